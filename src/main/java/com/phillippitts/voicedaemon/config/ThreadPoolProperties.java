package com.phillippitts.voicedaemon.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the daemon's executors.
 *
 * <p>The control pool must stay at exactly one thread: it is the single writer of daemon state.
 * The stt pool defaults to one thread because the speech engine is exclusive.
 */
@Validated
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    @Valid
    @NotNull
    private PoolProperties control = new PoolProperties(1, 1, Integer.MAX_VALUE, "daemon-control-");
    @Valid
    @NotNull
    private PoolProperties stt = new PoolProperties(1, 1, 4, "stt-worker-");
    @Valid
    @NotNull
    private PoolProperties llm = new PoolProperties(2, 4, 0, "llm-worker-");
    @Valid
    @NotNull
    private PoolProperties lifecycle = new PoolProperties(1, 1, 4, "lifecycle-");

    public PoolProperties getControl() {
        return control;
    }

    public void setControl(PoolProperties control) {
        this.control = control;
    }

    public PoolProperties getStt() {
        return stt;
    }

    public void setStt(PoolProperties stt) {
        this.stt = stt;
    }

    public PoolProperties getLlm() {
        return llm;
    }

    public void setLlm(PoolProperties llm) {
        this.llm = llm;
    }

    public PoolProperties getLifecycle() {
        return lifecycle;
    }

    public void setLifecycle(PoolProperties lifecycle) {
        this.lifecycle = lifecycle;
    }

    /**
     * Sizing of one executor. A queue capacity of 0 means direct hand-off.
     */
    public static class PoolProperties {
        @Min(value = 1, message = "core-pool-size must be at least 1")
        private int corePoolSize;
        @Min(value = 1, message = "max-pool-size must be at least 1")
        private int maxPoolSize;
        @Min(0)
        private int queueCapacity;
        @Min(0)
        private int keepAliveSeconds = 60;
        @Min(0)
        private int awaitTerminationSeconds = 5;
        @NotBlank
        private String threadNamePrefix;

        public PoolProperties() {
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public int getAwaitTerminationSeconds() {
            return awaitTerminationSeconds;
        }

        public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
            this.awaitTerminationSeconds = awaitTerminationSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
