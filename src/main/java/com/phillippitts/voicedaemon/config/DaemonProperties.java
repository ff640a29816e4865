package com.phillippitts.voicedaemon.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the daemon core: transport limits, session queues, cancellation and the
 * location of the local socket.
 *
 * <p>Example application.properties:
 * <pre>
 * daemon.max-frame-bytes=10485760
 * daemon.allow-foreign-stop=true
 * daemon.cancellation-timeout-ms=2000
 * daemon.session.queue-capacity=64
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "daemon")
public class DaemonProperties {

    /** Hard cap on one frame payload, inbound and outbound (bytes). */
    @Min(value = 1024, message = "max-frame-bytes must be at least 1024")
    private int maxFrameBytes = 10 * 1024 * 1024;

    /** Whether a session other than the recording owner may stop the recording. */
    private boolean allowForeignStop = true;

    /** Bound for a cancelled worker to release the engine before restart gives up (ms). */
    @Positive(message = "cancellation-timeout-ms must be positive")
    private long cancellationTimeoutMs = 2000;

    /** How long shutdown waits for outbound queues to drain (ms). */
    @Positive(message = "shutdown-flush-timeout-ms must be positive")
    private long shutdownFlushTimeoutMs = 1000;

    /** Explicit runtime directory; when blank, XDG_RUNTIME_DIR or the temp dir is used. */
    private String runtimeDir;

    @NotBlank
    private String socketName = "voicedaemon.sock";

    @NotBlank
    private String pidFileName = "voicedaemon.pid";

    @Valid
    private Session session = new Session();

    public int getMaxFrameBytes() {
        return maxFrameBytes;
    }

    public void setMaxFrameBytes(int maxFrameBytes) {
        this.maxFrameBytes = maxFrameBytes;
    }

    public boolean isAllowForeignStop() {
        return allowForeignStop;
    }

    public void setAllowForeignStop(boolean allowForeignStop) {
        this.allowForeignStop = allowForeignStop;
    }

    public long getCancellationTimeoutMs() {
        return cancellationTimeoutMs;
    }

    public void setCancellationTimeoutMs(long cancellationTimeoutMs) {
        this.cancellationTimeoutMs = cancellationTimeoutMs;
    }

    public long getShutdownFlushTimeoutMs() {
        return shutdownFlushTimeoutMs;
    }

    public void setShutdownFlushTimeoutMs(long shutdownFlushTimeoutMs) {
        this.shutdownFlushTimeoutMs = shutdownFlushTimeoutMs;
    }

    public String getRuntimeDir() {
        return runtimeDir;
    }

    public void setRuntimeDir(String runtimeDir) {
        this.runtimeDir = runtimeDir;
    }

    public String getSocketName() {
        return socketName;
    }

    public void setSocketName(String socketName) {
        this.socketName = socketName;
    }

    public String getPidFileName() {
        return pidFileName;
    }

    public void setPidFileName(String pidFileName) {
        this.pidFileName = pidFileName;
    }

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session;
    }

    /**
     * Per-session outbound queue limits.
     */
    public static class Session {

        /** Maximum queued outbound messages per session. */
        @Min(value = 1, message = "queue-capacity must be at least 1")
        private int queueCapacity = 64;

        /** Consecutive dropped events after which a stalled session is evicted. */
        @Min(value = 1, message = "max-consecutive-drops must be at least 1")
        private int maxConsecutiveDrops = 256;

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getMaxConsecutiveDrops() {
            return maxConsecutiveDrops;
        }

        public void setMaxConsecutiveDrops(int maxConsecutiveDrops) {
            this.maxConsecutiveDrops = maxConsecutiveDrops;
        }
    }
}
