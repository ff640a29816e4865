package com.phillippitts.voicedaemon.config;

import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors of the daemon.
 *
 * <ul>
 *   <li>{@code controlExecutor} - the single control thread that owns the state machine</li>
 *   <li>{@code sttExecutor} - transcription workers</li>
 *   <li>{@code llmExecutor} - refinement loops and their bounded provider attempts</li>
 *   <li>{@code lifecycleExecutor} - engine restarts and shutdown sequencing</li>
 * </ul>
 *
 * <p>Rejection policy is {@link ThreadPoolExecutor.AbortPolicy} everywhere: a task submitted
 * from the control thread must never run on it.
 *
 * <p>MDC propagation: every executor copies the Log4j2 ThreadContext of the submitting thread
 * so worker logs keep the session and command that started them.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    @Bean(name = "controlExecutor")
    public ThreadPoolTaskExecutor controlExecutor() {
        ThreadPoolProperties.PoolProperties props = threadPoolProperties.getControl();
        if (props.getCorePoolSize() != 1 || props.getMaxPoolSize() != 1) {
            throw new IllegalStateException("threadpool.control must have exactly one thread");
        }
        return build(props);
    }

    @Bean(name = "sttExecutor")
    public ThreadPoolTaskExecutor sttExecutor() {
        return build(threadPoolProperties.getStt());
    }

    @Bean(name = "llmExecutor")
    public ThreadPoolTaskExecutor llmExecutor() {
        return build(threadPoolProperties.getLlm());
    }

    @Bean(name = "lifecycleExecutor")
    public ThreadPoolTaskExecutor lifecycleExecutor() {
        return build(threadPoolProperties.getLifecycle());
    }

    static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
