package com.phillippitts.voicedaemon.config;

import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    private final ThreadPoolProperties properties = new ThreadPoolProperties();
    private final ThreadPoolConfig config = new ThreadPoolConfig(properties);

    @AfterEach
    void clearContext() {
        ThreadContext.clearAll();
    }

    @Test
    void controlExecutorIsSingleThreaded() {
        ThreadPoolTaskExecutor executor = config.controlExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(1);
            assertThat(executor.getMaxPoolSize()).isEqualTo(1);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("daemon-control-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void refusesWiderControlPool() {
        properties.getControl().setMaxPoolSize(2);

        assertThatThrownBy(config::controlExecutor)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("exactly one thread");
    }

    @Test
    void workerThreadsCarryConfiguredPrefix() throws InterruptedException {
        ThreadPoolTaskExecutor executor = config.sttExecutor();
        AtomicReference<String> name = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);
        try {
            executor.execute(() -> {
                name.set(Thread.currentThread().getName());
                latch.countDown();
            });

            assertThat(latch.await(1, TimeUnit.SECONDS)).isTrue();
            assertThat(name.get()).startsWith("stt-worker-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void propagatesLoggingContextToWorkers() throws InterruptedException {
        ThreadPoolTaskExecutor executor = config.llmExecutor();
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);
        try {
            ThreadContext.put("sessionId", "abc");
            executor.execute(() -> {
                seen.set(ThreadContext.get("sessionId"));
                latch.countDown();
            });

            assertThat(latch.await(1, TimeUnit.SECONDS)).isTrue();
            assertThat(seen.get()).isEqualTo("abc");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void decoratorRestoresWorkerContext() {
        ThreadContext.put("sessionId", "submitter");
        Runnable decorated = ThreadPoolConfig.mdcPropagating().decorate(
                () -> assertThat(ThreadContext.get("sessionId")).isEqualTo("submitter"));

        ThreadContext.clearAll();
        ThreadContext.put("worker", "yes");
        decorated.run();

        assertThat(ThreadContext.get("sessionId")).isNull();
        assertThat(ThreadContext.get("worker")).isEqualTo("yes");
    }
}
