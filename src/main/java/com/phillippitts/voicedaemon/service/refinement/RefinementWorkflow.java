package com.phillippitts.voicedaemon.service.refinement;

import com.phillippitts.voicedaemon.config.RefinementProperties;
import com.phillippitts.voicedaemon.config.RuntimeSettings;
import com.phillippitts.voicedaemon.domain.RefinementRequest;
import com.phillippitts.voicedaemon.exception.RefinementException;
import com.phillippitts.voicedaemon.service.metrics.DaemonMetrics;
import com.phillippitts.voicedaemon.util.LogSanitizer;
import com.phillippitts.voicedaemon.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Refines or translates text through the configured {@link LlmProvider} on the
 * {@code llm-worker} pool.
 *
 * <p>Each attempt is bounded by {@code refinement.request-timeout-ms}; failed attempts are retried
 * with exponential backoff up to {@code refinement.retry-attempts}. Exhaustion yields a
 * {@link RefinementException} carrying the original, unmodified text.
 */
@Component
public class RefinementWorkflow {

    private static final Logger LOG = LogManager.getLogger(RefinementWorkflow.class);

    private final AsyncTaskExecutor executor;
    private final Map<String, LlmProvider> providers;
    private final RuntimeSettings settings;
    private final RefinementProperties properties;
    private final DaemonMetrics metrics;

    public RefinementWorkflow(@Qualifier("llmExecutor") AsyncTaskExecutor executor,
                              List<LlmProvider> providers,
                              RuntimeSettings settings,
                              RefinementProperties properties,
                              DaemonMetrics metrics) {
        this.executor = executor;
        this.providers = providers.stream().collect(Collectors.toMap(LlmProvider::name, Function.identity()));
        this.settings = settings;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Starts the retry loop. Never blocks the caller.
     */
    public RefinementTask submit(String text, RefinementRequest request) {
        RefinementTask task = new RefinementTask();
        LlmProvider provider = providers.get(settings.provider());
        if (provider == null) {
            task.fail(new RefinementException("No LLM provider named '" + settings.provider() + "'", text, 0, null));
            return task;
        }
        try {
            task.attach(executor.submit(() -> run(task, provider, text, request)));
        } catch (TaskRejectedException e) {
            task.fail(new RefinementException("LLM worker pool is saturated", text, 0, e));
        }
        return task;
    }

    private void run(RefinementTask task, LlmProvider provider, String text, RefinementRequest request) {
        long start = System.nanoTime();
        LOG.debug("Refining {} with {}", LogSanitizer.preview(text), provider.name());
        try {
            String refined = refineWithRetry(task, provider, text, request);
            metrics.recordRefinement(System.nanoTime() - start, true);
            LOG.info("Refinement completed by {} in {} ms ({} chars)", provider.name(),
                    TimeUtils.elapsedMillis(start), refined.length());
            task.complete(refined);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Refinement cancelled");
        } catch (RefinementException e) {
            metrics.recordRefinement(System.nanoTime() - start, false);
            LOG.warn("Refinement failed: {}", e.getMessage());
            task.fail(e);
        }
    }

    private String refineWithRetry(RefinementTask task, LlmProvider provider, String text,
                                   RefinementRequest request) throws InterruptedException {
        int maxAttempts = properties.getRetryAttempts();
        Throwable lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (task.isCancelled()) {
                throw new InterruptedException("Refinement cancelled");
            }
            try {
                return attempt(provider, text, request);
            } catch (ExecutionException e) {
                lastFailure = e.getCause() != null ? e.getCause() : e;
            } catch (TimeoutException e) {
                lastFailure = new TimeoutException("No answer within " + properties.getRequestTimeoutMs() + " ms");
            } catch (TaskRejectedException e) {
                lastFailure = e;
            }
            if (attempt < maxAttempts) {
                long wait = backoffMillis(attempt, properties.getRetryMinWaitMs(), properties.getRetryMaxWaitMs());
                metrics.refinementRetry();
                LOG.warn("Refinement attempt {}/{} with {} failed, retrying in {} ms: {}",
                        attempt, maxAttempts, provider.name(), wait, lastFailure.getMessage());
                TimeUnit.MILLISECONDS.sleep(wait);
            }
        }
        throw new RefinementException("Refinement failed after " + maxAttempts + " attempts: "
                + lastFailure.getMessage(), text, maxAttempts, lastFailure);
    }

    private String attempt(LlmProvider provider, String text, RefinementRequest request)
            throws InterruptedException, ExecutionException, TimeoutException {
        Future<String> call = executor.submit(() -> provider.refine(text, request));
        try {
            return call.get(properties.getRequestTimeoutMs(), TimeUnit.MILLISECONDS);
        } finally {
            call.cancel(true);
        }
    }

    /**
     * Wait before the retry following failed attempt {@code attempt} (1-based):
     * {@code min(minWait * 2^(attempt-1), maxWait)}.
     */
    static long backoffMillis(int attempt, long minWaitMs, long maxWaitMs) {
        int shift = Math.min(Math.max(attempt - 1, 0), 30);
        long wait = minWaitMs << shift;
        return wait < 0 ? maxWaitMs : Math.min(wait, maxWaitMs);
    }
}
