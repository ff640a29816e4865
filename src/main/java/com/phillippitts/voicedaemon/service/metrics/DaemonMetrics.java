package com.phillippitts.voicedaemon.service.metrics;

import com.phillippitts.voicedaemon.domain.CommandKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Centralized Micrometer instrumentation of the daemon.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>commands handled, per kind</li>
 *   <li>state transitions, per event name</li>
 *   <li>transcription and refinement latency and failures</li>
 *   <li>broadcast backpressure (dropped events, evicted sessions)</li>
 * </ul>
 *
 * <p>{@link #summary()} reads the same meters back for {@code GET_STATUS}, together with the
 * process and JVM gauges Spring Boot binds to the registry ({@code process.cpu.usage},
 * {@code jvm.memory.used} and friends). Gauges that are not registered or report NaN are left out.
 */
@Component
public class DaemonMetrics {

    private static final String METRIC_PREFIX = "voicedaemon";
    private static final double MEGABYTE = 1024.0 * 1024.0;

    private final MeterRegistry registry;

    public DaemonMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCommand(CommandKind kind) {
        Counter.builder(METRIC_PREFIX + ".commands")
                .description("Commands handled by the dispatcher")
                .tag("kind", kind.name())
                .register(registry)
                .increment();
    }

    public void recordTransition(String event) {
        Counter.builder(METRIC_PREFIX + ".transitions")
                .description("State machine transitions")
                .tag("event", event)
                .register(registry)
                .increment();
    }

    /**
     * Records one finished transcription pass.
     *
     * @param durationNanos duration in nanoseconds
     * @param success whether the pass produced a transcript
     */
    public void recordTranscription(long durationNanos, boolean success) {
        Timer.builder(METRIC_PREFIX + ".transcription.latency")
                .description("Time taken to transcribe one recording")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        if (!success) {
            Counter.builder(METRIC_PREFIX + ".transcription.failure")
                    .description("Transcriptions that failed after retry")
                    .register(registry)
                    .increment();
        }
    }

    public void recordRefinement(long durationNanos, boolean success) {
        Timer.builder(METRIC_PREFIX + ".refinement.latency")
                .description("Time taken by one refinement including retries")
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void refinementRetry() {
        Counter.builder(METRIC_PREFIX + ".refinement.retries")
                .description("Provider attempts that failed and were retried")
                .register(registry)
                .increment();
    }

    public void eventDropped() {
        Counter.builder(METRIC_PREFIX + ".broadcast.dropped")
                .description("State events dropped from full session queues")
                .register(registry)
                .increment();
    }

    public void sessionEvicted() {
        Counter.builder(METRIC_PREFIX + ".sessions.evicted")
                .description("Sessions evicted for not draining their queue")
                .register(registry)
                .increment();
    }

    /**
     * Snapshot of the counters for status responses.
     */
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("commands_total", counterSum(".commands"));
        summary.put("transitions_total", counterSum(".transitions"));
        summary.put("transcriptions_total", timerCount(".transcription.latency"));
        summary.put("transcription_failures", counterSum(".transcription.failure"));
        summary.put("transcription_mean_ms", timerMeanMillis(".transcription.latency"));
        summary.put("refinements_total", timerCount(".refinement.latency"));
        summary.put("refinement_retries", counterSum(".refinement.retries"));
        summary.put("events_dropped", counterSum(".broadcast.dropped"));
        summary.put("sessions_evicted", counterSum(".sessions.evicted"));
        summary.put("system", systemSummary());
        return summary;
    }

    private Map<String, Object> systemSummary() {
        Map<String, Object> cpu = new LinkedHashMap<>();
        putGauge(cpu, "process_percent", gaugeSum("process.cpu.usage", null) * 100.0);
        putGauge(cpu, "system_percent", gaugeSum("system.cpu.usage", null) * 100.0);
        putGauge(cpu, "cores", gaugeSum("system.cpu.count", null));

        Map<String, Object> memory = new LinkedHashMap<>();
        putGauge(memory, "heap_used_mb", gaugeSum("jvm.memory.used", "heap") / MEGABYTE);
        putGauge(memory, "heap_committed_mb", gaugeSum("jvm.memory.committed", "heap") / MEGABYTE);
        putGauge(memory, "heap_max_mb", gaugeSum("jvm.memory.max", "heap") / MEGABYTE);

        Map<String, Object> system = new LinkedHashMap<>();
        system.put("cpu", cpu);
        system.put("memory", memory);
        putGauge(system, "threads_live", gaugeSum("jvm.threads.live", null));
        return system;
    }

    private double gaugeSum(String name, String area) {
        var search = registry.find(name);
        if (area != null) {
            search = search.tag("area", area);
        }
        var gauges = search.gauges();
        if (gauges.isEmpty()) {
            return Double.NaN;
        }
        // jvm.memory.max reports -1 for pools without a limit
        return gauges.stream().mapToDouble(Gauge::value).filter(v -> v >= 0).sum();
    }

    private static void putGauge(Map<String, Object> target, String key, double value) {
        if (Double.isFinite(value)) {
            target.put(key, Math.round(value * 10.0) / 10.0);
        }
    }

    private long counterSum(String suffix) {
        return (long) registry.find(METRIC_PREFIX + suffix).counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    private long timerCount(String suffix) {
        return registry.find(METRIC_PREFIX + suffix).timers().stream()
                .mapToLong(Timer::count)
                .sum();
    }

    private long timerMeanMillis(String suffix) {
        return (long) registry.find(METRIC_PREFIX + suffix).timers().stream()
                .mapToDouble(t -> t.mean(TimeUnit.MILLISECONDS))
                .average()
                .orElse(0.0);
    }
}
