package com.phillippitts.selfspy.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Centralized metrics for capture and persistence.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Flush latency and outcome (success, retry, discarded)</li>
 *   <li>Records persisted per flush</li>
 *   <li>Events dropped at the buffer hard cap</li>
 *   <li>Current buffer size</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer under the {@code selfspy} prefix.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class ActivityMetrics {

    private static final String METRIC_PREFIX = "selfspy";

    private final MeterRegistry registry;

    public ActivityMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the duration of one flush, all attempts included.
     *
     * @param durationNanos duration in nanoseconds
     * @param outcome success or discarded
     */
    public void recordFlushLatency(long durationNanos, String outcome) {
        Timer.builder(METRIC_PREFIX + ".flush.latency")
                .description("Time taken to persist a drained snapshot")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts records written by a successful flush.
     */
    public void incrementPersisted(int records) {
        Counter.builder(METRIC_PREFIX + ".flush.records")
                .description("Number of records persisted")
                .register(registry)
                .increment(records);
    }

    /**
     * Increments the failed-attempt counter.
     *
     * @param reason short failure class (timeout, unavailable, error)
     */
    public void incrementFlushFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".flush.failure")
                .description("Number of failed flush attempts")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Counts records lost because a snapshot was discarded after all retries.
     */
    public void incrementDiscarded(int records) {
        Counter.builder(METRIC_PREFIX + ".flush.discarded")
                .description("Number of records discarded after exhausting retries")
                .register(registry)
                .increment(records);
    }

    public void incrementDropped() {
        Counter.builder(METRIC_PREFIX + ".buffer.dropped")
                .description("Number of events dropped at the buffer hard cap")
                .register(registry)
                .increment();
    }

    /**
     * Exposes the live buffer size as a gauge.
     */
    public void registerBufferSize(Supplier<Number> size) {
        Gauge.builder(METRIC_PREFIX + ".buffer.size", size)
                .description("Items currently buffered")
                .register(registry);
    }
}
