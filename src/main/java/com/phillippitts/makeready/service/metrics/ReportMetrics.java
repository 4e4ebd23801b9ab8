package com.phillippitts.makeready.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation of report batches.
 *
 * <p>Meters:
 * <ul>
 *   <li>{@code makeready.report.latency} - batch duration, tagged with the attribute strategy</li>
 *   <li>{@code makeready.report.poles} - poles built, tagged {@code outcome=processed|failed}</li>
 *   <li>{@code makeready.report.neutral.missing} - poles reported without a neutral</li>
 * </ul>
 */
@Component
public class ReportMetrics {

    static final String METRIC_PREFIX = "makeready.report";

    private final MeterRegistry registry;

    public ReportMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordLatency(String strategy, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to build a make-ready report")
                .tag("strategy", strategy)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param outcome {@code processed} or {@code failed}
     */
    public void incrementPoles(String outcome) {
        Counter.builder(METRIC_PREFIX + ".poles")
                .description("Number of poles processed")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementNeutralMissing() {
        Counter.builder(METRIC_PREFIX + ".neutral.missing")
                .description("Number of poles without an identifiable neutral")
                .register(registry)
                .increment();
    }
}
