package com.phillippitts.makeready.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe facade over {@link ReportMetrics} used by the report pipeline.
 *
 * <p>Every method is a no-op when constructed without metrics, so the pipeline can be built by
 * hand in tests.
 */
@Component
public final class ReportMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(ReportMetricsPublisher.class);

    public static final String PROCESSED = "processed";
    public static final String FAILED = "failed";

    /** Publisher that records nothing. */
    public static final ReportMetricsPublisher NOOP = new ReportMetricsPublisher(null);

    private final ReportMetrics metrics;

    /**
     * @param metrics metrics service (nullable)
     */
    public ReportMetricsPublisher(ReportMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("ReportMetricsPublisher created without metrics");
        }
    }

    public void recordBatch(String strategy, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(strategy, durationNanos);
    }

    public void recordPoleProcessed() {
        if (metrics != null) {
            metrics.incrementPoles(PROCESSED);
        }
    }

    public void recordPoleFailed() {
        if (metrics != null) {
            metrics.incrementPoles(FAILED);
        }
    }

    public void recordNeutralMissing() {
        if (metrics != null) {
            metrics.incrementNeutralMissing();
        }
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
