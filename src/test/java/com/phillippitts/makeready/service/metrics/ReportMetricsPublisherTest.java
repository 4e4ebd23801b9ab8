package com.phillippitts.makeready.service.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

class ReportMetricsPublisherTest {

    @Test
    void noopPublisherIgnoresEverything() {
        assertThat(ReportMetricsPublisher.NOOP.isEnabled()).isFalse();
        assertThatCode(() -> {
            ReportMetricsPublisher.NOOP.recordBatch("PREFER_SURVEY", 10L);
            ReportMetricsPublisher.NOOP.recordPoleProcessed();
            ReportMetricsPublisher.NOOP.recordPoleFailed();
            ReportMetricsPublisher.NOOP.recordNeutralMissing();
        }).doesNotThrowAnyException();
    }

    @Test
    void delegatesToMetrics() {
        ReportMetrics metrics = mock(ReportMetrics.class);
        ReportMetricsPublisher publisher = new ReportMetricsPublisher(metrics);

        publisher.recordBatch("HIGHLIGHT_DIFFERENCES", 5L);
        publisher.recordPoleProcessed();
        publisher.recordPoleFailed();
        publisher.recordNeutralMissing();

        verify(metrics).recordLatency("HIGHLIGHT_DIFFERENCES", 5L);
        verify(metrics).incrementPoles(ReportMetricsPublisher.PROCESSED);
        verify(metrics).incrementPoles(ReportMetricsPublisher.FAILED);
        verify(metrics).incrementNeutralMissing();
        verifyNoMoreInteractions(metrics);
    }

    @Test
    void realRegistryIsEnabled() {
        assertThat(new ReportMetricsPublisher(new ReportMetrics(new SimpleMeterRegistry())).isEnabled()).isTrue();
    }
}
