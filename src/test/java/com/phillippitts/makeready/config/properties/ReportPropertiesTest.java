package com.phillippitts.makeready.config.properties;

import com.phillippitts.makeready.domain.ConflictStrategy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportPropertiesTest {

    @Test
    void nullsFallBackToDefaults() {
        ReportProperties props = new ReportProperties(null, null, null, null, null, null);

        assertThat(props.getAttributeStrategy()).isEqualTo(ConflictStrategy.PREFER_ENGINEERING);
        assertThat(props.getHeightStrategy()).isEqualTo(ConflictStrategy.PREFER_ENGINEERING);
        assertThat(props.getFailurePolicy()).isEqualTo(ReportProperties.FailurePolicy.SKIP_AND_COLLECT);
        assertThat(props.getNeutralMatchToleranceInches()).isEqualTo(5.0);
        assertThat(props.getHeightChangeToleranceInches()).isEqualTo(0.1);
        assertThat(props.getPassingCapacityThreshold()).isEqualTo(85.0);
    }

    @Test
    void shortConstructorKeepsStrategyAndPolicy() {
        ReportProperties props = new ReportProperties(ConflictStrategy.PREFER_SURVEY,
                ReportProperties.FailurePolicy.ABORT_BATCH);

        assertThat(props.getAttributeStrategy()).isEqualTo(ConflictStrategy.PREFER_SURVEY);
        assertThat(props.getFailurePolicy()).isEqualTo(ReportProperties.FailurePolicy.ABORT_BATCH);
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> new ReportProperties(null, null, null, 25.0, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("neutral-match-tolerance-inches");
        assertThatThrownBy(() -> new ReportProperties(null, null, null, null, -1.0, null))
                .hasMessageContaining("height-change-tolerance-inches");
        assertThatThrownBy(() -> new ReportProperties(null, null, null, null, null, 101.0))
                .hasMessageContaining("passing-capacity-threshold");
    }
}
