package com.phillippitts.makeready.config.reconcile;

import com.phillippitts.makeready.config.properties.ReportProperties;
import com.phillippitts.makeready.domain.ConflictStrategy;
import com.phillippitts.makeready.service.reconcile.AttributeReconcilers;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReconciliationConfigTest {

    @Test
    void registersEveryStrategyWithConfiguredDefault() {
        ReportProperties props = new ReportProperties(ConflictStrategy.HIGHLIGHT_DIFFERENCES,
                ReportProperties.FailurePolicy.SKIP_AND_COLLECT);

        AttributeReconcilers reconcilers = new ReconciliationConfig().attributeReconcilers(props);

        assertThat(reconcilers.getDefaultStrategy()).isEqualTo(ConflictStrategy.HIGHLIGHT_DIFFERENCES);
        for (ConflictStrategy strategy : ConflictStrategy.values()) {
            assertThat(reconcilers.forStrategy(strategy).strategy()).isEqualTo(strategy);
        }
        assertThat(reconcilers.forStrategy(null).reconcile("a", "b")).isEqualTo("a (ENGINEERING: b)");
    }

    @Test
    void factoryCreatesMatchingReconciler() {
        assertThat(ReconciliationConfig.reconcilerFor(ConflictStrategy.PREFER_SURVEY).reconcile("s", "e"))
                .isEqualTo("s");
        assertThat(ReconciliationConfig.reconcilerFor(ConflictStrategy.PREFER_ENGINEERING).reconcile("s", "e"))
                .isEqualTo("e");
    }
}
