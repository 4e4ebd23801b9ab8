package com.phillippitts.makeready.service.reconcile;

import com.phillippitts.makeready.domain.ConflictStrategy;
import com.phillippitts.makeready.service.reconcile.impl.HighlightDifferencesReconciler;
import com.phillippitts.makeready.service.reconcile.impl.PreferEngineeringReconciler;
import com.phillippitts.makeready.service.reconcile.impl.PreferSurveyReconciler;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconcilerStrategiesTest {

    private final AttributeReconciler preferSurvey = new PreferSurveyReconciler();
    private final AttributeReconciler preferEngineering = new PreferEngineeringReconciler();
    private final AttributeReconciler highlight = new HighlightDifferencesReconciler();

    @Test
    void conflictsResolvePerStrategy() {
        assertThat(preferSurvey.reconcile("40-4 Southern Pine", "45-3 Southern Pine"))
                .isEqualTo("40-4 Southern Pine");
        assertThat(preferEngineering.reconcile("40-4 Southern Pine", "45-3 Southern Pine"))
                .isEqualTo("45-3 Southern Pine");
        assertThat(highlight.reconcile("40-4 Southern Pine", "45-3 Southern Pine"))
                .isEqualTo("40-4 Southern Pine (ENGINEERING: 45-3 Southern Pine)");
    }

    @Test
    void singleSourceValueIsNeverAConflict() {
        for (AttributeReconciler reconciler : List.of(preferSurvey, preferEngineering, highlight)) {
            assertThat(reconciler.reconcile(null, "C")).isEqualTo("C");
            assertThat(reconciler.reconcile("  B ", "")).isEqualTo("B");
            assertThat(reconciler.reconcile(null, "  ")).isNull();
        }
    }

    @Test
    void caseInsensitiveMatchKeepsSurveyValue() {
        assertThat(preferEngineering.reconcile("CPS Energy", "cps energy ")).isEqualTo("CPS Energy");
        assertThat(highlight.reconcile("CPS Energy", "CPS ENERGY")).isEqualTo("CPS Energy");
    }

    @Test
    void registryFallsBackToDefaultStrategy() {
        AttributeReconcilers reconcilers = new AttributeReconcilers(
                List.of(preferSurvey, preferEngineering, highlight), ConflictStrategy.PREFER_ENGINEERING);

        assertThat(reconcilers.forStrategy(null).strategy()).isEqualTo(ConflictStrategy.PREFER_ENGINEERING);
        assertThat(reconcilers.forStrategy(ConflictStrategy.HIGHLIGHT_DIFFERENCES)).isSameAs(highlight);
        assertThat(reconcilers.getDefaultStrategy()).isEqualTo(ConflictStrategy.PREFER_ENGINEERING);
    }

    @Test
    void registryRequiresEveryStrategy() {
        assertThatThrownBy(() -> new AttributeReconcilers(List.of(preferSurvey), ConflictStrategy.PREFER_SURVEY))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No reconciler registered");
    }
}
