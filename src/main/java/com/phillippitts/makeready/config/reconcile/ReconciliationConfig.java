package com.phillippitts.makeready.config.reconcile;

import com.phillippitts.makeready.config.properties.ReportProperties;
import com.phillippitts.makeready.domain.ConflictStrategy;
import com.phillippitts.makeready.service.reconcile.AttributeReconciler;
import com.phillippitts.makeready.service.reconcile.AttributeReconcilers;
import com.phillippitts.makeready.service.reconcile.impl.HighlightDifferencesReconciler;
import com.phillippitts.makeready.service.reconcile.impl.PreferEngineeringReconciler;
import com.phillippitts.makeready.service.reconcile.impl.PreferSurveyReconciler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

@Configuration
public class ReconciliationConfig {

    @Bean
    public AttributeReconcilers attributeReconcilers(ReportProperties props) {
        List<AttributeReconciler> all = Arrays.stream(ConflictStrategy.values())
                .map(ReconciliationConfig::reconcilerFor)
                .toList();
        return new AttributeReconcilers(all, props.getAttributeStrategy());
    }

    static AttributeReconciler reconcilerFor(ConflictStrategy strategy) {
        return switch (strategy) {
            case PREFER_SURVEY -> new PreferSurveyReconciler();
            case PREFER_ENGINEERING -> new PreferEngineeringReconciler();
            case HIGHLIGHT_DIFFERENCES -> new HighlightDifferencesReconciler();
        };
    }
}
