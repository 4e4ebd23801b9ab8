package com.phillippitts.makeready.service.attribute;

import com.phillippitts.makeready.TestResourceLoader;
import com.phillippitts.makeready.domain.ConflictStrategy;
import com.phillippitts.makeready.domain.PoleAttributes;
import com.phillippitts.makeready.service.reconcile.AttributeReconcilers;
import com.phillippitts.makeready.service.reconcile.impl.HighlightDifferencesReconciler;
import com.phillippitts.makeready.service.reconcile.impl.PreferEngineeringReconciler;
import com.phillippitts.makeready.service.reconcile.impl.PreferSurveyReconciler;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PoleAttributeResolverTest {

    private PoleAttributeResolver resolver;
    private JSONObject survey;
    private JSONObject engineering;

    @BeforeEach
    void setUp() throws Exception {
        resolver = new PoleAttributeResolver(new AttributeReconcilers(
                List.of(new PreferSurveyReconciler(), new PreferEngineeringReconciler(),
                        new HighlightDifferencesReconciler()),
                ConflictStrategy.PREFER_ENGINEERING));
        survey = TestResourceLoader.loadJson("/fixtures/survey-basic.json");
        engineering = TestResourceLoader.loadJson("/fixtures/engineering-basic.json");
    }

    @Test
    void mergesBothSources() {
        PoleAttributes attributes = resolver.resolve(node("n1"), location(0), engineering, null);

        assertThat(attributes.poleNumber()).isEqualTo("PL410620");
        assertThat(attributes.normalizedPoleNumber()).isEqualTo("410620");
        assertThat(attributes.owner()).isEqualTo("CPS Energy");
        assertThat(attributes.structure()).isEqualTo("40-4 Southern Pine");
        assertThat(attributes.constructionGrade()).isEqualTo("C");
        assertThat(attributes.plaPercentage()).isEqualTo("42.50%");
        assertThat(attributes.notes()).isEqualTo("Lower PROVIDER fiber 10 in");
        assertThat(attributes.passingCapacity()).isEqualTo(92.5);
        assertThat(attributes.latitude()).isEqualTo(29.4);
    }

    @Test
    void surveyOnlyPoleKeepsSurveyValues() {
        PoleAttributes attributes = resolver.resolve(node("n1"), null, null, ConflictStrategy.PREFER_SURVEY);

        assertThat(attributes.structure()).isEqualTo("40-4 Southern Pine");
        assertThat(attributes.constructionGrade()).isNull();
        assertThat(attributes.plaPercentage()).isNull();
    }

    @Test
    void conflictingStructureFollowsStrategy() {
        JSONObject location = location(0);
        location.getJSONObject("poleTags").put("height", 45).put("class", "3");

        assertThat(resolver.resolve(node("n1"), location, engineering, ConflictStrategy.PREFER_SURVEY).structure())
                .isEqualTo("40-4 Southern Pine");
        assertThat(resolver.resolve(node("n1"), location, engineering, null).structure())
                .isEqualTo("45-3 Southern Pine");
        assertThat(resolver.resolve(node("n1"), location, engineering, ConflictStrategy.HIGHLIGHT_DIFFERENCES)
                .structure()).isEqualTo("40-4 Southern Pine (ENGINEERING: 45-3 Southern Pine)");
    }

    @Test
    void engineeringStructureFallsBackToAlias() {
        JSONObject location = new JSONObject("{\"label\":\"PL1\",\"aliases\":[{\"id\":\"35-5\"}]}");

        assertThat(EngineeringAttributeExtractor.structure(location)).isEqualTo("35-5");
        assertThat(EngineeringAttributeExtractor.structure(new JSONObject())).isNull();
    }

    private JSONObject node(String nodeId) {
        return survey.getJSONObject("nodes").getJSONObject(nodeId);
    }

    private JSONObject location(int index) {
        return engineering.getJSONArray("leads").getJSONObject(0).getJSONArray("locations").getJSONObject(index);
    }
}
