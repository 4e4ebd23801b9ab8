package com.phillippitts.makeready.service.survey;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PoleLabelResolverTest {

    private static final JSONObject SURVEY = new JSONObject("{\"nodes\":{"
            + "\"pole1\":{\"button\":\"aerial\",\"attributes\":{\"PoleNumber\":{\"-Imported\":\"PL410620\"}}},"
            + "\"pole2\":{\"attributes\":{\"node_type\":{\"-Imported\":\"pole\"},"
            + "\"pl_number\":{\"assessment\":{\"tagtext\":\"PL55\"}}}},"
            + "\"ref1\":{\"attributes\":{\"node_type\":{\"button_added\":\"reference\"},\"scid\":\"SC-7\"}},"
            + "\"anchor9999\":{\"attributes\":{\"node_type\":\"anchor\"}},"
            + "\"misc\":{\"attributes\":{}}}}");

    @Test
    void recognizesPoleNodes() {
        assertThat(PoleLabelResolver.isPoleNode(node("pole1"))).isTrue();
        assertThat(PoleLabelResolver.isPoleNode(node("pole2"))).isTrue();
        assertThat(PoleLabelResolver.isPoleNode(node("ref1"))).isFalse();
        assertThat(PoleLabelResolver.isPoleNode(null)).isFalse();
    }

    @Test
    void readsPoleNumberFromWrappers() {
        assertThat(PoleLabelResolver.poleNumber(node("pole1"))).isEqualTo("PL410620");
        assertThat(PoleLabelResolver.poleNumber(node("pole2"))).isEqualTo("PL55");
        assertThat(PoleLabelResolver.poleNumber(node("misc"))).isNull();
    }

    @Test
    void synthesizesLabelsForNonPoles() {
        assertThat(PoleLabelResolver.label(SURVEY, "pole1")).isEqualTo("PL410620");
        assertThat(PoleLabelResolver.label(SURVEY, "ref1")).isEqualTo("Reference-SC-7");
        assertThat(PoleLabelResolver.label(SURVEY, "anchor9999")).isEqualTo("Anchor-anchor");
        assertThat(PoleLabelResolver.label(SURVEY, "misc")).isEqualTo("Node-misc");
    }

    private static JSONObject node(String id) {
        return SURVEY.getJSONObject("nodes").getJSONObject(id);
    }
}
