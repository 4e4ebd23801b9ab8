package com.phillippitts.makeready.service.attribute;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AttributeValueTest {

    @Test
    void scalarIsTrimmedText() {
        assertThat(AttributeValue.of(" 40 ").text()).isEqualTo("40");
        assertThat(AttributeValue.of(42).text()).isEqualTo("42");
        assertThat(AttributeValue.of("  ").text()).isNull();
    }

    @Test
    void nullAndEmptyArraysHaveNoValue() {
        assertThat(AttributeValue.of(null)).isNull();
        assertThat(AttributeValue.of(JSONObject.NULL)).isNull();
        assertThat(AttributeValue.of(new JSONArray())).isNull();
        assertThat(AttributeValue.of(new JSONArray("[\"first\",\"second\"]")).text()).isEqualTo("first");
    }

    @Test
    void wrapperPrefersImportedPayload() {
        AttributeValue value = AttributeValue.of(
                new JSONObject("{\"button_added\":\"field\",\"-Imported\":\"PL410620\"}"));

        assertThat(value.text()).isEqualTo("PL410620");
    }

    @Test
    void strictFindIgnoresUnlistedKeys() {
        AttributeValue value = AttributeValue.of(new JSONObject("{\"other\":\"x\"}"));

        assertThat(value.find(List.of("-Imported"), List.of())).isNull();
        assertThat(value.text()).isEqualTo("x");
    }

    @Test
    void nestedWrappersUseNestedKeys() {
        AttributeValue value = AttributeValue.of(
                new JSONObject("{\"assessment\":{\"tagtext\":\"410620\",\"other\":\"no\"}}"));

        assertThat(value.find(List.of("assessment"), List.of("tagtext"))).isEqualTo("410620");
    }

    @Test
    void textOfReadsMember() {
        JSONObject attributes = new JSONObject("{\"pole_owner\":{\"-Imported\":\"CPS Energy\"}}");

        assertThat(AttributeValue.textOf(attributes, "pole_owner")).isEqualTo("CPS Energy");
        assertThat(AttributeValue.textOf(attributes, "missing")).isNull();
    }
}
