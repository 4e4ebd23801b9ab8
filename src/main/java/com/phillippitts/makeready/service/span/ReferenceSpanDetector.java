package com.phillippitts.makeready.service.span;

import com.phillippitts.makeready.util.JsonTrees;
import org.json.JSONObject;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether a survey connection is flagged as a reference span.
 *
 * <p>Checked in order, first match wins: {@code connection_type.button_added == "reference"},
 * {@code button_added == "reference"}, a {@code reference} attribute that is {@code true} or
 * {@code "true"}, then a span classification attribute whose text mentions "reference".
 */
public final class ReferenceSpanDetector {

    private static final String REFERENCE = "reference";
    private static final List<String> CLASSIFICATION_ATTRIBUTES =
            List.of("span_type", "spanType", "connection_classification", "span_classification");

    private ReferenceSpanDetector() {}

    public static boolean isReference(JSONObject connection) {
        JSONObject attributes = JsonTrees.object(connection, "attributes");

        JSONObject connectionType = attributes.optJSONObject("connection_type");
        if (connectionType != null && REFERENCE.equals(JsonTrees.text(connectionType, "button_added"))) {
            return true;
        }
        if (REFERENCE.equals(JsonTrees.text(attributes, "button_added"))) {
            return true;
        }
        Object flag = JsonTrees.value(attributes, "reference");
        if (Boolean.TRUE.equals(flag) || (flag instanceof String text && "true".equalsIgnoreCase(text.trim()))) {
            return true;
        }
        for (String name : CLASSIFICATION_ATTRIBUTES) {
            Object raw = JsonTrees.value(attributes, name);
            if (!JsonTrees.truthy(raw)) {
                continue;
            }
            Object classification = raw;
            if (raw instanceof JSONObject wrapper) {
                List<String> keys = JsonTrees.sortedKeys(wrapper);
                classification = keys.isEmpty() ? null : JsonTrees.value(wrapper, keys.get(0));
            }
            if (classification instanceof String text && text.toLowerCase(Locale.ROOT).contains(REFERENCE)) {
                return true;
            }
        }
        return false;
    }
}
