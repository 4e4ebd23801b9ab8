package com.phillippitts.makeready.service.survey;

import com.phillippitts.makeready.service.attribute.AttributeValue;
import com.phillippitts.makeready.service.attribute.AttributeValues;
import com.phillippitts.makeready.util.JsonTrees;
import com.phillippitts.makeready.util.PoleIds;
import org.json.JSONObject;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Pole numbers and display labels of survey nodes.
 */
public final class PoleLabelResolver {

    static final List<String> POLE_NUMBER_ATTRIBUTES = List.of(
            "PoleNumber", "pl_number", "dloc_number", "PL_number", "DLOC_number", "pole_tag", "electric_pole_tag");

    static final List<String> POLE_NUMBER_KEYS = List.of("-Imported", "assessment", "button_added", "tagtext");

    private static final List<String> TAG_TEXT = List.of("tagtext");
    private static final List<String> REFERENCE_NAME_ATTRIBUTES =
            List.of("name", "label", "scid", "reference_name", "description");
    private static final Set<String> REFERENCE_NODE_TYPES = Set.of("reference", "service", "anchor");
    private static final Set<String> POLE_BUTTONS = Set.of("aerial", "pole", "aerial_path");

    private PoleLabelResolver() {}

    /**
     * A node is a pole when its {@code button} is a pole button or its {@code node_type} is
     * {@code pole}.
     */
    public static boolean isPoleNode(JSONObject node) {
        if (node == null) {
            return false;
        }
        if (POLE_BUTTONS.contains(JsonTrees.text(node, "button", ""))) {
            return true;
        }
        AttributeValue nodeType = AttributeValue.of(JsonTrees.value(JsonTrees.object(node, "attributes"), "node_type"));
        String type = nodeType == null ? null : nodeType.find(List.of("-Imported", "button_added"), List.of());
        return "pole".equals(type);
    }

    /**
     * Pole number of a node from the first pole-number attribute that carries one.
     *
     * @return the label as found, or null
     */
    public static String poleNumber(JSONObject node) {
        JSONObject attributes = JsonTrees.object(node, "attributes");
        return AttributeValues.find(attributes, POLE_NUMBER_ATTRIBUTES, POLE_NUMBER_KEYS, TAG_TEXT);
    }

    /**
     * Label of the node at the far end of a span. Falls back to a synthesized descriptive label
     * for reference, service and anchor nodes, then to {@code Node-<shortId>}.
     */
    public static String label(JSONObject survey, String nodeId) {
        JSONObject node = JsonTrees.object(JsonTrees.object(survey, "nodes"), nodeId);
        String poleNumber = poleNumber(node);
        if (poleNumber != null) {
            return poleNumber;
        }
        JSONObject attributes = JsonTrees.object(node, "attributes");
        String nodeType = firstValue(JsonTrees.value(attributes, "node_type"));
        if (nodeType != null && REFERENCE_NODE_TYPES.contains(nodeType.toLowerCase(Locale.ROOT))) {
            for (String name : REFERENCE_NAME_ATTRIBUTES) {
                String value = firstValue(JsonTrees.value(attributes, name));
                if (value != null) {
                    return "Reference-" + value;
                }
            }
            return capitalize(nodeType) + "-" + PoleIds.shortId(nodeId);
        }
        return "Node-" + PoleIds.shortId(nodeId);
    }

    /** Scalar text, or the first value (in key order) of a wrapper. */
    private static String firstValue(Object raw) {
        if (raw instanceof JSONObject wrapper) {
            for (String key : JsonTrees.sortedKeys(wrapper)) {
                String text = JsonTrees.text(wrapper, key);
                if (text != null && !text.isBlank()) {
                    return text;
                }
            }
            return null;
        }
        if (!JsonTrees.truthy(raw)) {
            return null;
        }
        return raw.toString();
    }

    private static String capitalize(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
