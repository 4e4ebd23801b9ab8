package com.phillippitts.makeready.service.span;

import com.phillippitts.makeready.domain.SpanHeader;
import com.phillippitts.makeready.domain.SpanKind;
import com.phillippitts.makeready.util.JsonTrees;
import com.phillippitts.makeready.util.PoleIds;
import org.json.JSONObject;

import java.util.List;
import java.util.Locale;

/**
 * Header rows for backspan and reference-span blocks.
 */
public final class SpanHeaderFactory {

    public static final String BACKSPAN_STYLE = "light-blue";
    public static final String ORANGE = "orange";
    public static final String PURPLE = "purple";

    static final String DEFAULT_DIRECTION = "Reference";

    private static final List<String> DIRECTION_ATTRIBUTES =
            List.of("direction_tag", "direction", "span_direction", "ref_direction");
    private static final List<String> COLOR_ATTRIBUTES = List.of("color_tag", "color", "span_color", "ref_color");
    private static final List<String> WRAPPER_KEYS = List.of("-Notes Added", "button_added", "assessment", "-Imported");

    private SpanHeaderFactory() {}

    /** {@code Ref (Backspan) to <previousPoleId>}, styled light blue. */
    public static SpanHeader backspan(String previousPoleId) {
        return new SpanHeader(SpanKind.BACKSPAN, "Ref (Backspan) to " + previousPoleId, BACKSPAN_STYLE);
    }

    /**
     * {@code Ref (<direction>) to <tag>}. The direction comes from the connection's attributes,
     * else from the bearing between the two nodes, else {@value #DEFAULT_DIRECTION}.
     */
    public static SpanHeader reference(JSONObject connection, JSONObject fromNode, JSONObject toNode,
                                       String otherLabel, String otherNodeId) {
        JSONObject attributes = JsonTrees.object(connection, "attributes");
        String direction = attributeText(attributes, DIRECTION_ATTRIBUTES);
        if (direction == null) {
            direction = bearing(fromNode, toNode);
        }
        if (direction == null) {
            direction = DEFAULT_DIRECTION;
        }
        String description = "Ref (" + direction + ") to " + PoleIds.displayTag(otherLabel, otherNodeId);
        return new SpanHeader(SpanKind.REFERENCE, description, color(attributes));
    }

    /**
     * Eight-point compass direction from {@code from} to {@code to}; a component dominates when
     * it is more than twice the other.
     *
     * @return the direction, or null when either node lacks coordinates
     */
    static String bearing(JSONObject from, JSONObject to) {
        Double lat1 = JsonTrees.number(from, "latitude");
        Double lon1 = JsonTrees.number(from, "longitude");
        Double lat2 = JsonTrees.number(to, "latitude");
        Double lon2 = JsonTrees.number(to, "longitude");
        if (lat1 == null || lon1 == null || lat2 == null || lon2 == null) {
            return null;
        }
        double dLat = lat2 - lat1;
        double dLon = lon2 - lon1;
        if (Math.abs(dLat) > Math.abs(dLon) * 2) {
            return dLat > 0 ? "North" : "South";
        }
        if (Math.abs(dLon) > Math.abs(dLat) * 2) {
            return dLon > 0 ? "East" : "West";
        }
        if (dLat > 0) {
            return dLon > 0 ? "North East" : "North West";
        }
        return dLon > 0 ? "South East" : "South West";
    }

    static String color(JSONObject attributes) {
        String text = attributeText(attributes, COLOR_ATTRIBUTES);
        if (text != null && text.toLowerCase(Locale.ROOT).contains(PURPLE)
                && !text.toLowerCase(Locale.ROOT).contains(ORANGE)) {
            return PURPLE;
        }
        return ORANGE;
    }

    /**
     * First attribute among {@code names} that yields text: a plain string, or a wrapper whose
     * first known key holds a string or a {@code tagtext} object.
     */
    private static String attributeText(JSONObject attributes, List<String> names) {
        for (String name : names) {
            Object raw = JsonTrees.value(attributes, name);
            if (!JsonTrees.truthy(raw)) {
                continue;
            }
            String text = null;
            if (raw instanceof JSONObject wrapper) {
                for (String key : WRAPPER_KEYS) {
                    Object inner = JsonTrees.value(wrapper, key);
                    if (inner instanceof JSONObject tagged && tagged.has("tagtext")) {
                        text = JsonTrees.text(tagged, "tagtext");
                        break;
                    } else if (inner instanceof String value) {
                        text = value;
                        break;
                    }
                }
            } else if (raw instanceof String value) {
                text = value;
            }
            if (text != null && !text.isBlank()) {
                return text.trim();
            }
        }
        return null;
    }
}
