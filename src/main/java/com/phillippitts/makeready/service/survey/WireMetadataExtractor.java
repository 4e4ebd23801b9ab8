package com.phillippitts.makeready.service.survey;

import com.phillippitts.makeready.domain.TraceMetadata;
import com.phillippitts.makeready.service.attribute.AttributeValue;
import com.phillippitts.makeready.util.JsonTrees;
import com.phillippitts.makeready.util.OwnerNormalizer;
import org.json.JSONObject;

import java.util.List;
import java.util.Locale;

/**
 * Resolves owner, cable type and proposed status of a surveyed wire. The trace is consulted
 * first; the wire's own fields fill whatever the trace leaves unknown.
 */
public final class WireMetadataExtractor {

    private static final List<String> COMMUNICATION_OWNERS = List.of("AT&T", "SPECTRUM", "CHARTER");
    private static final List<String> PROPOSED_WORDS = List.of("true", "yes", "proposed");

    private WireMetadataExtractor() {}

    /**
     * @param wire  wire record from a photo (never null)
     * @param trace resolved trace, possibly empty
     */
    public static TraceMetadata extract(JSONObject wire, JSONObject trace) {
        String owner = null;
        String cableType = null;
        boolean proposed = false;

        if (trace != null && !trace.isEmpty()) {
            owner = text(JsonTrees.firstTruthy(trace, "company", "owner", "client"));
            cableType = text(JsonTrees.firstTruthy(trace, "cable_type", "type", "description"));
            proposed = isProposed(JsonTrees.firstTruthy(trace, "proposed", "is_proposed", "status"));
        }
        if (owner == null) {
            owner = text(JsonTrees.firstTruthy(wire, "_company", "owner", "client"));
        }
        if (cableType == null) {
            cableType = text(JsonTrees.firstTruthy(wire, "_cable_type", "type", "description"));
        }
        if (!proposed) {
            proposed = isProposed(JsonTrees.firstTruthy(wire, "_proposed", "is_proposed", "status"));
        }

        String normalizedOwner = owner == null ? TraceMetadata.UNKNOWN : OwnerNormalizer.normalize(owner);
        if (cableType == null && normalizedOwner != null && !TraceMetadata.UNKNOWN.equals(normalizedOwner)) {
            String upper = normalizedOwner.toUpperCase(Locale.ROOT);
            if (COMMUNICATION_OWNERS.stream().anyMatch(upper::contains)) {
                cableType = "Communication";
            }
        }
        String usageGroup = trace == null ? null : JsonTrees.text(trace, "usageGroup");
        return new TraceMetadata(normalizedOwner, cableType, usageGroup, proposed);
    }

    /** Proposed flag as stored in surveys: a boolean, a yes-like string, or the number 1. */
    static boolean isProposed(Object raw) {
        if (raw instanceof Boolean flag) {
            return flag;
        }
        if (raw instanceof String text) {
            return PROPOSED_WORDS.contains(text.trim().toLowerCase(Locale.ROOT));
        }
        if (raw instanceof Number number) {
            return number.doubleValue() == 1.0;
        }
        return false;
    }

    private static String text(Object raw) {
        AttributeValue value = AttributeValue.of(raw);
        return value == null ? null : value.text();
    }
}
