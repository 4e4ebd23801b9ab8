package com.phillippitts.makeready.service.survey;

import com.phillippitts.makeready.domain.TraceMetadata;
import com.phillippitts.makeready.util.JsonTrees;
import com.phillippitts.makeready.util.OwnerNormalizer;
import org.json.JSONObject;

import java.util.List;
import java.util.Locale;

/**
 * Splits surveyed span wires into communications and utility electrical circuits.
 *
 * <p>Ownership is decided first: a utility-owned wire is electrical, never communications.
 * Other owners count as communications when the trace cable type or the owner name matches a
 * communications pattern.
 */
public final class WireClassifier {

    private static final List<String> COMMUNICATION_CABLE_WORDS =
            List.of("com", "fiber", "telco", "cable", "telephone", "catv");
    private static final List<String> COMMUNICATION_OWNER_WORDS =
            List.of("att", "at&t", "spectrum", "charter", "comcast", "frontier", "verizon", "telco");
    private static final List<String> SPAN_ELECTRICAL_TYPES = List.of("neutral", "secondary", "service", "primary");

    private WireClassifier() {}

    public static boolean isCommunication(TraceMetadata metadata, JSONObject trace) {
        String owner = metadata.owner().toLowerCase(Locale.ROOT);
        if (OwnerNormalizer.isUtility(owner)) {
            return false;
        }
        String cableType = JsonTrees.text(trace, "cable_type", "").toLowerCase(Locale.ROOT);
        if (COMMUNICATION_CABLE_WORDS.stream().anyMatch(cableType::contains)) {
            return true;
        }
        return COMMUNICATION_OWNER_WORDS.stream().anyMatch(owner::contains);
    }

    public static boolean isUtilityElectrical(TraceMetadata metadata) {
        return OwnerNormalizer.isUtility(metadata.owner());
    }

    /**
     * Mid-span table classification: utility wires count as electrical only when their type
     * names a power circuit or their usage group is {@code power}.
     *
     * @param owner      normalized owner (nullable)
     * @param wireType   wire or trace cable type (nullable)
     * @param usageGroup wire or trace usage group (nullable)
     */
    public static boolean isSpanElectrical(String owner, String wireType, String usageGroup) {
        if (!OwnerNormalizer.UTILITY.equals(owner)) {
            return false;
        }
        String type = wireType == null ? "" : wireType.toLowerCase(Locale.ROOT);
        return SPAN_ELECTRICAL_TYPES.stream().anyMatch(type::contains)
                || "power".equalsIgnoreCase(usageGroup == null ? "" : usageGroup.trim());
    }
}
