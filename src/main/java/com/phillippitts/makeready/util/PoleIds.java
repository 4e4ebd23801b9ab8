package com.phillippitts.makeready.util;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Pole identifier normalization and display helpers. */
public final class PoleIds {

    private static final Pattern TRAILING_DIGITS = Pattern.compile("(\\d+)$");
    private static final Pattern PL_TAG = Pattern.compile("(?i)PL\\d+");
    private static final List<String> DESCRIPTIVE_PREFIXES =
            List.of("Reference-", "Service-", "Anchor-", "Node-", "Unknown-");

    private PoleIds() {}

    /**
     * Extracts the trailing digits of a pole label ({@code "PL410620"} becomes {@code "410620"}).
     *
     * @param label raw label (nullable)
     * @return normalized id, or null when the label has no trailing digits
     */
    public static String normalize(String label) {
        if (label == null || label.isEmpty()) {
            return null;
        }
        Matcher matcher = TRAILING_DIGITS.matcher(label);
        return matcher.find() ? matcher.group(1) : null;
    }

    /**
     * Label used in span headers. Digit-only and {@code PL<digits>} tags render as
     * {@code PL<digits>}; synthesized tags and other formats are kept as is.
     */
    public static String displayTag(String tag, String nodeId) {
        if (tag == null || tag.isBlank()) {
            return "Unknown-" + shortId(nodeId);
        }
        for (String prefix : DESCRIPTIVE_PREFIXES) {
            if (tag.startsWith(prefix)) {
                return tag;
            }
        }
        if (tag.chars().allMatch(Character::isDigit) || PL_TAG.matcher(tag).matches()) {
            return "PL" + normalize(tag);
        }
        return tag;
    }

    /** First six characters of a node id. */
    public static String shortId(String nodeId) {
        if (nodeId == null) {
            return "";
        }
        return nodeId.length() <= 6 ? nodeId : nodeId.substring(0, 6);
    }
}
