package com.phillippitts.makeready.util;

import java.util.Locale;
import java.util.Set;

/**
 * Canonical owner names. Normalization is idempotent: {@code normalize(normalize(x))}
 * always equals {@code normalize(x)}.
 */
public final class OwnerNormalizer {

    /** Canonical name of the pole-owning electric utility. */
    public static final String UTILITY = "CPS ENERGY";

    public static final String TELCO = "AT&T";

    private static final Set<String> TELCO_ALIASES = Set.of("ATT", "AT AND T", "ATANDT");
    private static final Set<String> UTILITY_ALIASES = Set.of("CPS ENERGY", "CPS");

    private OwnerNormalizer() {}

    /**
     * Trims, upper-cases and replaces {@code &} with {@code AND}, then folds known aliases.
     *
     * @param owner raw owner (nullable)
     * @return normalized owner, or null for a null or blank input
     */
    public static String normalize(String owner) {
        if (owner == null || owner.isBlank()) {
            return null;
        }
        String upper = owner.trim().toUpperCase(Locale.ROOT).replace("&", "AND");
        if (TELCO_ALIASES.contains(upper)) {
            return TELCO;
        }
        if (UTILITY_ALIASES.contains(upper)) {
            return UTILITY;
        }
        return upper;
    }

    /**
     * Owner token of an attachment description: its first word, normalized.
     */
    public static String ownerOfDescription(String description) {
        if (description == null || description.isBlank()) {
            return null;
        }
        String first = description.trim().split(" ", 2)[0];
        return normalize(first);
    }

    public static boolean isUtility(String owner) {
        return owner != null && owner.toLowerCase(Locale.ROOT).contains("cps");
    }
}
