package com.phillippitts.makeready.service.attachment;

import com.phillippitts.makeready.util.OwnerNormalizer;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical attachment descriptions shared by both extractors, so that the same physical wire
 * reported by the survey and by the engineering document ends up under the same description.
 */
public final class AttachmentDescriptions {

    static final String CHARTER_SPECTRUM = "Charter/Spectrum";

    private static final List<String> TELCO_VARIANTS = List.of("at&t", "att", "atandt", "at and t");
    private static final List<String> UNDERGROUND_WORDS = List.of("underground", "riser", "vertical");
    private static final Pattern UG_WORD = Pattern.compile("(?i)\\bug\\b");

    private AttachmentDescriptions() {}

    /**
     * Formats {@code owner} and {@code type} into the description used in reports,
     * e.g. {@code ("AT&T", "fiber")} becomes {@code "AT&T Fiber Optic Com"}.
     */
    public static String format(String owner, String type) {
        String o = owner == null ? "" : owner.trim();
        String d = type == null ? "" : type.trim();
        String ownerLower = o.toLowerCase(Locale.ROOT);
        String descLower = d.toLowerCase(Locale.ROOT);

        if (descLower.contains("neutral")) {
            return "Neutral";
        }
        if (TELCO_VARIANTS.stream().anyMatch(ownerLower::contains)) {
            return formatTelco(d, descLower);
        }
        String normalizedOwner = OwnerNormalizer.normalize(o);
        if (OwnerNormalizer.TELCO.equals(normalizedOwner)) {
            return formatTelco(d, descLower);
        }
        if ((ownerLower.contains("cps") || ownerLower.contains("energy")) && descLower.contains("fiber")) {
            return "CPS Supply Fiber";
        }
        if (isCharterFamily(ownerLower) || isCharterFamily(descLower)) {
            if (descLower.contains("fiber") || descLower.contains("optic")) {
                return CHARTER_SPECTRUM + " Fiber Optic";
            }
            String rest = normalizeType(d);
            return rest.isBlank() || CHARTER_SPECTRUM.equals(rest) ? CHARTER_SPECTRUM : CHARTER_SPECTRUM + " " + rest;
        }
        return ((normalizedOwner == null ? "" : normalizedOwner) + " " + normalizeType(d)).trim();
    }

    /**
     * Normalizes a type or description: Charter/Spectrum family names, {@code Fiber} spelled
     * out as {@code Fiber Optic}, AT&T communications variants and utility supply fiber.
     */
    public static String normalizeType(String type) {
        String d = type == null ? "" : type;
        String lower = d.toLowerCase(Locale.ROOT);
        if (isCharterFamily(lower)) {
            return CHARTER_SPECTRUM;
        }
        if (lower.contains("fiber") && !lower.contains("optic")) {
            d = d.replace("Fiber", "Fiber Optic").replace("fiber", "Fiber Optic");
        }
        if (lower.contains("at&t") || lower.contains("att")) {
            if (lower.contains("telco")) {
                return "Telco Com";
            } else if (lower.contains("drop")) {
                return "Com Drop";
            } else if (lower.contains("fiber")) {
                return "Fiber Optic Com";
            } else if (lower.contains("com")) {
                return "Com";
            }
        }
        if ((lower.contains("cps") || lower.contains("energy")) && lower.contains("fiber")) {
            return "Supply Fiber";
        }
        return d;
    }

    /**
     * Whether a description or type marks an item that leaves the pole underground.
     * {@code ug} only counts as a whole word.
     */
    public static boolean isUnderground(String... texts) {
        for (String text : texts) {
            if (text == null || text.isEmpty()) {
                continue;
            }
            String lower = text.toLowerCase(Locale.ROOT);
            if (UNDERGROUND_WORDS.stream().anyMatch(lower::contains) || UG_WORD.matcher(lower).find()) {
                return true;
            }
        }
        return false;
    }

    public static boolean isCharterFamily(String text) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return lower.contains("charter") || lower.contains("spectrum");
    }

    private static String formatTelco(String desc, String descLower) {
        if (descLower.contains("telco")) {
            return "AT&T Telco Com";
        } else if (descLower.contains("drop")) {
            return "AT&T Com Drop";
        } else if (descLower.contains("fiber") || descLower.contains("optic")) {
            return "AT&T Fiber Optic Com";
        }
        return ("AT&T " + normalizeType(desc)).trim();
    }
}
