package com.phillippitts.makeready.service.neutral;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case-insensitive patterns naming a neutral conductor.
 */
public final class NeutralPatterns {

    static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("neutral"),
            Pattern.compile("cps\\s+energy\\s+neutral"),
            Pattern.compile("cps\\s+neutral"),
            Pattern.compile("primary\\s+neutral"),
            Pattern.compile("secondary\\s+neutral"),
            Pattern.compile("power\\s+neutral"),
            Pattern.compile("electric.*neutral"));

    private NeutralPatterns() {}

    public static boolean matches(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        return PATTERNS.stream().anyMatch(p -> p.matcher(normalized).find());
    }
}
