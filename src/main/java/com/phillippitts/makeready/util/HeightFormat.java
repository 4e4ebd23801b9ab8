package com.phillippitts.makeready.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversions between the canonical height unit (inches) and the textual forms found in
 * survey and engineering documents.
 *
 * <p>All heights inside the engine are inches. Metre values coming from the engineering
 * document are converted exactly once, at extraction time.
 */
public final class HeightFormat {

    /** Rendered for a height that is absent. */
    public static final String NOT_AVAILABLE = "N/A";

    public static final double INCHES_PER_METER = 39.3701;

    private static final Pattern FEET_INCHES = Pattern.compile("(\\d+)'(?:-|\\s*)?(\\d+)\"?");

    private HeightFormat() {}

    /**
     * Formats inches as {@code F'-I"}. Remainders are rounded half-to-even and a
     * rounded remainder of 12 carries into the feet.
     *
     * @param inches height in inches (nullable)
     * @return formatted height, or {@value #NOT_AVAILABLE} when absent
     */
    public static String toFeetInches(Double inches) {
        if (inches == null || inches.isNaN() || inches.isInfinite()) {
            return NOT_AVAILABLE;
        }
        int feet = (int) Math.floor(inches / 12.0);
        int remainder = (int) Math.rint(inches - feet * 12.0);
        if (remainder == 12) {
            feet++;
            remainder = 0;
        }
        return feet + "'-" + remainder + "\"";
    }

    /**
     * Parses {@code F'-I"}, {@code F' I"} or a plain number (taken as inches).
     *
     * @param text height text (nullable)
     * @return inches, or null when the text is not a height
     */
    public static Double parseFeetInches(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        Matcher matcher = FEET_INCHES.matcher(trimmed);
        if (matcher.lookingAt()) {
            return Integer.parseInt(matcher.group(1)) * 12.0 + Integer.parseInt(matcher.group(2));
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static double metersToInches(double meters) {
        return meters * INCHES_PER_METER;
    }

    public static double feetToInches(double feet) {
        return feet * 12.0;
    }
}
