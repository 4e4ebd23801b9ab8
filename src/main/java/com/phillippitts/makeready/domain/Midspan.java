package com.phillippitts.makeready.domain;

import com.phillippitts.makeready.util.HeightFormat;

/**
 * Proposed mid-span clearance of an attachment: unset, a height in inches, or underground.
 *
 * @param inches      clearance in inches (null unless a concrete height)
 * @param underground true when the attachment leaves the span underground
 */
public record Midspan(Double inches, boolean underground) {

    public static final String UNDERGROUND_LABEL = "UG";

    public static final Midspan UNSET = new Midspan(null, false);
    public static final Midspan UNDERGROUND = new Midspan(null, true);

    public Midspan {
        if (underground && inches != null) {
            throw new IllegalArgumentException("An underground midspan carries no height");
        }
    }

    public static Midspan ofInches(Double inches) {
        return inches == null ? UNSET : new Midspan(inches, false);
    }

    public boolean isSet() {
        return underground || inches != null;
    }

    /** {@code "UG"}, a feet-inch string, or {@code "N/A"}. */
    public String format() {
        return underground ? UNDERGROUND_LABEL : HeightFormat.toFeetInches(inches);
    }
}
