package com.phillippitts.makeready.domain;

import com.phillippitts.makeready.util.HeightFormat;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A wire or equipment item attached to a pole.
 *
 * <p>Heights are inches. At least one of {@code existingHeight} and {@code proposedHeight}
 * is always present. Instances are immutable; the consolidation and midspan steps derive
 * updated copies through the {@code with*} methods.
 *
 * @param description    normalized owner and type, e.g. {@code Charter/Spectrum Fiber Optic}
 * @param existingHeight measured height before make-ready (nullable)
 * @param proposedHeight height after make-ready (nullable)
 * @param midspan        proposed mid-span clearance
 * @param proposed       source flagged the item as a proposed installation
 * @param underground    item leaves the pole underground (riser, vertical run)
 * @param neutral        item is the pole's governing neutral
 */
public record AttachmentRecord(
        String description,
        Double existingHeight,
        Double proposedHeight,
        Midspan midspan,
        boolean proposed,
        boolean underground,
        boolean neutral
) implements AttacherLine {

    public AttachmentRecord {
        Objects.requireNonNull(description, "description must not be null");
        if (description.isBlank()) {
            throw new IllegalArgumentException("description must not be blank");
        }
        if (existingHeight == null && proposedHeight == null) {
            throw new IllegalArgumentException(
                    "Attachment '" + description + "' needs an existing or proposed height");
        }
        midspan = midspan == null ? Midspan.UNSET : midspan;
    }

    /** Unchanged existing attachment. */
    public static AttachmentRecord existing(String description, double heightInches) {
        return new AttachmentRecord(description, heightInches, null, Midspan.UNSET, false, false, false);
    }

    /** Attachment with no existing height, installed at {@code heightInches}. */
    public static AttachmentRecord newInstall(String description, double heightInches) {
        return new AttachmentRecord(description, null, heightInches, Midspan.UNSET, true, false, false);
    }

    public boolean hasExisting() {
        return existingHeight != null;
    }

    public boolean hasProposed() {
        return proposedHeight != null;
    }

    /** Existing and proposed heights both present and rendering differently. */
    public boolean isMoved() {
        return hasExisting() && hasProposed() && !existingHeightText().equals(proposedHeightText());
    }

    public boolean isNewInstall() {
        return !hasExisting() && hasProposed();
    }

    /** Existing height, or the proposed height for new installs. */
    public double sortHeight() {
        return hasExisting() ? existingHeight : proposedHeight;
    }

    public String existingHeightText() {
        return HeightFormat.toFeetInches(existingHeight);
    }

    public String proposedHeightText() {
        return HeightFormat.toFeetInches(proposedHeight);
    }

    public AttachmentRecord withMidspan(Midspan value) {
        return new AttachmentRecord(description, existingHeight, proposedHeight, value,
                proposed, underground, neutral);
    }

    public AttachmentRecord withProposedHeight(Double value) {
        return new AttachmentRecord(description, existingHeight, value, midspan,
                proposed, underground, neutral);
    }

    public AttachmentRecord withUnderground(boolean value) {
        return new AttachmentRecord(description, existingHeight, proposedHeight,
                value ? Midspan.UNDERGROUND : midspan, proposed, value, neutral);
    }

    public AttachmentRecord asNeutral() {
        return new AttachmentRecord(description, existingHeight, proposedHeight, midspan,
                proposed, underground, true);
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("type", "attachment");
        row.put("description", description);
        row.put("existing_height", existingHeightText());
        row.put("proposed_height", proposedHeightText());
        row.put("midspan_proposed", midspan.format());
        row.put("raw_existing_height_inches", existingHeight);
        row.put("raw_proposed_height_inches", proposedHeight);
        row.put("is_proposed", proposed);
        row.put("is_neutral", neutral);
        row.put("goes_underground", underground);
        return row;
    }
}
