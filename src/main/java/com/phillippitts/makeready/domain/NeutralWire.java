package com.phillippitts.makeready.domain;

import java.util.Objects;

/**
 * Candidate neutral conductor found on a pole.
 *
 * @param heightInches attachment height in inches
 * @param description  owner and type text as found in the source
 * @param source       dataset the wire was found in
 */
public record NeutralWire(double heightInches, String description, Source source) {

    public enum Source { SURVEY, ENGINEERING }

    public NeutralWire {
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }

    /** Attachment row representing this neutral in a below-neutral list. */
    public AttachmentRecord toAttachment() {
        String text = description.isBlank() ? "Neutral" : description;
        return AttachmentRecord.existing(text, heightInches).asNeutral();
    }
}
