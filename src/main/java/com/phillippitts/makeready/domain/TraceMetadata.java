package com.phillippitts.makeready.domain;

/**
 * Classification of a surveyed wire, resolved from its trace and the wire itself.
 *
 * @param owner      normalized owner, or {@value #UNKNOWN}
 * @param cableType  cable type text, or {@value #UNKNOWN}
 * @param usageGroup trace usage group (empty when absent)
 * @param proposed   wire is a proposed installation
 */
public record TraceMetadata(String owner, String cableType, String usageGroup, boolean proposed) {

    public static final String UNKNOWN = "Unknown";

    public TraceMetadata {
        owner = owner == null || owner.isBlank() ? UNKNOWN : owner;
        cableType = cableType == null || cableType.isBlank() ? UNKNOWN : cableType;
        usageGroup = usageGroup == null ? "" : usageGroup;
    }

    public static TraceMetadata unknown() {
        return new TraceMetadata(UNKNOWN, UNKNOWN, "", false);
    }

    public boolean hasKnownOwner() {
        return !UNKNOWN.equals(owner);
    }

    /** {@code owner cableType}, used for span attachments and neutral matching. */
    public String description() {
        String text = (owner + " " + cableType).trim();
        return text.isEmpty() ? "Unknown Attachment" : text;
    }
}
