package com.phillippitts.makeready.domain;

/**
 * Identity and structural attributes of a pole after conflict resolution.
 * Any field other than {@code poleNumber} may be null.
 */
public record PoleAttributes(
        String poleNumber,
        String normalizedPoleNumber,
        String owner,
        String structure,
        String constructionGrade,
        String plaPercentage,
        String notes,
        Double passingCapacity,
        Double latitude,
        Double longitude
) {

    public boolean hasNotes() {
        return notes != null && !notes.isBlank();
    }
}
