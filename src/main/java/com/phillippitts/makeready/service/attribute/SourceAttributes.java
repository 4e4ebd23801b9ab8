package com.phillippitts.makeready.service.attribute;

/**
 * Pole attributes as reported by one source document. Every field is nullable.
 */
public record SourceAttributes(
        String owner,
        String structure,
        String constructionGrade,
        String plaPercentage,
        String notes
) {

    public static final SourceAttributes NONE = new SourceAttributes(null, null, null, null, null);
}
