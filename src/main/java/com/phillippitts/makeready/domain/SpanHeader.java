package com.phillippitts.makeready.domain;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Header row introducing a backspan or reference-span block.
 *
 * @param kind        backspan or reference
 * @param description header text, e.g. {@code Ref (North East) to PL410620}
 * @param styleHint   rendering hint ({@code light-blue}, {@code orange}, {@code purple})
 */
public record SpanHeader(SpanKind kind, String description, String styleHint) implements AttacherLine {

    public SpanHeader {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(styleHint, "styleHint must not be null");
    }

    public SpanHeader withStyleHint(String hint) {
        return new SpanHeader(kind, description, hint);
    }

    @Override
    public boolean isHeader() {
        return true;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("type", kind.typeName());
        row.put("description", description);
        row.put("style_hint", styleHint);
        row.put("existing_height", "");
        row.put("proposed_height", "");
        row.put("midspan_proposed", "");
        return row;
    }
}
