package com.phillippitts.makeready.domain;

/** Kind of non-primary span block in a pole's attacher list. */
public enum SpanKind {
    REFERENCE("reference_header"),
    BACKSPAN("backspan_header");

    private final String typeName;

    SpanKind(String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }
}
