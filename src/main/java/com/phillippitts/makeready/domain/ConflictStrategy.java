package com.phillippitts.makeready.domain;

/**
 * How a value reported differently by the survey and the engineering source is resolved.
 * A value reported by only one source is never a conflict.
 */
public enum ConflictStrategy {
    PREFER_SURVEY,
    PREFER_ENGINEERING,
    HIGHLIGHT_DIFFERENCES
}
