package com.phillippitts.makeready.domain;

import java.util.Map;

/**
 * One row of a pole's final attacher list: an attachment or a span header.
 */
public interface AttacherLine {

    String description();

    default boolean isHeader() {
        return false;
    }

    /** Row in the list-of-mappings shape consumed by report renderers. */
    Map<String, Object> toMap();
}
