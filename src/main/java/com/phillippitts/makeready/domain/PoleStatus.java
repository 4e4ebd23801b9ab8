package com.phillippitts.makeready.domain;

/** Pole-level review status. */
public enum PoleStatus {
    NO_CHANGE("No Change"),
    MAKE_READY_REQUIRED("Make-Ready Required"),
    ISSUE_DETECTED("Issue Detected");

    private final String label;

    PoleStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
