package com.phillippitts.makeready.domain;

/** Make-ready work implied by a pole's primary attachments. */
public enum PoleAction {
    INSTALLING("(I)nstalling"),
    REMOVING("(R)emoving"),
    EXISTING("(E)xisting");

    private final String label;

    PoleAction(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
