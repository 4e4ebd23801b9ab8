package com.phillippitts.makeready.exception;

/**
 * Thrown when a survey or engineering document is not usable as a whole: not a JSON object,
 * or missing a required top-level collection. Raised before any pole is processed.
 */
public class InvalidSourceDocumentException extends MakeReadyException {

    private final String documentName;
    private final String reason;

    public InvalidSourceDocumentException(String documentName, String reason) {
        super("Invalid " + documentName + " document: " + reason);
        this.documentName = documentName;
        this.reason = reason;
    }

    public InvalidSourceDocumentException(String documentName, String reason, Throwable cause) {
        super("Invalid " + documentName + " document: " + reason, cause);
        this.documentName = documentName;
        this.reason = reason;
    }

    public String getDocumentName() {
        return documentName;
    }

    public String getReason() {
        return reason;
    }
}
