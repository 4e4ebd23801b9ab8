package com.phillippitts.makeready.exception;

/**
 * Thrown when building the report record of a single pole fails unexpectedly.
 */
public class PoleProcessingException extends MakeReadyException {

    private final String nodeId;
    private final String poleNumber;

    public PoleProcessingException(String message, String nodeId, String poleNumber) {
        super(message);
        this.nodeId = nodeId;
        this.poleNumber = poleNumber;
    }

    public PoleProcessingException(String message, String nodeId, String poleNumber, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
        this.poleNumber = poleNumber;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getPoleNumber() {
        return poleNumber;
    }
}
