package com.phillippitts.makeready.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link PoleProcessingException} with contextual details.
 *
 * <pre>
 * throw PoleProcessingExceptionBuilder.create("Pole processing failed")
 *         .node(nodeId)
 *         .pole(poleNumber)
 *         .cause(e)
 *         .metadata("stage", "neutral")
 *         .build();
 * </pre>
 *
 * <p>The resulting message reads {@code message (nodeId=..., pole=..., key=value)}.
 */
public final class PoleProcessingExceptionBuilder {

    private final String message;
    private String nodeId;
    private String poleNumber;
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private PoleProcessingExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * @param message base error message (must not be null or empty)
     */
    public static PoleProcessingExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new PoleProcessingExceptionBuilder(message);
    }

    public PoleProcessingExceptionBuilder node(String nodeId) {
        this.nodeId = nodeId;
        return this;
    }

    public PoleProcessingExceptionBuilder pole(String poleNumber) {
        this.poleNumber = poleNumber;
        return this;
    }

    public PoleProcessingExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /** Adds a detail; null keys or values are ignored. */
    public PoleProcessingExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public PoleProcessingException build() {
        String detailed = buildDetailedMessage();
        if (cause != null) {
            return new PoleProcessingException(detailed, nodeId, poleNumber, cause);
        }
        return new PoleProcessingException(detailed, nodeId, poleNumber);
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (nodeId != null) {
            details.put("nodeId", nodeId);
        }
        if (poleNumber != null) {
            details.put("pole", poleNumber);
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        return sb.append(")").toString();
    }
}
