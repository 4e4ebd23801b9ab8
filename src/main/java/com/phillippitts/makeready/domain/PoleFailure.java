package com.phillippitts.makeready.domain;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A pole omitted from a report because its processing failed.
 *
 * @param nodeId     survey node id
 * @param poleNumber pole label when known
 * @param message    failure description (never raw document content)
 */
public record PoleFailure(String nodeId, String poleNumber, String message) {

    public Map<String, Object> toMap() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("node_id", nodeId);
        row.put("pole_number", poleNumber);
        row.put("message", message);
        return row;
    }
}
