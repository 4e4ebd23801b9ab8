package com.phillippitts.makeready.service.span;

import org.json.JSONObject;

/**
 * A survey connection touching the pole being processed.
 *
 * @param connectionId survey connection id
 * @param connection   connection object
 * @param otherNodeId  node id of the opposite endpoint
 */
record PoleConnection(String connectionId, JSONObject connection, String otherNodeId) {

    boolean joins(String nodeA, String nodeB) {
        String first = connection.optString("node_id_1", null);
        String second = connection.optString("node_id_2", null);
        return (nodeA.equals(first) && nodeB.equals(second)) || (nodeA.equals(second) && nodeB.equals(first));
    }
}
