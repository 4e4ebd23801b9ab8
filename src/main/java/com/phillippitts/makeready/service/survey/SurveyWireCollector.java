package com.phillippitts.makeready.service.survey;

import com.phillippitts.makeready.util.JsonTrees;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks the photo records of a survey document and collects the wire entries they carry.
 *
 * <p>Wire collections appear as arrays or id-keyed objects; both are accepted. Photo data lives
 * either inline on the node's photo association or in the document's {@code photos} collection.
 */
public final class SurveyWireCollector {

    private SurveyWireCollector() {}

    /** Wires photographed at the pole itself. */
    public static List<JSONObject> poleWires(JSONObject survey, JSONObject node) {
        List<JSONObject> wires = new ArrayList<>();
        JSONObject photos = JsonTrees.object(node, "photos");
        for (String photoId : JsonTrees.sortedKeys(photos)) {
            JSONObject association = photos.optJSONObject(photoId);
            if (association == null) {
                continue;
            }
            JSONObject photoFirst = association.optJSONObject("photofirst_data");
            if (photoFirst == null) {
                photoFirst = photoFirstData(survey, photoId);
            }
            wires.addAll(wires(photoFirst));
        }
        return wires;
    }

    /** Wires photographed along every section of a connection. */
    public static List<SpanWire> spanWires(JSONObject survey, String connectionId, JSONObject connection) {
        List<SpanWire> result = new ArrayList<>();
        for (JSONObject section : JsonTrees.objects(connection, "sections")) {
            for (String photoId : photoIds(section)) {
                for (JSONObject wire : wires(photoFirstData(survey, photoId))) {
                    result.add(new SpanWire(connectionId, section, wire));
                }
            }
        }
        return result;
    }

    /** Wire entries of a {@code photofirst_data} record. */
    public static List<JSONObject> wires(JSONObject photoFirst) {
        return photoFirst == null ? List.of() : JsonTrees.objects(photoFirst, "wire");
    }

    /**
     * @return trimmed {@code _trace} id of a wire, or null when absent or blank
     */
    public static String traceId(JSONObject wire) {
        String id = JsonTrees.text(wire, "_trace");
        return id == null || id.isBlank() ? null : id.trim();
    }

    private static JSONObject photoFirstData(JSONObject survey, String photoId) {
        return JsonTrees.object(JsonTrees.object(JsonTrees.object(survey, "photos"), photoId), "photofirst_data");
    }

    private static List<String> photoIds(JSONObject section) {
        Object photos = JsonTrees.value(section, "photos");
        if (photos instanceof JSONObject byId) {
            return JsonTrees.sortedKeys(byId);
        }
        List<String> ids = new ArrayList<>();
        if (photos instanceof JSONArray list) {
            for (int i = 0; i < list.length(); i++) {
                String id = list.optString(i, null);
                if (id != null && !id.isBlank()) {
                    ids.add(id);
                }
            }
        }
        return ids;
    }
}
