package com.phillippitts.makeready.service.source;

import com.phillippitts.makeready.exception.InvalidSourceDocumentException;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Checks the top-level shape of both documents before any pole is processed.
 */
public final class SourceDocumentValidator {

    private SourceDocumentValidator() {}

    /**
     * @param survey      survey document (required)
     * @param engineering engineering document (nullable)
     * @throws InvalidSourceDocumentException when a required collection is missing or has the
     *                                        wrong shape
     */
    public static void validate(JSONObject survey, JSONObject engineering) {
        if (survey == null) {
            throw new InvalidSourceDocumentException(SourceDocumentParser.SURVEY, "document is missing");
        }
        if (!survey.has("nodes")) {
            throw new InvalidSourceDocumentException(SourceDocumentParser.SURVEY, "missing 'nodes' collection");
        }
        if (survey.optJSONObject("nodes") == null) {
            throw new InvalidSourceDocumentException(SourceDocumentParser.SURVEY, "'nodes' is not an object");
        }
        for (String collection : new String[] {"connections", "photos", "traces"}) {
            Object value = survey.opt(collection);
            if (value != null && !JSONObject.NULL.equals(value) && !(value instanceof JSONObject)) {
                throw new InvalidSourceDocumentException(SourceDocumentParser.SURVEY,
                        "'" + collection + "' is not an object");
            }
        }
        if (engineering != null && engineering.has("leads") && !(engineering.opt("leads") instanceof JSONArray)) {
            throw new InvalidSourceDocumentException(SourceDocumentParser.ENGINEERING, "'leads' is not an array");
        }
    }
}
