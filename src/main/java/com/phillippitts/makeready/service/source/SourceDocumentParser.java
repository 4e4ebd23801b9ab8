package com.phillippitts.makeready.service.source;

import com.phillippitts.makeready.exception.InvalidSourceDocumentException;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Parses raw document text into a JSON object tree.
 */
public final class SourceDocumentParser {

    public static final String SURVEY = "survey";
    public static final String ENGINEERING = "engineering";

    private SourceDocumentParser() {}

    /**
     * @param documentName name used in error messages ({@link #SURVEY} or {@link #ENGINEERING})
     * @param text         document text
     * @throws InvalidSourceDocumentException if the text is empty or not a JSON object
     */
    public static JSONObject parse(String documentName, String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidSourceDocumentException(documentName, "document is empty");
        }
        try {
            Object value = new JSONTokener(text).nextValue();
            if (value instanceof JSONObject object) {
                return object;
            }
            throw new InvalidSourceDocumentException(documentName, "top-level value is not an object");
        } catch (JSONException e) {
            throw new InvalidSourceDocumentException(documentName, "malformed JSON", e);
        }
    }
}
