package com.phillippitts.makeready.service.survey;

import org.json.JSONObject;

/**
 * A wire photographed on a span section.
 *
 * @param connectionId survey connection id
 * @param section      the section record holding the photo
 * @param wire         the wire record
 */
public record SpanWire(String connectionId, JSONObject section, JSONObject wire) {

    public String traceId() {
        return SurveyWireCollector.traceId(wire);
    }
}
