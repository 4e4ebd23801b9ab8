package com.phillippitts.makeready.service.span;

import com.phillippitts.makeready.domain.SpanMidspanHeights;
import com.phillippitts.makeready.service.survey.PoleLabelResolver;
import com.phillippitts.makeready.service.survey.SpanWire;
import com.phillippitts.makeready.service.survey.SurveyWireCollector;
import com.phillippitts.makeready.service.survey.TraceResolver;
import com.phillippitts.makeready.service.survey.WireClassifier;
import com.phillippitts.makeready.service.survey.WireMetadataExtractor;
import com.phillippitts.makeready.util.JsonTrees;
import com.phillippitts.makeready.util.OwnerNormalizer;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowest mid-span heights per span, for every connection of a pole that leads to another pole.
 *
 * <p>Only mid-span readings are trusted: the wire's {@code _midspan_height}, its
 * {@code midspanHeight_in}, the section's {@code midspanHeight_in}, and as a last resort the
 * wire's {@code _measured_height}. Spans drawn as underground paths report {@code UG}.
 */
final class SpanMidspanCollector {

    private static final String UNDERGROUND_PATH = "underground_path";

    private final JSONObject survey;
    private final TraceResolver traces;

    SpanMidspanCollector(JSONObject survey, TraceResolver traces) {
        this.survey = survey;
        this.traces = traces;
    }

    /**
     * @param connections connection ids and objects touching the pole, paired with the
     *                    opposite node id
     */
    List<SpanMidspanHeights> collect(List<PoleConnection> connections) {
        Map<String, SpanMidspanHeights> byPole = new LinkedHashMap<>();
        for (PoleConnection connection : connections) {
            String otherPole = PoleLabelResolver.poleNumber(
                    JsonTrees.object(JsonTrees.object(survey, "nodes"), connection.otherNodeId()));
            if (otherPole == null) {
                continue;
            }
            if (UNDERGROUND_PATH.equalsIgnoreCase(JsonTrees.text(connection.connection(), "button", ""))) {
                byPole.put(otherPole, SpanMidspanHeights.underground(otherPole));
                continue;
            }
            byPole.put(otherPole, lowest(otherPole, connection));
        }
        return new ArrayList<>(byPole.values());
    }

    private SpanMidspanHeights lowest(String otherPole, PoleConnection connection) {
        Double communication = null;
        Double electrical = null;
        for (SpanWire spanWire : SurveyWireCollector.spanWires(survey, connection.connectionId(),
                connection.connection())) {
            JSONObject wire = spanWire.wire();
            Double height = midspanHeight(wire, spanWire.section());
            if (height == null) {
                continue;
            }
            String traceId = spanWire.traceId();
            JSONObject trace = traceId == null ? new JSONObject() : traces.resolve(traceId);

            String owner = OwnerNormalizer.normalize(
                    JsonTrees.text(wire, "owner", JsonTrees.text(wire, "_company", null)));
            if (owner == null && !trace.isEmpty()) {
                owner = WireMetadataExtractor.extract(wire, trace).owner();
            }
            String type = JsonTrees.text(wire, "type", JsonTrees.text(trace, "cable_type", ""));
            String usage = JsonTrees.text(wire, "usageGroup", JsonTrees.text(trace, "usageGroup", ""));

            if (OwnerNormalizer.UTILITY.equals(owner)) {
                if (WireClassifier.isSpanElectrical(owner, type, usage)
                        && (electrical == null || height < electrical)) {
                    electrical = height;
                }
            } else if (communication == null || height < communication) {
                communication = height;
            }
        }
        return new SpanMidspanHeights(otherPole, communication, electrical, false);
    }

    static Double midspanHeight(JSONObject wire, JSONObject section) {
        Object raw = JsonTrees.firstTruthy(wire, "_midspan_height", "midspanHeight_in");
        if (raw == null) {
            raw = JsonTrees.firstTruthy(section, "midspanHeight_in");
        }
        if (raw == null) {
            raw = JsonTrees.value(wire, "_measured_height");
        }
        return JsonTrees.number(raw);
    }
}
