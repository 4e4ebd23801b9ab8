package com.phillippitts.makeready.service.source;

import com.phillippitts.makeready.service.survey.PoleLabelResolver;
import com.phillippitts.makeready.service.survey.TraceResolver;
import com.phillippitts.makeready.util.JsonTrees;
import com.phillippitts.makeready.util.OwnerNormalizer;
import com.phillippitts.makeready.util.PoleIds;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates both documents and builds the shared {@link SourceIndex}.
 */
public final class SourceIndexBuilder {

    private static final Logger LOG = LogManager.getLogger(SourceIndexBuilder.class);

    private SourceIndexBuilder() {}

    /**
     * @param survey      survey document
     * @param engineering engineering document, or null
     * @throws com.phillippitts.makeready.exception.InvalidSourceDocumentException on a malformed document
     */
    public static SourceIndex build(JSONObject survey, JSONObject engineering) {
        SourceDocumentValidator.validate(survey, engineering);

        Map<String, JSONObject> locations = new HashMap<>();
        List<String> sequence = new ArrayList<>();
        Map<WireKey, JSONObject> wires = new LinkedHashMap<>();
        int leadCount = 0;
        int locationCount = 0;

        if (engineering != null) {
            for (JSONObject lead : JsonTrees.objects(engineering, "leads")) {
                leadCount++;
                for (JSONObject location : JsonTrees.objects(lead, "locations")) {
                    locationCount++;
                    String pole = PoleIds.normalize(JsonTrees.text(location, "label"));
                    if (pole == null) {
                        continue;
                    }
                    if (!sequence.contains(pole)) {
                        sequence.add(pole);
                    }
                    locations.put(pole, location);
                    indexWires(wires, pole, location);
                }
            }
        }

        Map<String, String> nodeIds = new HashMap<>();
        JSONObject nodes = JsonTrees.object(survey, "nodes");
        for (String nodeId : JsonTrees.sortedKeys(nodes)) {
            String pole = PoleIds.normalize(PoleLabelResolver.poleNumber(nodes.optJSONObject(nodeId)));
            if (pole != null) {
                nodeIds.putIfAbsent(pole, nodeId);
            }
        }

        SourceIndex index = new SourceIndex(survey, engineering, new TraceResolver(survey), locations,
                sequence, wires, nodeIds);
        LOG.info("Survey: {} nodes, {} connections, {} photos",
                nodes.length(), JsonTrees.object(survey, "connections").length(),
                JsonTrees.object(survey, "photos").length());
        if (engineering != null) {
            LOG.info("Engineering: {} leads, {} locations, {} sequenced poles, {} indexed wires",
                    leadCount, locationCount, sequence.size(), index.wireCount());
        } else {
            LOG.info("No engineering document; running survey-only");
        }
        return index;
    }

    private static void indexWires(Map<WireKey, JSONObject> wires, String pole, JSONObject location) {
        for (JSONObject design : JsonTrees.objects(location, "designs")) {
            for (JSONObject wire : JsonTrees.objects(JsonTrees.object(design, "structure"), "wires")) {
                String owner = OwnerNormalizer.normalize(JsonTrees.text(JsonTrees.object(wire, "owner"), "id"));
                List<String> endpoints = new ArrayList<>();
                endpoints.add(pole);
                for (JSONObject endPoint : JsonTrees.objects(wire, "wireEndPoints")) {
                    endpoints.add(PoleIds.normalize(JsonTrees.text(endPoint, "label")));
                }
                wires.put(WireKey.of(owner, endpoints), wire);
            }
        }
    }
}
