package com.phillippitts.makeready.service.span;

import com.phillippitts.makeready.domain.ConnectionSummary;
import com.phillippitts.makeready.domain.SpanBlock;
import com.phillippitts.makeready.domain.SpanHeader;
import com.phillippitts.makeready.domain.TraceMetadata;
import com.phillippitts.makeready.service.source.SourceIndex;
import com.phillippitts.makeready.service.survey.PoleLabelResolver;
import com.phillippitts.makeready.service.survey.SpanWire;
import com.phillippitts.makeready.service.survey.SurveyWireCollector;
import com.phillippitts.makeready.service.survey.WireClassifier;
import com.phillippitts.makeready.service.survey.WireHeightReader;
import com.phillippitts.makeready.service.survey.WireMetadataExtractor;
import com.phillippitts.makeready.util.JsonTrees;
import com.phillippitts.makeready.util.PoleIds;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Walks the survey connections of a pole.
 *
 * <p>For every connection the lowest communications and utility electrical heights are
 * recorded. Connections flagged as reference spans become reference blocks. The connection to
 * the pole visited just before this one in the engineering sequence becomes the backspan,
 * unless it was already taken as a reference span; no connection is ever both.
 */
public final class ConnectionProcessor {

    private static final Logger LOG = LogManager.getLogger(ConnectionProcessor.class);

    private final SourceIndex index;
    private final SpanAttachmentBuilder attachmentBuilder;
    private final SpanMidspanCollector midspanCollector;

    public ConnectionProcessor(SourceIndex index) {
        this.index = index;
        this.attachmentBuilder = new SpanAttachmentBuilder(index.traces());
        this.midspanCollector = new SpanMidspanCollector(index.survey(), index.traces());
    }

    /**
     * @param nodeId     survey node of the pole
     * @param poleNumber pole label as found on the node
     */
    public ConnectionResult process(String nodeId, String poleNumber) {
        JSONObject survey = index.survey();
        List<PoleConnection> poleConnections = connectionsOf(nodeId);

        List<ConnectionSummary> summaries = new ArrayList<>();
        List<SpanBlock> references = new ArrayList<>();
        List<SpanWire> allWires = new ArrayList<>();
        Set<String> processed = new HashSet<>();

        for (PoleConnection pc : poleConnections) {
            String otherLabel = PoleLabelResolver.label(survey, pc.otherNodeId());
            List<SpanWire> wires = SurveyWireCollector.spanWires(survey, pc.connectionId(), pc.connection());
            allWires.addAll(wires);
            summaries.add(summarize(pc, poleNumber, otherLabel, wires));

            if (ReferenceSpanDetector.isReference(pc.connection())) {
                SpanHeader header = SpanHeaderFactory.reference(pc.connection(), node(nodeId),
                        node(pc.otherNodeId()), otherLabel, pc.otherNodeId());
                references.add(new SpanBlock(header, attachmentBuilder.build(wires)));
                processed.add(pc.connectionId());
            }
        }

        SpanBlock backspan = findBackspan(nodeId, poleNumber, poleConnections, processed).orElse(null);
        LOG.debug("Pole {}: {} connections, {} reference spans, backspan {}",
                poleNumber, summaries.size(), references.size(), backspan == null ? "none" : "found");

        return new ConnectionResult(summaries, primarySpan(summaries, poleNumber), references, backspan,
                allWires, midspanCollector.collect(poleConnections));
    }

    private Optional<SpanBlock> findBackspan(String nodeId, String poleNumber, List<PoleConnection> connections,
                                             Set<String> processed) {
        Optional<String> previousPole = index.previousPole(PoleIds.normalize(poleNumber));
        if (previousPole.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> previousNode = index.nodeIdForPole(previousPole.get());
        if (previousNode.isEmpty()) {
            LOG.debug("Previous pole {} has no survey node", previousPole.get());
            return Optional.empty();
        }
        for (PoleConnection pc : connections) {
            if (!processed.contains(pc.connectionId()) && pc.joins(nodeId, previousNode.get())) {
                processed.add(pc.connectionId());
                List<SpanWire> wires = SurveyWireCollector.spanWires(index.survey(), pc.connectionId(),
                        pc.connection());
                return Optional.of(new SpanBlock(SpanHeaderFactory.backspan(previousPole.get()),
                        attachmentBuilder.build(wires)));
            }
        }
        return Optional.empty();
    }

    private ConnectionSummary summarize(PoleConnection pc, String poleNumber, String otherLabel,
                                        List<SpanWire> wires) {
        Double lowestCommunication = null;
        Double lowestElectrical = null;
        for (SpanWire spanWire : wires) {
            String traceId = spanWire.traceId();
            if (traceId == null) {
                continue;
            }
            Double height = WireHeightReader.read(spanWire.wire());
            if (height == null) {
                continue;
            }
            JSONObject trace = index.traces().resolve(traceId);
            TraceMetadata metadata = WireMetadataExtractor.extract(spanWire.wire(), trace);
            if (WireClassifier.isCommunication(metadata, trace)
                    && (lowestCommunication == null || height < lowestCommunication)) {
                lowestCommunication = height;
            }
            if (WireClassifier.isUtilityElectrical(metadata)
                    && (lowestElectrical == null || height < lowestElectrical)) {
                lowestElectrical = height;
            }
        }
        return new ConnectionSummary(pc.connectionId(), poleNumber, otherLabel, lowestCommunication,
                lowestElectrical);
    }

    /** First connection leading to a known label, else the first connection. */
    static ConnectionSummary primarySpan(List<ConnectionSummary> summaries, String poleNumber) {
        return summaries.stream()
                .filter(ConnectionSummary::hasKnownTarget)
                .findFirst()
                .or(() -> summaries.stream().findFirst())
                .orElse(ConnectionSummary.empty(poleNumber));
    }

    private List<PoleConnection> connectionsOf(String nodeId) {
        List<PoleConnection> result = new ArrayList<>();
        JSONObject connections = JsonTrees.object(index.survey(), "connections");
        for (String connectionId : JsonTrees.sortedKeys(connections)) {
            JSONObject connection = connections.optJSONObject(connectionId);
            if (connection == null) {
                continue;
            }
            String first = connection.optString("node_id_1", null);
            String second = connection.optString("node_id_2", null);
            if (nodeId.equals(first)) {
                result.add(new PoleConnection(connectionId, connection, second));
            } else if (nodeId.equals(second)) {
                result.add(new PoleConnection(connectionId, connection, first));
            }
        }
        return result;
    }

    private JSONObject node(String nodeId) {
        return JsonTrees.object(JsonTrees.object(index.survey(), "nodes"), nodeId);
    }
}
