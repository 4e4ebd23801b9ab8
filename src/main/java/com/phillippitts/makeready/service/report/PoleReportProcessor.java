package com.phillippitts.makeready.service.report;

import com.phillippitts.makeready.domain.AttacherLine;
import com.phillippitts.makeready.domain.AttachmentRecord;
import com.phillippitts.makeready.domain.ConflictStrategy;
import com.phillippitts.makeready.domain.Midspan;
import com.phillippitts.makeready.domain.NeutralWire;
import com.phillippitts.makeready.domain.PoleAttributes;
import com.phillippitts.makeready.domain.PoleReport;
import com.phillippitts.makeready.service.attachment.AttachmentConsolidator;
import com.phillippitts.makeready.service.attachment.SurveyAttachmentExtractor;
import com.phillippitts.makeready.service.attribute.SurveyAttributeExtractor;
import com.phillippitts.makeready.service.equipment.ProposedEquipmentCounter;
import com.phillippitts.makeready.service.metrics.ReportMetricsPublisher;
import com.phillippitts.makeready.service.midspan.MidspanCalculator;
import com.phillippitts.makeready.service.neutral.NeutralFilterResult;
import com.phillippitts.makeready.service.neutral.NeutralIdentifier;
import com.phillippitts.makeready.service.source.SourceIndex;
import com.phillippitts.makeready.service.span.ConnectionProcessor;
import com.phillippitts.makeready.service.span.ConnectionResult;
import com.phillippitts.makeready.util.JsonTrees;
import com.phillippitts.makeready.util.PoleIds;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the report record of one pole from the documents of a batch.
 *
 * <p>Steps: resolve attributes, extract attachments from both sources, consolidate, walk the
 * pole's connections, filter below the governing neutral, count proposed equipment, compute and
 * propagate the proposed midspan, then compose the final attacher list and classify the pole.
 * One instance serves one batch; it holds no per-pole state.
 */
public final class PoleReportProcessor {

    private static final Logger LOG = LogManager.getLogger(PoleReportProcessor.class);

    private final SourceIndex index;
    private final PoleReportComponents components;
    private final ConflictStrategy attributeStrategy;
    private final ReportMetricsPublisher metrics;

    private final SurveyAttachmentExtractor surveyExtractor;
    private final ConnectionProcessor connectionProcessor;
    private final MidspanCalculator midspanCalculator;

    /**
     * @param index             indices over the batch's documents
     * @param components        shared pipeline collaborators
     * @param attributeStrategy attribute conflict strategy, or null for the configured default
     * @param metrics           metrics publisher (use {@link ReportMetricsPublisher#NOOP} in tests)
     */
    public PoleReportProcessor(SourceIndex index, PoleReportComponents components,
                               ConflictStrategy attributeStrategy, ReportMetricsPublisher metrics) {
        this.index = index;
        this.components = components;
        this.attributeStrategy = attributeStrategy;
        this.metrics = metrics;
        this.surveyExtractor = new SurveyAttachmentExtractor(index.survey(), index.traces());
        this.connectionProcessor = new ConnectionProcessor(index);
        this.midspanCalculator = new MidspanCalculator(index.traces());
    }

    /**
     * @param nodeId     survey node id of the pole
     * @param node       survey node
     * @param poleNumber pole label found on the node
     */
    public PoleReport process(String nodeId, JSONObject node, String poleNumber) {
        String normalized = PoleIds.normalize(poleNumber);
        JSONObject location = normalized == null ? null : index.location(normalized);
        PoleAttributes attributes = components.getAttributeResolver()
                .resolve(node, location, index.engineering(), attributeStrategy);

        AttachmentConsolidator consolidator = components.getConsolidator();
        Map<String, AttachmentRecord> fromSurvey = surveyExtractor.extract(node);
        Map<String, AttachmentRecord> fromEngineering = location == null
                ? Map.of()
                : components.getEngineeringExtractor().extract(location);
        List<AttachmentRecord> consolidated = consolidator.consolidate(fromEngineering, fromSurvey);
        Set<String> ownersWithChanges = consolidator.ownersWithChanges(consolidated);

        ConnectionResult connections = connectionProcessor.process(nodeId, poleNumber);

        NeutralIdentifier neutralIdentifier = components.getNeutralIdentifier();
        List<NeutralWire> candidates = new ArrayList<>(
                neutralIdentifier.surveyCandidates(index.survey(), node, index.traces()));
        if (location != null) {
            candidates.addAll(neutralIdentifier.engineeringCandidates(location));
        }
        Optional<NeutralWire> neutral = neutralIdentifier.highest(candidates);
        NeutralFilterResult filtered = neutralIdentifier.filter(consolidated, neutral);
        if (!filtered.neutralFound()) {
            metrics.recordNeutralMissing();
        }

        String notes = SurveyAttributeExtractor.notes(JsonTrees.object(node, "attributes"));
        ProposedEquipmentCounter.Counts counts = components.getEquipmentCounter().count(node, location, notes);

        Midspan poleMidspan = midspanCalculator.poleMidspan(connections.spanWires(), consolidated,
                ownersWithChanges);
        List<AttachmentRecord> belowNeutral = midspanCalculator.apply(filtered.belowNeutral(), poleMidspan);

        List<AttacherLine> attachers = components.getFinalListBuilder().build(belowNeutral,
                connections.backspanBlock(), connections.referenceSpans(), filtered.governingNeutral());

        PoleClassifier classifier = components.getClassifier();
        Integer operationNumber = normalized == null ? null : index.operationNumber(normalized);

        LOG.debug("Pole {}: {} consolidated, {} below neutral, {} lines, midspan {}",
                poleNumber, consolidated.size(), belowNeutral.size(), attachers.size(), poleMidspan.format());

        return PoleReport.builder(nodeId, attributes)
                .proposedRiser(counts.riserText())
                .proposedGuy(counts.guyText())
                .primarySpan(connections.primarySpan())
                .connections(connections.connections())
                .midspanProposed(poleMidspan.format())
                .attachers(attachers)
                .belowNeutral(belowNeutral)
                .action(classifier.action(belowNeutral))
                .status(classifier.status(notes, attributes.passingCapacity()))
                .operationNumber(operationNumber)
                .midspanHeights(connections.midspanHeights())
                .primary(operationNumber != null)
                .build();
    }
}
