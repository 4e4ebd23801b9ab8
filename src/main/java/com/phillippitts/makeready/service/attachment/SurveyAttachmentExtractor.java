package com.phillippitts.makeready.service.attachment;

import com.phillippitts.makeready.domain.AttachmentRecord;
import com.phillippitts.makeready.domain.Midspan;
import com.phillippitts.makeready.domain.TraceMetadata;
import com.phillippitts.makeready.service.survey.SurveyWireCollector;
import com.phillippitts.makeready.service.survey.TraceResolver;
import com.phillippitts.makeready.service.survey.WireHeightReader;
import com.phillippitts.makeready.service.survey.WireMetadataExtractor;
import com.phillippitts.makeready.util.JsonTrees;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds attachment records from the wires photographed at a survey pole.
 *
 * <p>One record per formatted description; when the same description is photographed more
 * than once the tallest reading is kept. Wires flagged proposed are recorded as new installs
 * at their measured height.
 */
public final class SurveyAttachmentExtractor {

    private static final Logger LOG = LogManager.getLogger(SurveyAttachmentExtractor.class);

    private final JSONObject survey;
    private final TraceResolver traceResolver;

    public SurveyAttachmentExtractor(JSONObject survey, TraceResolver traceResolver) {
        this.survey = survey;
        this.traceResolver = traceResolver;
    }

    /**
     * @param node survey node of the pole
     * @return records keyed by description, in first-seen order
     */
    public Map<String, AttachmentRecord> extract(JSONObject node) {
        Map<String, AttachmentRecord> byDescription = new LinkedHashMap<>();
        for (JSONObject wire : SurveyWireCollector.poleWires(survey, node)) {
            String traceId = SurveyWireCollector.traceId(wire);
            if (traceId == null) {
                LOG.debug("Skipping pole wire without trace id");
                continue;
            }
            Double height = WireHeightReader.measured(wire);
            if (height == null) {
                LOG.debug("Skipping wire on trace {}: no measured height", traceId);
                continue;
            }
            TraceMetadata metadata = WireMetadataExtractor.extract(wire, traceResolver.resolve(traceId));
            String description = AttachmentDescriptions.format(metadata.owner(), metadata.cableType());
            if (description.isBlank()) {
                continue;
            }

            AttachmentRecord current = byDescription.get(description);
            if (current != null && current.sortHeight() >= height) {
                continue;
            }
            byDescription.put(description, toRecord(description, height, metadata, wire));
        }
        return byDescription;
    }

    private static AttachmentRecord toRecord(String description, double height, TraceMetadata metadata,
                                             JSONObject wire) {
        AttachmentRecord record = metadata.proposed()
                ? AttachmentRecord.newInstall(description, height)
                : AttachmentRecord.existing(description, height);
        boolean underground = JsonTrees.truthy(JsonTrees.firstTruthy(wire, "_underground", "underground"))
                || AttachmentDescriptions.isUnderground(description, metadata.cableType());
        if (underground) {
            return record.withUnderground(true);
        }
        return record.withMidspan(Midspan.ofInches(JsonTrees.number(wire, "_midspan_height")));
    }
}
