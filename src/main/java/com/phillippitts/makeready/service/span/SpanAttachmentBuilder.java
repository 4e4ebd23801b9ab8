package com.phillippitts.makeready.service.span;

import com.phillippitts.makeready.domain.AttachmentRecord;
import com.phillippitts.makeready.domain.Midspan;
import com.phillippitts.makeready.domain.TraceMetadata;
import com.phillippitts.makeready.service.attachment.AttachmentConsolidator;
import com.phillippitts.makeready.service.attachment.AttachmentDescriptions;
import com.phillippitts.makeready.service.survey.SpanWire;
import com.phillippitts.makeready.service.survey.TraceResolver;
import com.phillippitts.makeready.service.survey.WireHeightReader;
import com.phillippitts.makeready.service.survey.WireMetadataExtractor;
import com.phillippitts.makeready.util.JsonTrees;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Attachment rows of a backspan or reference span, one per photographed wire.
 *
 * <p>Rows are not deduplicated; every wire on the span is listed, tallest first.
 */
final class SpanAttachmentBuilder {

    private static final Logger LOG = LogManager.getLogger(SpanAttachmentBuilder.class);

    private static final List<String> UNDERGROUND_CABLE_WORDS = List.of("underground", "riser", "vertical");

    private final TraceResolver traces;

    SpanAttachmentBuilder(TraceResolver traces) {
        this.traces = traces;
    }

    List<AttachmentRecord> build(List<SpanWire> wires) {
        List<AttachmentRecord> rows = new ArrayList<>();
        for (SpanWire spanWire : wires) {
            String traceId = spanWire.traceId();
            if (traceId == null) {
                continue;
            }
            AttachmentRecord row = toRecord(spanWire, traces.resolve(traceId));
            if (row != null) {
                rows.add(row);
            }
        }
        rows.sort(AttachmentConsolidator.BY_HEIGHT_DESCENDING);
        return rows;
    }

    private static AttachmentRecord toRecord(SpanWire spanWire, JSONObject trace) {
        JSONObject wire = spanWire.wire();
        TraceMetadata metadata = WireMetadataExtractor.extract(wire, trace);
        String description = metadata.description();
        Double height = WireHeightReader.read(wire);
        if (height == null) {
            LOG.debug("Span wire {} on {} has no height", description, spanWire.connectionId());
            return null;
        }
        AttachmentRecord record = metadata.proposed()
                ? AttachmentRecord.newInstall(description, height)
                : AttachmentRecord.existing(description, height);

        if (goesUnderground(description, wire, trace)) {
            return record.withUnderground(true);
        }
        Double midspan = JsonTrees.number(spanWire.section(), "midspanHeight_in");
        if (midspan == null || midspan == 0.0) {
            Object own = JsonTrees.value(wire, "_midspan_height");
            midspan = JsonTrees.truthy(own) ? JsonTrees.number(own) : null;
        }
        return record.withMidspan(Midspan.ofInches(midspan));
    }

    static boolean goesUnderground(String description, JSONObject wire, JSONObject trace) {
        String cableType = JsonTrees.text(trace, "cable_type", "").toLowerCase(Locale.ROOT).trim();
        if ("ug".equals(cableType) || UNDERGROUND_CABLE_WORDS.stream().anyMatch(cableType::contains)) {
            return true;
        }
        if (AttachmentDescriptions.isUnderground(description)) {
            return true;
        }
        return JsonTrees.truthy(JsonTrees.firstTruthy(wire, "_underground", "underground"));
    }
}
