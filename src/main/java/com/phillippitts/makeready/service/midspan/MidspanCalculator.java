package com.phillippitts.makeready.service.midspan;

import com.phillippitts.makeready.domain.AttachmentRecord;
import com.phillippitts.makeready.domain.Midspan;
import com.phillippitts.makeready.domain.TraceMetadata;
import com.phillippitts.makeready.service.attachment.AttachmentDescriptions;
import com.phillippitts.makeready.service.survey.SpanWire;
import com.phillippitts.makeready.service.survey.TraceResolver;
import com.phillippitts.makeready.service.survey.WireHeightReader;
import com.phillippitts.makeready.service.survey.WireMetadataExtractor;
import com.phillippitts.makeready.util.OwnerNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Pole-level proposed midspan and its propagation to individual attachments.
 */
public final class MidspanCalculator {

    private static final Logger LOG = LogManager.getLogger(MidspanCalculator.class);

    private final TraceResolver traces;

    public MidspanCalculator(TraceResolver traces) {
        this.traces = traces;
    }

    /**
     * Lowest span wire height among the wires that take part in the make-ready: every wire
     * when the pole has a new install, otherwise wires of owners with changes and wires
     * flagged proposed.
     *
     * @param spanWires         wires photographed on the pole's connections
     * @param attachments       consolidated attachments of the pole
     * @param ownersWithChanges owners whose attachments move or are proposed
     * @return the lowest height, or {@link Midspan#UNSET} when nothing changes or no wire qualifies
     */
    public Midspan poleMidspan(List<SpanWire> spanWires, List<AttachmentRecord> attachments,
                               Set<String> ownersWithChanges) {
        boolean hasNewInstall = attachments.stream().anyMatch(AttachmentRecord::isNewInstall);
        if (!hasNewInstall && ownersWithChanges.isEmpty()) {
            return Midspan.UNSET;
        }
        Double lowest = null;
        for (SpanWire spanWire : spanWires) {
            String traceId = spanWire.traceId();
            if (traceId == null) {
                continue;
            }
            JSONObject wire = spanWire.wire();
            TraceMetadata metadata = WireMetadataExtractor.extract(wire, traces.resolve(traceId));
            if (!hasNewInstall && !metadata.proposed() && !ownerChanged(metadata, ownersWithChanges)) {
                continue;
            }
            Double height = WireHeightReader.read(wire);
            if (height != null && (lowest == null || height < lowest)) {
                lowest = height;
            }
        }
        LOG.debug("Pole midspan from {} span wires: {}", spanWires.size(), lowest);
        return Midspan.ofInches(lowest);
    }

    /**
     * Applies the pole-level midspan: a moved attachment without a midspan takes the pole value,
     * a new install loses any midspan other than underground, an unmoved existing attachment
     * loses its midspan.
     */
    public List<AttachmentRecord> apply(List<AttachmentRecord> attachments, Midspan poleMidspan) {
        List<AttachmentRecord> result = new ArrayList<>(attachments.size());
        for (AttachmentRecord record : attachments) {
            if (record.isMoved()) {
                if (!record.midspan().isSet() && poleMidspan.isSet()) {
                    record = record.withMidspan(poleMidspan);
                }
            } else if (record.isNewInstall()) {
                if (!record.midspan().underground()) {
                    record = record.withMidspan(Midspan.UNSET);
                }
            } else {
                record = record.withMidspan(Midspan.UNSET);
            }
            result.add(record);
        }
        return result;
    }

    /**
     * Matches the wire's normalized owner, or the owner token of its formatted description,
     * against the owners with changes.
     */
    private static boolean ownerChanged(TraceMetadata metadata, Set<String> ownersWithChanges) {
        if (ownersWithChanges.contains(metadata.owner())) {
            return true;
        }
        String formatted = AttachmentDescriptions.format(metadata.owner(), metadata.cableType());
        String token = OwnerNormalizer.ownerOfDescription(formatted);
        return token != null && ownersWithChanges.contains(token);
    }
}
