package com.phillippitts.makeready.service.report;

import com.phillippitts.makeready.domain.AttacherLine;
import com.phillippitts.makeready.domain.AttachmentRecord;
import com.phillippitts.makeready.domain.Midspan;
import com.phillippitts.makeready.domain.NeutralWire;
import com.phillippitts.makeready.domain.SpanBlock;
import com.phillippitts.makeready.domain.SpanHeader;
import com.phillippitts.makeready.service.attachment.AttachmentConsolidator;
import com.phillippitts.makeready.service.neutral.NeutralPatterns;
import com.phillippitts.makeready.service.span.SpanHeaderFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Composes the final attacher list of a pole: primary attachments, then the backspan block,
 * then reference blocks.
 *
 * <p>Span block attachments are kept when strictly below the reference height or when they are
 * neutrals. The reference height is the governing neutral, else the highest primary attachment;
 * without either nothing is filtered.
 */
public final class FinalAttacherListBuilder {

    /**
     * @param primary    below-neutral attachments of the pole
     * @param backspan   backspan block, if any
     * @param references reference-span blocks in connection order
     * @param neutral    governing neutral, if any
     */
    public List<AttacherLine> build(List<AttachmentRecord> primary, Optional<SpanBlock> backspan,
                                    List<SpanBlock> references, Optional<NeutralWire> neutral) {
        List<AttachmentRecord> sorted = new ArrayList<>(primary);
        sorted.sort(AttachmentConsolidator.BY_HEIGHT_DESCENDING);

        Double limit = neutral.map(NeutralWire::heightInches)
                .orElseGet(() -> sorted.isEmpty() ? null : sorted.get(0).sortHeight());

        List<AttacherLine> lines = new ArrayList<>(sorted);
        backspan.ifPresent(block -> appendBlock(lines, block.header(), block.attachments(), limit, false));
        for (SpanBlock block : references) {
            appendBlock(lines, referenceHeader(block.header()), block.attachments(), limit, true);
        }
        return lines;
    }

    private static void appendBlock(List<AttacherLine> lines, SpanHeader header,
                                    List<AttachmentRecord> attachments, Double limit, boolean reference) {
        lines.add(header);
        for (AttachmentRecord record : attachments) {
            if (!keep(record, limit)) {
                continue;
            }
            lines.add(reference ? fiberMidspan(record) : record);
        }
    }

    static boolean keep(AttachmentRecord record, Double limit) {
        if (limit == null) {
            return true;
        }
        return record.sortHeight() < limit || record.neutral() || NeutralPatterns.matches(record.description());
    }

    // Fiber on a reference span reports its attachment height as midspan when none was measured
    static AttachmentRecord fiberMidspan(AttachmentRecord record) {
        String text = record.description().toLowerCase(Locale.ROOT);
        boolean fiber = text.contains("fiber") || text.contains("optic");
        if (fiber && !record.midspan().isSet() && record.hasExisting()) {
            return record.withMidspan(Midspan.ofInches(record.existingHeight()));
        }
        return record;
    }

    private static SpanHeader referenceHeader(SpanHeader header) {
        if (header.description().toLowerCase(Locale.ROOT).contains("south east")) {
            return header.withStyleHint(SpanHeaderFactory.PURPLE);
        }
        return header;
    }
}
