package com.phillippitts.makeready.service.neutral;

import com.phillippitts.makeready.domain.AttachmentRecord;
import com.phillippitts.makeready.domain.NeutralWire;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of below-neutral filtering for one pole.
 *
 * @param neutral      governing neutral, or null when the pole has none
 * @param belowNeutral attachments at or below the neutral, the neutral itself included
 */
public record NeutralFilterResult(NeutralWire neutral, List<AttachmentRecord> belowNeutral) {

    public NeutralFilterResult {
        belowNeutral = belowNeutral == null ? List.of() : List.copyOf(belowNeutral);
    }

    public Optional<NeutralWire> governingNeutral() {
        return Optional.ofNullable(neutral);
    }

    public boolean neutralFound() {
        return neutral != null;
    }
}
