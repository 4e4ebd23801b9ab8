package com.phillippitts.makeready.service.report;

import com.phillippitts.makeready.domain.AttachmentRecord;
import com.phillippitts.makeready.domain.PoleAction;
import com.phillippitts.makeready.domain.PoleStatus;

import java.util.List;

/**
 * Derives the pole-level action and status columns.
 */
public final class PoleClassifier {

    private final double passingCapacityThreshold;

    /**
     * @param passingCapacityThreshold percent below which a pole is flagged
     */
    public PoleClassifier(double passingCapacityThreshold) {
        this.passingCapacityThreshold = passingCapacityThreshold;
    }

    /**
     * Installing when any attachment is new, else removing when any existing attachment has no
     * proposed height and no proposed flag, else existing.
     */
    public PoleAction action(List<AttachmentRecord> attachments) {
        boolean removal = false;
        for (AttachmentRecord record : attachments) {
            if (!record.hasExisting()) {
                return PoleAction.INSTALLING;
            }
            if (!record.hasProposed() && !record.proposed()) {
                removal = true;
            }
        }
        return removal ? PoleAction.REMOVING : PoleAction.EXISTING;
    }

    /**
     * @param makeReadyNotes  survey make-ready notes (nullable)
     * @param passingCapacity passing capacity percent (nullable)
     */
    public PoleStatus status(String makeReadyNotes, Double passingCapacity) {
        if (passingCapacity != null && passingCapacity < passingCapacityThreshold) {
            return PoleStatus.ISSUE_DETECTED;
        }
        if (makeReadyNotes != null && !makeReadyNotes.isBlank()) {
            return PoleStatus.MAKE_READY_REQUIRED;
        }
        return PoleStatus.NO_CHANGE;
    }

    public double getPassingCapacityThreshold() {
        return passingCapacityThreshold;
    }
}
