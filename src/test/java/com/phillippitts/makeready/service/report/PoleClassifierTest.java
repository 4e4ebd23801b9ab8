package com.phillippitts.makeready.service.report;

import com.phillippitts.makeready.domain.AttachmentRecord;
import com.phillippitts.makeready.domain.PoleAction;
import com.phillippitts.makeready.domain.PoleStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PoleClassifierTest {

    private final PoleClassifier classifier = new PoleClassifier(85.0);

    @Test
    void newInstallMeansInstalling() {
        assertThat(classifier.action(List.of(
                AttachmentRecord.existing("A", 300),
                AttachmentRecord.newInstall("B", 280)))).isEqualTo(PoleAction.INSTALLING);
    }

    @Test
    void existingWithoutProposedHeightMeansRemoving() {
        assertThat(classifier.action(List.of(
                AttachmentRecord.existing("A", 300).withProposedHeight(290.0),
                AttachmentRecord.existing("B", 280)))).isEqualTo(PoleAction.REMOVING);
    }

    @Test
    void everyAttachmentMovedMeansExisting() {
        assertThat(classifier.action(List.of(
                AttachmentRecord.existing("A", 300).withProposedHeight(290.0)))).isEqualTo(PoleAction.EXISTING);
        assertThat(classifier.action(List.of())).isEqualTo(PoleAction.EXISTING);
    }

    @Test
    void lowCapacityOverridesNotes() {
        assertThat(classifier.status("Lower fiber", 80.0)).isEqualTo(PoleStatus.ISSUE_DETECTED);
        assertThat(classifier.status("Lower fiber", 85.0)).isEqualTo(PoleStatus.MAKE_READY_REQUIRED);
        assertThat(classifier.status("  ", null)).isEqualTo(PoleStatus.NO_CHANGE);
        assertThat(classifier.getPassingCapacityThreshold()).isEqualTo(85.0);
    }
}
