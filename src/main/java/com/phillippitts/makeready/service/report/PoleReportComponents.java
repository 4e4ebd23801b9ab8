package com.phillippitts.makeready.service.report;

import com.phillippitts.makeready.service.attachment.AttachmentConsolidator;
import com.phillippitts.makeready.service.attachment.EngineeringAttachmentExtractor;
import com.phillippitts.makeready.service.attribute.PoleAttributeResolver;
import com.phillippitts.makeready.service.equipment.ProposedEquipmentCounter;
import com.phillippitts.makeready.service.neutral.NeutralIdentifier;

import java.util.Objects;

/**
 * Groups the document-independent collaborators of the per-pole pipeline for cleaner
 * constructor injection. Collaborators bound to one batch's documents are created by
 * {@link PoleReportProcessor} itself.
 */
public final class PoleReportComponents {
    private final PoleAttributeResolver attributeResolver;
    private final EngineeringAttachmentExtractor engineeringExtractor;
    private final AttachmentConsolidator consolidator;
    private final NeutralIdentifier neutralIdentifier;
    private final ProposedEquipmentCounter equipmentCounter;
    private final FinalAttacherListBuilder finalListBuilder;
    private final PoleClassifier classifier;

    public PoleReportComponents(PoleAttributeResolver attributeResolver,
                                EngineeringAttachmentExtractor engineeringExtractor,
                                AttachmentConsolidator consolidator,
                                NeutralIdentifier neutralIdentifier,
                                ProposedEquipmentCounter equipmentCounter,
                                FinalAttacherListBuilder finalListBuilder,
                                PoleClassifier classifier) {
        this.attributeResolver = Objects.requireNonNull(attributeResolver, "attributeResolver");
        this.engineeringExtractor = Objects.requireNonNull(engineeringExtractor, "engineeringExtractor");
        this.consolidator = Objects.requireNonNull(consolidator, "consolidator");
        this.neutralIdentifier = Objects.requireNonNull(neutralIdentifier, "neutralIdentifier");
        this.equipmentCounter = Objects.requireNonNull(equipmentCounter, "equipmentCounter");
        this.finalListBuilder = Objects.requireNonNull(finalListBuilder, "finalListBuilder");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public PoleAttributeResolver getAttributeResolver() {
        return attributeResolver;
    }

    public EngineeringAttachmentExtractor getEngineeringExtractor() {
        return engineeringExtractor;
    }

    public AttachmentConsolidator getConsolidator() {
        return consolidator;
    }

    public NeutralIdentifier getNeutralIdentifier() {
        return neutralIdentifier;
    }

    public ProposedEquipmentCounter getEquipmentCounter() {
        return equipmentCounter;
    }

    public FinalAttacherListBuilder getFinalListBuilder() {
        return finalListBuilder;
    }

    public PoleClassifier getClassifier() {
        return classifier;
    }
}
