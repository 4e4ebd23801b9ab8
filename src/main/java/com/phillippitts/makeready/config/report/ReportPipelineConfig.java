package com.phillippitts.makeready.config.report;

import com.phillippitts.makeready.config.properties.ReportProperties;
import com.phillippitts.makeready.service.attachment.AttachmentConsolidator;
import com.phillippitts.makeready.service.attachment.EngineeringAttachmentExtractor;
import com.phillippitts.makeready.service.attribute.PoleAttributeResolver;
import com.phillippitts.makeready.service.equipment.ProposedEquipmentCounter;
import com.phillippitts.makeready.service.metrics.ReportMetricsPublisher;
import com.phillippitts.makeready.service.neutral.NeutralIdentifier;
import com.phillippitts.makeready.service.reconcile.AttributeReconcilers;
import com.phillippitts.makeready.service.report.DefaultMakeReadyReportService;
import com.phillippitts.makeready.service.report.FinalAttacherListBuilder;
import com.phillippitts.makeready.service.report.MakeReadyReportService;
import com.phillippitts.makeready.service.report.PoleClassifier;
import com.phillippitts.makeready.service.report.PoleReportComponents;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the report pipeline explicitly. Collaborators bound to one batch's documents are built
 * per request by the pipeline itself; everything here is stateless and shared.
 */
@Configuration
public class ReportPipelineConfig {

    private final ReportProperties props;

    public ReportPipelineConfig(ReportProperties props) {
        this.props = props;
    }

    @Bean
    public PoleAttributeResolver poleAttributeResolver(AttributeReconcilers reconcilers) {
        return new PoleAttributeResolver(reconcilers);
    }

    @Bean
    public EngineeringAttachmentExtractor engineeringAttachmentExtractor() {
        return new EngineeringAttachmentExtractor(props.getHeightChangeToleranceInches());
    }

    @Bean
    public NeutralIdentifier neutralIdentifier() {
        return new NeutralIdentifier(props.getNeutralMatchToleranceInches());
    }

    @Bean
    public PoleClassifier poleClassifier() {
        return new PoleClassifier(props.getPassingCapacityThreshold());
    }

    @Bean
    public PoleReportComponents poleReportComponents(PoleAttributeResolver attributeResolver,
                                                     EngineeringAttachmentExtractor engineeringExtractor,
                                                     NeutralIdentifier neutralIdentifier,
                                                     PoleClassifier classifier) {
        return new PoleReportComponents(attributeResolver, engineeringExtractor, new AttachmentConsolidator(),
                neutralIdentifier, new ProposedEquipmentCounter(), new FinalAttacherListBuilder(), classifier);
    }

    @Bean
    public MakeReadyReportService makeReadyReportService(PoleReportComponents components,
                                                         ReportMetricsPublisher metricsPublisher) {
        return new DefaultMakeReadyReportService(components, props, metricsPublisher);
    }
}
