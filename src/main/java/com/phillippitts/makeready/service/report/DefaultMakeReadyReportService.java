package com.phillippitts.makeready.service.report;

import com.phillippitts.makeready.config.logging.BatchLoggingContext;
import com.phillippitts.makeready.config.properties.ReportProperties;
import com.phillippitts.makeready.domain.ConflictStrategy;
import com.phillippitts.makeready.domain.PoleFailure;
import com.phillippitts.makeready.domain.PoleReport;
import com.phillippitts.makeready.domain.ReportRequest;
import com.phillippitts.makeready.domain.ReportResult;
import com.phillippitts.makeready.exception.PoleProcessingException;
import com.phillippitts.makeready.exception.PoleProcessingExceptionBuilder;
import com.phillippitts.makeready.service.metrics.ReportMetricsPublisher;
import com.phillippitts.makeready.service.source.SourceIndex;
import com.phillippitts.makeready.service.source.SourceIndexBuilder;
import com.phillippitts.makeready.service.survey.PoleLabelResolver;
import com.phillippitts.makeready.util.JsonTrees;
import com.phillippitts.makeready.util.PoleIds;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Default {@link MakeReadyReportService}: sequential, one pole at a time.
 *
 * <p>Each batch opens a {@link BatchLoggingContext} so every log line of the batch carries its
 * id, and each pole is tagged while it is being built. The height strategy is advisory: it is
 * logged with the batch while attachment heights follow the merge rules.
 */
public final class DefaultMakeReadyReportService implements MakeReadyReportService {

    private static final Logger LOG = LogManager.getLogger(DefaultMakeReadyReportService.class);

    private final PoleReportComponents components;
    private final ReportProperties props;
    private final ReportMetricsPublisher metrics;

    /**
     * @param components shared pipeline collaborators
     * @param props      report configuration
     * @param metrics    metrics publisher (use {@link ReportMetricsPublisher#NOOP} in tests)
     * @throws NullPointerException if any parameter is null
     */
    public DefaultMakeReadyReportService(PoleReportComponents components,
                                         ReportProperties props,
                                         ReportMetricsPublisher metrics) {
        this.components = Objects.requireNonNull(components, "components must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    @Override
    public ReportResult generate(ReportRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        ConflictStrategy attributeStrategy = request.attributeStrategy() != null
                ? request.attributeStrategy() : props.getAttributeStrategy();
        ConflictStrategy heightStrategy = request.heightStrategy() != null
                ? request.heightStrategy() : props.getHeightStrategy();

        try (BatchLoggingContext context = BatchLoggingContext.open(request.batchId(), attributeStrategy.name())) {
            long start = System.nanoTime();
            LOG.info("Report batch started: attributes={}, heights={} (advisory), targets={}",
                    attributeStrategy, heightStrategy,
                    request.targetPoles().isEmpty() ? "all" : request.targetPoles().size());

            SourceIndex index = SourceIndexBuilder.build(request.survey(),
                    request.hasEngineering() ? request.engineering() : null);
            PoleReportProcessor processor = new PoleReportProcessor(index, components, attributeStrategy, metrics);
            Set<String> targets = normalizedTargets(request.targetPoles());

            List<PoleReport> reports = new ArrayList<>();
            List<PoleFailure> failures = new ArrayList<>();
            JSONObject nodes = JsonTrees.object(request.survey(), "nodes");
            for (String nodeId : JsonTrees.sortedKeys(nodes)) {
                JSONObject node = nodes.optJSONObject(nodeId);
                if (node == null || !PoleLabelResolver.isPoleNode(node)) {
                    LOG.debug("Skipping non-pole node {}", nodeId);
                    continue;
                }
                String poleNumber = PoleLabelResolver.poleNumber(node);
                if (poleNumber == null) {
                    LOG.debug("Skipping pole node {} without a pole number", nodeId);
                    continue;
                }
                if (!request.targetPoles().isEmpty() && !targets.contains(PoleIds.normalize(poleNumber))) {
                    continue;
                }

                try (BatchLoggingContext.PoleScope ignored = context.pole(poleNumber)) {
                    reports.add(processor.process(nodeId, node, poleNumber));
                    metrics.recordPoleProcessed();
                } catch (RuntimeException e) {
                    PoleProcessingException failure = PoleProcessingExceptionBuilder
                            .create("Failed to build pole report")
                            .node(nodeId)
                            .pole(poleNumber)
                            .metadata("error", e.getClass().getSimpleName())
                            .cause(e)
                            .build();
                    LOG.error(failure.getMessage(), e);
                    metrics.recordPoleFailed();
                    if (props.getFailurePolicy() == ReportProperties.FailurePolicy.ABORT_BATCH) {
                        throw failure;
                    }
                    failures.add(new PoleFailure(nodeId, poleNumber, failure.getMessage()));
                }
            }

            reports.sort(Comparator.comparingInt(report -> sequencePosition(index, report)));
            metrics.recordBatch(attributeStrategy.name(), System.nanoTime() - start);
            LOG.info("Report batch finished: {} poles, {} failures", reports.size(), failures.size());
            return new ReportResult(context.batchId(), reports, failures);
        }
    }

    private static Set<String> normalizedTargets(List<String> targetPoles) {
        return targetPoles.stream()
                .map(PoleIds::normalize)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
    }

    // Poles outside the engineering sequence keep their survey order after the sequenced ones
    private static int sequencePosition(SourceIndex index, PoleReport report) {
        int position = index.sequenceIndex(report.normalizedPoleNumber());
        return position < 0 ? Integer.MAX_VALUE : position;
    }
}
