package com.phillippitts.makeready.service.report;

import com.phillippitts.makeready.domain.ReportRequest;
import com.phillippitts.makeready.domain.ReportResult;

/**
 * Batch entry point: reconciles a survey document and an optional engineering document into
 * one report record per pole.
 *
 * <p><b>Processing:</b>
 * <ol>
 *   <li>Validate both documents and build the shared indices (trace lookup, pole sequence,
 *       engineering locations)</li>
 *   <li>Visit every survey pole node in key order, skipping poles outside the target list</li>
 *   <li>Build each pole's record independently</li>
 *   <li>Order the records by engineering sequence, poles unknown to the engineering data last</li>
 * </ol>
 *
 * <p><b>Failures:</b> a malformed document fails the whole batch before any pole is built.
 * A pole that cannot be built is either collected as a
 * {@link com.phillippitts.makeready.domain.PoleFailure} or aborts the batch, depending on the
 * configured failure policy.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * MakeReadyReportService service = ...;
 * ReportResult result = service.generate(ReportRequest.of(survey, engineering));
 * result.poles().forEach(pole -> render(pole.toMap()));
 * }</pre>
 *
 * @see com.phillippitts.makeready.config.properties.ReportProperties
 */
public interface MakeReadyReportService {

    /**
     * Generates the report for one batch.
     *
     * @param request parsed documents and options
     * @return ordered pole records and collected failures
     * @throws com.phillippitts.makeready.exception.InvalidSourceDocumentException if a document is malformed
     * @throws com.phillippitts.makeready.exception.PoleProcessingException if a pole fails under
     *         {@code ABORT_BATCH}
     * @throws NullPointerException if request is null
     */
    ReportResult generate(ReportRequest request);
}
