package com.phillippitts.makeready.domain;

import org.json.JSONObject;

import java.util.List;
import java.util.Objects;

/**
 * One reconciliation batch: the parsed source documents and the options that apply to them.
 *
 * @param survey            survey document (required)
 * @param engineering       engineering document, or null for a survey-only run
 * @param targetPoles       pole ids restricting the batch; empty means every pole
 * @param attributeStrategy attribute conflict strategy, or null for the configured default
 * @param heightStrategy    advisory height strategy, or null for the configured default
 * @param batchId           correlation id for logs, or null to generate one
 */
public record ReportRequest(
        JSONObject survey,
        JSONObject engineering,
        List<String> targetPoles,
        ConflictStrategy attributeStrategy,
        ConflictStrategy heightStrategy,
        String batchId
) {

    public ReportRequest {
        Objects.requireNonNull(survey, "survey must not be null");
        targetPoles = targetPoles == null ? List.of() : List.copyOf(targetPoles);
    }

    public static ReportRequest of(JSONObject survey, JSONObject engineering) {
        return new ReportRequest(survey, engineering, List.of(), null, null, null);
    }

    public ReportRequest withTargetPoles(List<String> poles) {
        return new ReportRequest(survey, engineering, poles, attributeStrategy, heightStrategy, batchId);
    }

    public ReportRequest withStrategies(ConflictStrategy attributes, ConflictStrategy heights) {
        return new ReportRequest(survey, engineering, targetPoles, attributes, heights, batchId);
    }

    public boolean hasEngineering() {
        return engineering != null && !engineering.isEmpty();
    }
}
