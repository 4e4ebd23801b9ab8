package com.phillippitts.makeready.domain;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a batch: ordered pole reports and the poles that failed.
 */
public record ReportResult(String batchId, List<PoleReport> poles, List<PoleFailure> failures) {

    public ReportResult {
        poles = poles == null ? List.of() : List.copyOf(poles);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("batch_id", batchId);
        body.put("poles", poles.stream().map(PoleReport::toMap).toList());
        body.put("failures", failures.stream().map(PoleFailure::toMap).toList());
        return body;
    }
}
