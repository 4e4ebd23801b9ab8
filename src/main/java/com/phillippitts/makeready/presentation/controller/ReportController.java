package com.phillippitts.makeready.presentation.controller;

import com.phillippitts.makeready.domain.ConflictStrategy;
import com.phillippitts.makeready.domain.ReportRequest;
import com.phillippitts.makeready.domain.ReportResult;
import com.phillippitts.makeready.exception.InvalidSourceDocumentException;
import com.phillippitts.makeready.service.report.MakeReadyReportService;
import com.phillippitts.makeready.service.source.SourceDocumentParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Thin JSON entry point over {@link MakeReadyReportService}.
 *
 * <p>Body: {@code {"survey": {...}, "engineering": {...}, "targetPoles": [...],
 * "attributeStrategy": "...", "heightStrategy": "...", "batchId": "..."}}; only
 * {@code survey} is required.
 */
@RestController
class ReportController {

    private static final Logger LOG = LogManager.getLogger(ReportController.class);

    static final String REQUEST = "request";

    private final MakeReadyReportService reportService;

    ReportController(MakeReadyReportService reportService) {
        this.reportService = reportService;
    }

    @PostMapping(path = "/api/v1/reports", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<Map<String, Object>> generate(@RequestBody String body) {
        ReportRequest request = toRequest(SourceDocumentParser.parse(REQUEST, body));
        ReportResult result = reportService.generate(request);
        LOG.info("Report generated: {} poles, {} failures", result.poles().size(), result.failures().size());
        return ResponseEntity.ok(result.toMap());
    }

    static ReportRequest toRequest(JSONObject body) {
        JSONObject survey = body.optJSONObject(SourceDocumentParser.SURVEY);
        if (survey == null) {
            throw new InvalidSourceDocumentException(SourceDocumentParser.SURVEY, "missing or not an object");
        }
        Object engineering = body.opt(SourceDocumentParser.ENGINEERING);
        if (engineering != null && !JSONObject.NULL.equals(engineering) && !(engineering instanceof JSONObject)) {
            throw new InvalidSourceDocumentException(SourceDocumentParser.ENGINEERING, "not an object");
        }
        return new ReportRequest(
                survey,
                engineering instanceof JSONObject object ? object : null,
                targetPoles(body.optJSONArray("targetPoles")),
                strategy(body, "attributeStrategy"),
                strategy(body, "heightStrategy"),
                body.optString("batchId", null));
    }

    private static List<String> targetPoles(JSONArray array) {
        List<String> poles = new ArrayList<>();
        if (array == null) {
            return poles;
        }
        for (int i = 0; i < array.length(); i++) {
            String pole = array.optString(i, "").trim();
            if (!pole.isEmpty()) {
                poles.add(pole);
            }
        }
        return poles;
    }

    private static ConflictStrategy strategy(JSONObject body, String key) {
        String value = body.optString(key, "").trim();
        if (value.isEmpty()) {
            return null;
        }
        try {
            return ConflictStrategy.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidSourceDocumentException(REQUEST, "unknown " + key + " '" + value + "'", e);
        }
    }
}
