package com.phillippitts.makeready.presentation.controller;

import com.phillippitts.makeready.domain.ConflictStrategy;
import com.phillippitts.makeready.domain.ReportRequest;
import com.phillippitts.makeready.domain.ReportResult;
import com.phillippitts.makeready.exception.InvalidSourceDocumentException;
import com.phillippitts.makeready.service.report.MakeReadyReportService;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ReportControllerTest {

    private MakeReadyReportService service;
    private ReportController controller;

    @BeforeEach
    void setUp() {
        service = mock(MakeReadyReportService.class);
        controller = new ReportController(service);
    }

    @Test
    void mapsBodyToRequest() {
        when(service.generate(any())).thenReturn(new ReportResult("b-1", List.of(), List.of()));

        ResponseEntity<Map<String, Object>> response = controller.generate("{"
                + "\"survey\":{\"nodes\":{}},\"engineering\":{\"leads\":[]},"
                + "\"targetPoles\":[\"PL410620\",\" \"],"
                + "\"attributeStrategy\":\"prefer_survey\",\"batchId\":\"b-1\"}");

        ArgumentCaptor<ReportRequest> captor = ArgumentCaptor.forClass(ReportRequest.class);
        verify(service).generate(captor.capture());
        ReportRequest request = captor.getValue();
        assertThat(request.targetPoles()).containsExactly("PL410620");
        assertThat(request.attributeStrategy()).isEqualTo(ConflictStrategy.PREFER_SURVEY);
        assertThat(request.heightStrategy()).isNull();
        assertThat(request.batchId()).isEqualTo("b-1");
        assertThat(request.engineering()).isNotNull();
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).containsEntry("batch_id", "b-1");
    }

    @Test
    void engineeringIsOptional() {
        ReportRequest request = ReportController.toRequest(
                new JSONObject("{\"survey\":{\"nodes\":{}},\"engineering\":null}"));

        assertThat(request.engineering()).isNull();
        assertThat(request.hasEngineering()).isFalse();
        assertThat(request.batchId()).isNull();
    }

    @Test
    void rejectsMissingSurvey() {
        assertThatThrownBy(() -> controller.generate("{\"engineering\":{}}"))
                .isInstanceOf(InvalidSourceDocumentException.class)
                .hasMessage("Invalid survey document: missing or not an object");
        verifyNoInteractions(service);
    }

    @Test
    void rejectsUnknownStrategy() {
        assertThatThrownBy(() -> ReportController.toRequest(
                new JSONObject("{\"survey\":{\"nodes\":{}},\"heightStrategy\":\"newest\"}")))
                .isInstanceOf(InvalidSourceDocumentException.class)
                .hasMessageContaining("unknown heightStrategy 'newest'");
    }

    @Test
    void rejectsNonObjectEngineering() {
        assertThatThrownBy(() -> ReportController.toRequest(
                new JSONObject("{\"survey\":{\"nodes\":{}},\"engineering\":[1]}")))
                .isInstanceOf(InvalidSourceDocumentException.class)
                .hasMessage("Invalid engineering document: not an object");
    }
}
