package com.phillippitts.makeready;

import com.phillippitts.makeready.domain.PoleReport;
import com.phillippitts.makeready.domain.ReportRequest;
import com.phillippitts.makeready.domain.ReportResult;
import com.phillippitts.makeready.service.report.MakeReadyReportService;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@SpringBootTest(
    properties = {
        "makeready.report.attribute-strategy=HIGHLIGHT_DIFFERENCES",
        "makeready.report.failure-policy=SKIP_AND_COLLECT"
    }
)
class MakeReadyApplicationTests {

    @Autowired
    private MakeReadyReportService reportService;

    @Test
    void contextLoads() {
        assertThat(reportService).isNotNull();
    }

    @Test
    void generatesReportFromFixtures() throws Exception {
        ReportResult result = reportService.generate(ReportRequest.of(
                TestResourceLoader.loadJson("/fixtures/survey-basic.json"),
                TestResourceLoader.loadJson("/fixtures/engineering-basic.json")));

        assertThat(result.poles()).extracting(PoleReport::poleNumber).containsExactly("PL410620", "PL410621");
        assertThat(result.failures()).isEmpty();
    }
}
