package com.phillippitts.makeready.service.attachment;

import com.phillippitts.makeready.TestResourceLoader;
import com.phillippitts.makeready.domain.AttachmentRecord;
import com.phillippitts.makeready.domain.Midspan;
import com.phillippitts.makeready.service.survey.TraceResolver;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SurveyAttachmentExtractorTest {

    @Test
    void extractsPoleWiresFromFixture() throws Exception {
        JSONObject survey = TestResourceLoader.loadJson("/fixtures/survey-basic.json");
        SurveyAttachmentExtractor extractor = new SurveyAttachmentExtractor(survey, new TraceResolver(survey));

        Map<String, AttachmentRecord> records = extractor.extract(survey.getJSONObject("nodes").getJSONObject("n1"));

        assertThat(records).containsOnlyKeys("Neutral", "PROVIDER Fiber Optic");
        assertThat(records.get("Neutral").existingHeightText()).isEqualTo("28'-0\"");
        assertThat(records.get("PROVIDER Fiber Optic").existingHeight()).isEqualTo(300.0);
        assertThat(records.get("PROVIDER Fiber Optic").midspan()).isEqualTo(Midspan.UNSET);
    }

    @Test
    void keepsTallestReadingAndFlagsProposedAndUnderground() {
        JSONObject survey = new JSONObject("{"
                + "\"nodes\":{\"n\":{\"photos\":{\"p\":{\"photofirst_data\":{\"wire\":["
                + "{\"_trace\":\"a\",\"_measured_height\":250},"
                + "{\"_trace\":\"a\",\"_measured_height\":260,\"_midspan_height\":220},"
                + "{\"_trace\":\"b\",\"_measured_height\":\"20'-0\\\"\"},"
                + "{\"_trace\":\"c\",\"_measured_height\":200},"
                + "{\"_trace\":\"a\",\"_measured_height\":0},"
                + "{\"_measured_height\":100}]}}}}},"
                + "\"traces\":{\"a\":{\"company\":\"AT&T\",\"cable_type\":\"Telco\"},"
                + "\"b\":{\"company\":\"Charter\",\"cable_type\":\"Fiber\",\"proposed\":true},"
                + "\"c\":{\"company\":\"AT&T\",\"cable_type\":\"Riser\"}}}");
        SurveyAttachmentExtractor extractor = new SurveyAttachmentExtractor(survey, new TraceResolver(survey));

        Map<String, AttachmentRecord> records = extractor.extract(survey.getJSONObject("nodes").getJSONObject("n"));

        assertThat(records.get("AT&T Telco Com").existingHeight()).isEqualTo(260.0);
        assertThat(records.get("AT&T Telco Com").midspan().format()).isEqualTo("18'-4\"");
        AttachmentRecord proposed = records.get("Charter/Spectrum Fiber Optic");
        assertThat(proposed.isNewInstall()).isTrue();
        assertThat(proposed.proposedHeight()).isEqualTo(240.0);
        assertThat(records.get("AT&T Riser").underground()).isTrue();
        assertThat(records.get("AT&T Riser").midspan().format()).isEqualTo("UG");
        assertThat(records).hasSize(3);
    }
}
