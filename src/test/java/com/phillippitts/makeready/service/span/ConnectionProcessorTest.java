package com.phillippitts.makeready.service.span;

import com.phillippitts.makeready.TestResourceLoader;
import com.phillippitts.makeready.domain.AttachmentRecord;
import com.phillippitts.makeready.domain.SpanBlock;
import com.phillippitts.makeready.domain.SpanKind;
import com.phillippitts.makeready.domain.SpanMidspanHeights;
import com.phillippitts.makeready.service.source.SourceIndex;
import com.phillippitts.makeready.service.source.SourceIndexBuilder;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionProcessorTest {

    @Test
    void summarizesPrimarySpanAndMidspans() throws Exception {
        ConnectionProcessor processor = new ConnectionProcessor(fixtureIndex());

        ConnectionResult result = processor.process("n1", "PL410620");

        assertThat(result.connections()).hasSize(1);
        assertThat(result.primarySpan().toPole()).isEqualTo("PL410621");
        assertThat(result.primarySpan().toMap())
                .containsEntry("lowest_com", "24'-2\"")
                .containsEntry("lowest_cps_electrical", "N/A");
        assertThat(result.referenceSpans()).isEmpty();
        assertThat(result.backspanBlock()).isEmpty();
        assertThat(result.spanWires()).hasSize(2);
        assertThat(result.midspanHeights()).singleElement()
                .extracting(SpanMidspanHeights::communicationText).isEqualTo("24'-2\"");
    }

    @Test
    void previousPoleInSequenceBecomesBackspan() throws Exception {
        ConnectionProcessor processor = new ConnectionProcessor(fixtureIndex());

        ConnectionResult result = processor.process("n2", "PL410621");

        SpanBlock backspan = result.backspanBlock().orElseThrow();
        assertThat(backspan.kind()).isEqualTo(SpanKind.BACKSPAN);
        assertThat(backspan.header().description()).isEqualTo("Ref (Backspan) to 410620");
        assertThat(backspan.attachments()).extracting(AttachmentRecord::description)
                .containsExactly("UTILITY Neutral", "PROVIDER Fiber");
    }

    @Test
    void referenceSpanIsNeverAlsoBackspan() {
        JSONObject survey = new JSONObject("{"
                + "\"nodes\":{"
                + "\"a\":{\"button\":\"aerial\",\"latitude\":0,\"longitude\":0,"
                + "\"attributes\":{\"PoleNumber\":{\"-Imported\":\"PL100\"}}},"
                + "\"b\":{\"button\":\"aerial\",\"latitude\":1,\"longitude\":1,"
                + "\"attributes\":{\"PoleNumber\":{\"-Imported\":\"PL200\"}}}},"
                + "\"connections\":{\"c1\":{\"node_id_1\":\"a\",\"node_id_2\":\"b\","
                + "\"attributes\":{\"connection_type\":{\"button_added\":\"reference\"}},"
                + "\"sections\":{\"s1\":{\"photos\":[\"p1\"]}}}},"
                + "\"photos\":{\"p1\":{\"photofirst_data\":{\"wire\":[{\"_trace\":\"t\",\"_measured_height\":250}]}}},"
                + "\"traces\":{\"t\":{\"company\":\"AT&T\",\"cable_type\":\"Telco\"}}}");
        JSONObject engineering = new JSONObject(
                "{\"leads\":[{\"locations\":[{\"label\":\"PL100\"},{\"label\":\"PL200\"}]}]}");
        ConnectionProcessor processor = new ConnectionProcessor(SourceIndexBuilder.build(survey, engineering));

        ConnectionResult result = processor.process("b", "PL200");

        assertThat(result.backspanBlock()).isEmpty();
        assertThat(result.referenceSpans()).singleElement().satisfies(block -> {
            assertThat(block.header().description()).isEqualTo("Ref (South West) to PL100");
            assertThat(block.header().styleHint()).isEqualTo("orange");
            assertThat(block.attachments()).extracting(AttachmentRecord::description).containsExactly("AT&T Telco");
        });
    }

    @Test
    void poleWithoutConnectionsHasEmptyPrimarySpan() throws Exception {
        ConnectionProcessor processor = new ConnectionProcessor(fixtureIndex());

        ConnectionResult result = processor.process("n3", null);

        assertThat(result.connections()).isEmpty();
        assertThat(result.primarySpan().hasKnownTarget()).isFalse();
    }

    private static SourceIndex fixtureIndex() throws Exception {
        return SourceIndexBuilder.build(
                TestResourceLoader.loadJson("/fixtures/survey-basic.json"),
                TestResourceLoader.loadJson("/fixtures/engineering-basic.json"));
    }
}
