package com.phillippitts.makeready.service.attachment;

import com.phillippitts.makeready.TestResourceLoader;
import com.phillippitts.makeready.domain.AttachmentRecord;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EngineeringAttachmentExtractorTest {

    private EngineeringAttachmentExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new EngineeringAttachmentExtractor(0.1);
    }

    @Test
    void recommendedHeightBecomesProposed() throws Exception {
        JSONObject engineering = TestResourceLoader.loadJson("/fixtures/engineering-basic.json");
        JSONObject location = engineering.getJSONArray("leads").getJSONObject(0)
                .getJSONArray("locations").getJSONObject(0);

        List<AttachmentRecord> records = distinct(extractor.extract(location).values());

        assertThat(records).hasSize(1);
        AttachmentRecord fiber = records.get(0);
        assertThat(fiber.description()).isEqualTo("PROVIDER Fiber Optic");
        assertThat(fiber.existingHeightText()).isEqualTo("25'-0\"");
        assertThat(fiber.proposedHeightText()).isEqualTo("24'-2\"");
        assertThat(fiber.isMoved()).isTrue();
    }

    @Test
    void unmatchedRecommendedItemIsNewInstallAndSmallDriftIsIgnored() {
        JSONObject location = new JSONObject("{\"designs\":["
                + "{\"label\":\"Measured Design\",\"structure\":{\"wires\":["
                + wire("m1", "AT&T", "Telco", "Telco", 6.0) + "]}},"
                + "{\"label\":\"Recommended Design\",\"structure\":{\"wires\":["
                + wire("r1", "AT&T", "Telco", "Telco", 6.001) + ","
                + wire("r2", "Charter", "Fiber", "Fiber", 5.5) + "]}}]}");

        List<AttachmentRecord> records = distinct(extractor.extract(location).values());

        assertThat(records).hasSize(2);
        assertThat(records.get(0).description()).isEqualTo("AT&T Telco Com");
        assertThat(records.get(0).hasProposed()).isFalse();
        assertThat(records.get(1).description()).isEqualTo("Charter/Spectrum Fiber Optic");
        assertThat(records.get(1).isNewInstall()).isTrue();
    }

    @Test
    void charterItemsMatchOnSharedKeyword() {
        JSONObject location = new JSONObject("{\"designs\":["
                + "{\"label\":\"Measured Design\",\"structure\":{\"wires\":["
                + wire("m1", "Charter", "Spectrum Coax", "Coax", 6.0) + "]}},"
                + "{\"label\":\"Recommended Design\",\"structure\":{\"wires\":["
                + wire("r9", "Spectrum", "Charter coax cable", "Cable", 5.8) + "]}}]}");

        List<AttachmentRecord> records = distinct(extractor.extract(location).values());

        assertThat(records).hasSize(1);
        assertThat(records.get(0).isMoved()).isTrue();
    }

    @Test
    void locationWithoutDesignsYieldsNothing() {
        assertThat(extractor.extract(new JSONObject("{\"designs\":[]}"))).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }

    private static String wire(String id, String owner, String description, String type, double meters) {
        return "{\"id\":\"" + id + "\",\"owner\":{\"id\":\"" + owner + "\"},"
                + "\"clientItem\":{\"description\":\"" + description + "\",\"type\":\"" + type + "\"},"
                + "\"attachmentHeight\":{\"value\":" + meters + "}}";
    }

    private static List<AttachmentRecord> distinct(java.util.Collection<AttachmentRecord> records) {
        return records.stream().distinct().toList();
    }
}
