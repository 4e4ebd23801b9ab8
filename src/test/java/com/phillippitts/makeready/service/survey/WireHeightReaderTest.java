package com.phillippitts.makeready.service.survey;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class WireHeightReaderTest {

    @Test
    void measuredHeightWins() {
        assertThat(WireHeightReader.read(new JSONObject("{\"_measured_height\":336,\"height\":12}")))
                .isEqualTo(336.0);
    }

    @Test
    void parsesFeetInchText() {
        assertThat(WireHeightReader.read(new JSONObject("{\"height\":\"24'-2\\\"\"}"))).isEqualTo(290.0);
    }

    @Test
    void smallCoordinatesAreMetres() {
        assertThat(WireHeightReader.read(new JSONObject("{\"position\":{\"z\":7.62}}")))
                .isCloseTo(300.0, within(0.01));
        assertThat(WireHeightReader.read(new JSONObject("{\"position\":{\"z\":300}}"))).isEqualTo(300.0);
    }

    @Test
    void attachmentHeightHonoursUnit() {
        assertThat(WireHeightReader.read(new JSONObject("{\"attachmentHeight\":{\"value\":25,\"unit\":\"ft\"}}")))
                .isEqualTo(300.0);
        assertThat(WireHeightReader.read(new JSONObject("{\"attachmentHeight\":{\"value\":7.62,\"unit\":\"METRE\"}}")))
                .isCloseTo(300.0, within(0.01));
        assertThat(WireHeightReader.read(new JSONObject("{\"value\":250}"))).isEqualTo(250.0);
    }

    @Test
    void measuredReadsOnlyMeasuredHeight() {
        assertThat(WireHeightReader.measured(new JSONObject("{\"_measured_height\":\"28'-0\\\"\"}")))
                .isEqualTo(336.0);
        assertThat(WireHeightReader.measured(new JSONObject("{\"_measured_height\":\"300\"}"))).isEqualTo(300.0);
        assertThat(WireHeightReader.measured(new JSONObject("{\"_measured_height\":0,\"height\":200}"))).isNull();
        assertThat(WireHeightReader.measured(new JSONObject("{\"_measured_height\":\"tall\"}"))).isNull();
    }

    @Test
    void noHeightYieldsNull() {
        assertThat(WireHeightReader.read(new JSONObject("{\"id\":\"w1\",\"height\":\"tall\"}"))).isNull();
        assertThat(WireHeightReader.read(null)).isNull();
    }
}
