package com.phillippitts.makeready.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HeightFormatTest {

    @Test
    void formatsWholeFeetAndInches() {
        assertThat(HeightFormat.toFeetInches(300.0)).isEqualTo("25'-0\"");
        assertThat(HeightFormat.toFeetInches(290.0)).isEqualTo("24'-2\"");
        assertThat(HeightFormat.toFeetInches(0.0)).isEqualTo("0'-0\"");
    }

    @Test
    void roundsRemainderAndCarriesTwelve() {
        assertThat(HeightFormat.toFeetInches(290.4)).isEqualTo("24'-2\"");
        assertThat(HeightFormat.toFeetInches(299.7)).isEqualTo("25'-0\"");
    }

    @Test
    void formattedHeightsParseBackWithinOneInch() {
        for (double inches = 0.0; inches <= 720.0; inches += 0.25) {
            Double parsed = HeightFormat.parseFeetInches(HeightFormat.toFeetInches(inches));
            assertThat(parsed).as("height %s", inches).isCloseTo(inches, within(1.0));
        }
    }

    @ParameterizedTest
    @CsvSource({"11.5, 12.0", "23.5, 24.0", "335.6, 336.0", "290.4, 290.0"})
    void carriedRemainderParsesToNextFoot(double inches, double expected) {
        assertThat(HeightFormat.parseFeetInches(HeightFormat.toFeetInches(inches))).isEqualTo(expected);
    }

    @Test
    void rendersMissingHeightsAsNotAvailable() {
        assertThat(HeightFormat.toFeetInches(null)).isEqualTo(HeightFormat.NOT_AVAILABLE);
        assertThat(HeightFormat.toFeetInches(Double.NaN)).isEqualTo("N/A");
    }

    @Test
    void parsesFeetInchForms() {
        assertThat(HeightFormat.parseFeetInches("24'-2\"")).isEqualTo(290.0);
        assertThat(HeightFormat.parseFeetInches("24' 2\"")).isEqualTo(290.0);
        assertThat(HeightFormat.parseFeetInches(" 312 ")).isEqualTo(312.0);
    }

    @Test
    void rejectsNonHeights() {
        assertThat(HeightFormat.parseFeetInches(null)).isNull();
        assertThat(HeightFormat.parseFeetInches("N/A")).isNull();
    }

    @Test
    void convertsUnits() {
        assertThat(HeightFormat.metersToInches(7.62)).isCloseTo(300.0, within(0.01));
        assertThat(HeightFormat.feetToInches(40)).isEqualTo(480.0);
    }
}
