package com.phillippitts.makeready.service.attachment;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AttachmentDescriptionsTest {

    @ParameterizedTest
    @CsvSource({
            "AT&T, fiber, AT&T Fiber Optic Com",
            "ATT, Telco, AT&T Telco Com",
            "at&t, Drop, AT&T Com Drop",
            "CPS Energy, Fiber, CPS Supply Fiber",
            "Charter, Fiber, Charter/Spectrum Fiber Optic",
            "Spectrum, Coax, Charter/Spectrum Coax",
            "UTILITY, Primary Neutral, Neutral",
            "PROVIDER, Fiber, PROVIDER Fiber Optic",
            "Crown Castle, Coax, CROWN CASTLE Coax"
    })
    void formatsOwnerAndType(String owner, String type, String expected) {
        assertThat(AttachmentDescriptions.format(owner, type)).isEqualTo(expected);
    }

    @Test
    void charterOnlyTypeIsNotRepeated() {
        assertThat(AttachmentDescriptions.format("Charter", "Spectrum")).isEqualTo("Charter/Spectrum");
    }

    @Test
    void undergroundMatchesWholeWordUg() {
        assertThat(AttachmentDescriptions.isUnderground("Riser")).isTrue();
        assertThat(AttachmentDescriptions.isUnderground("UG service")).isTrue();
        assertThat(AttachmentDescriptions.isUnderground("plug", null)).isFalse();
        assertThat(AttachmentDescriptions.isUnderground(null, "Vertical run")).isTrue();
    }

    @Test
    void normalizesTypes() {
        assertThat(AttachmentDescriptions.normalizeType("Fiber")).isEqualTo("Fiber Optic");
        assertThat(AttachmentDescriptions.normalizeType("Fiber Optic")).isEqualTo("Fiber Optic");
        assertThat(AttachmentDescriptions.normalizeType("spectrum coax")).isEqualTo("Charter/Spectrum");
        assertThat(AttachmentDescriptions.normalizeType(null)).isEmpty();
    }
}
