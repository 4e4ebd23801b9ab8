package com.phillippitts.makeready.util;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OwnerNormalizerTest {

    @ParameterizedTest
    @CsvSource({
            "AT&T, AT&T",
            "att, AT&T",
            "At And T, AT&T",
            "CPS, CPS ENERGY",
            "cps energy, CPS ENERGY",
            "' Charter ', CHARTER"
    })
    void foldsKnownAliases(String raw, String expected) {
        assertThat(OwnerNormalizer.normalize(raw)).isEqualTo(expected);
    }

    @Test
    void isIdempotent() {
        for (String raw : new String[] {"AT&T", "Crown Castle", "cps"}) {
            String once = OwnerNormalizer.normalize(raw);
            assertThat(OwnerNormalizer.normalize(once)).isEqualTo(once);
        }
    }

    @Test
    void blankOwnerNormalizesToNull() {
        assertThat(OwnerNormalizer.normalize(null)).isNull();
        assertThat(OwnerNormalizer.normalize("  ")).isNull();
    }

    @Test
    void ownerOfDescriptionTakesFirstWord() {
        assertThat(OwnerNormalizer.ownerOfDescription("AT&T Telco Com")).isEqualTo("AT&T");
        assertThat(OwnerNormalizer.ownerOfDescription("Charter/Spectrum Fiber Optic"))
                .isEqualTo("CHARTER/SPECTRUM");
        assertThat(OwnerNormalizer.ownerOfDescription("")).isNull();
    }

    @Test
    void recognizesUtility() {
        assertThat(OwnerNormalizer.isUtility("CPS Energy")).isTrue();
        assertThat(OwnerNormalizer.isUtility("AT&T")).isFalse();
        assertThat(OwnerNormalizer.isUtility(null)).isFalse();
    }
}
