package com.phillippitts.makeready.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PoleIdsTest {

    @Test
    void normalizeKeepsTrailingDigits() {
        assertThat(PoleIds.normalize("PL410620")).isEqualTo("410620");
        assertThat(PoleIds.normalize("410620")).isEqualTo("410620");
        assertThat(PoleIds.normalize("Pole 12-77")).isEqualTo("77");
    }

    @Test
    void normalizeReturnsNullWithoutTrailingDigits() {
        assertThat(PoleIds.normalize("PL41A")).isNull();
        assertThat(PoleIds.normalize("Unknown")).isNull();
        assertThat(PoleIds.normalize("")).isNull();
        assertThat(PoleIds.normalize(null)).isNull();
    }

    @Test
    void displayTagPrefixesNumericTags() {
        assertThat(PoleIds.displayTag("410620", "n1")).isEqualTo("PL410620");
        assertThat(PoleIds.displayTag("pl410620", "n1")).isEqualTo("PL410620");
    }

    @Test
    void displayTagKeepsDescriptiveTags() {
        assertThat(PoleIds.displayTag("Reference-abc123", "n1")).isEqualTo("Reference-abc123");
        assertThat(PoleIds.displayTag("MH-12A", "n1")).isEqualTo("MH-12A");
    }

    @Test
    void displayTagSynthesizesUnknownFromNodeId() {
        assertThat(PoleIds.displayTag(null, "-Nabcdefgh")).isEqualTo("Unknown--Nabcd");
        assertThat(PoleIds.shortId("abc")).isEqualTo("abc");
        assertThat(PoleIds.shortId(null)).isEmpty();
    }
}
