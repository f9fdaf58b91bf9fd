package com.autolens.insight.resolver;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TextNormalizerTest {

    @Test
    void foldsAccentsAndPunctuation() {
        assertThat(TextNormalizer.normalize("Citroën C4 (e-HDi), Boîte: auto!"))
            .isEqualTo("citroen c4 e hdi boite auto");
    }

    @Test
    void keepsDecimalPoints() {
        assertThat(TextNormalizer.normalize("VW ID.3 1.2L")).isEqualTo("vw id.3 1.2l");
    }

    @Test
    void nullAndEmptyGiveEmptyString() {
        assertThat(TextNormalizer.normalize(null)).isEmpty();
        assertThat(TextNormalizer.normalize("   ")).isEmpty();
    }

    @Test
    void tableKeyJoinsWords() {
        assertThat(TextNormalizer.tableKey("Land-Rover")).isEqualTo("land_rover");
        assertThat(TextNormalizer.tableKey(" Aston  Martin ")).isEqualTo("aston_martin");
        assertThat(TextNormalizer.tableKey("Škoda")).isEqualTo("skoda");
    }
}
