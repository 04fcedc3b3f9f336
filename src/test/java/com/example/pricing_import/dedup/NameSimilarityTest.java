package com.example.pricing_import.dedup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class NameSimilarityTest {

    @Test
    void ratio_basics() {
        assertThat(NameSimilarity.ratio("abc", "abc")).isEqualTo(1.0);
        assertThat(NameSimilarity.ratio("", "")).isEqualTo(1.0);
        assertThat(NameSimilarity.ratio("abc", "")).isEqualTo(0.0);
        assertThat(NameSimilarity.ratio("kitten", "sitting")).isCloseTo(1 - 3.0 / 7, within(1e-9));
        assertThat(NameSimilarity.ratio(null, "a")).isEqualTo(0.0);
    }

    @Test
    void ratio_isSymmetric() {
        assertThat(NameSimilarity.ratio("widget abcd", "widget abfe"))
                .isEqualTo(NameSimilarity.ratio("widget abfe", "widget abcd"));
    }
}
