package com.netcracker.core.ddisync.service.mapping;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SequenceSimilarityTest {

    @Test
    void ratioShouldCountMatchingBlocks() {
        assertThat(SequenceSimilarity.ratio("abcd", "bcde")).isEqualTo(0.75);
        assertThat(SequenceSimilarity.ratio("createdby", "created_by")).isCloseTo(18.0 / 19.0, within(1e-9));
    }

    @Test
    void ratioShouldPreferEarliestBlockOnTies() {
        assertThat(SequenceSimilarity.ratio("ab", "ba")).isEqualTo(0.5);
    }

    @Test
    void ratioShouldHandleEdgeCases() {
        assertThat(SequenceSimilarity.ratio("", "")).isEqualTo(1.0);
        assertThat(SequenceSimilarity.ratio("abc", "")).isZero();
        assertThat(SequenceSimilarity.ratio("owner", "owner")).isEqualTo(1.0);
        assertThat(SequenceSimilarity.ratio("abc", "xyz")).isZero();
    }
}
