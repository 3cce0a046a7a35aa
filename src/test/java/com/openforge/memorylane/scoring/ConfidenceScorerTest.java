package com.openforge.memorylane.scoring;

import com.openforge.memorylane.extraction.MemoryType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfidenceScorerTest {

    private final ConfidenceScorer scorer = new ConfidenceScorer();

    @Test
    @DisplayName("zero confidence gap with empty content scores the low-priority boost")
    void score_lowBoostOnly() {
        assertThat(scorer.score(0, MemoryType.GAP, "")).isCloseTo(0.05, within(1e-9));
    }

    @Test
    @DisplayName("strong language on a correction is clamped to 1.0")
    void score_clampedAtOne() {
        assertThat(scorer.score(100, MemoryType.CORRECTION, "always do X")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("type boosts follow priority")
    void score_typeBoosts() {
        assertThat(scorer.score(50, MemoryType.DECISION, "plain")).isCloseTo(0.65, within(1e-9));
        assertThat(scorer.score(50, MemoryType.INSIGHT, "plain")).isCloseTo(0.60, within(1e-9));
        assertThat(scorer.score(50, MemoryType.WORKFLOW_NOTE, "plain")).isCloseTo(0.55, within(1e-9));
    }

    @Test
    @DisplayName("strong and ambiguous terms are matched case-insensitively and cancel out")
    void score_languageAdjustments() {
        assertThat(scorer.score(50, MemoryType.GAP, "This is CRITICAL")).isCloseTo(0.65, within(1e-9));
        assertThat(scorer.score(50, MemoryType.GAP, "Maybe later")).isCloseTo(0.45, within(1e-9));
        assertThat(scorer.score(50, MemoryType.GAP, "must, perhaps")).isCloseTo(0.55, within(1e-9));
    }

    @Test
    @DisplayName("null content is treated as empty and the floor is 0")
    void score_nullContentAndFloor() {
        assertThat(scorer.score(0, MemoryType.GAP, null)).isCloseTo(0.05, within(1e-9));
        assertThat(scorer.score(0, MemoryType.GAP, "unsure")).isEqualTo(0.0);
    }
}
