package com.openforge.memorylane.scoring;

import com.openforge.memorylane.extraction.MemoryType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Normalises a provider's 0–100 confidence into [0, 1].
 *
 *   score = raw/100 + typeBoost + strongLanguage(+0.10) + ambiguity(−0.10), clamped
 *
 * Pure and stateless.
 */
@Component
public class ConfidenceScorer {

    static final double LANGUAGE_ADJUSTMENT = 0.10;

    private static final List<String> STRONG_TERMS = List.of(
            "always", "never", "must", "critical", "important",
            "exactly", "perfect", "wrong", "incorrect");

    private static final List<String> AMBIGUOUS_TERMS = List.of(
            "maybe", "perhaps", "might", "could", "unsure");

    public double score(int rawConfidence, MemoryType type, String content) {
        String text = content == null ? "" : content.toLowerCase(Locale.ROOT);

        double score = rawConfidence / 100.0;
        if (type != null) score += type.boost();
        if (containsAny(text, STRONG_TERMS))    score += LANGUAGE_ADJUSTMENT;
        if (containsAny(text, AMBIGUOUS_TERMS)) score -= LANGUAGE_ADJUSTMENT;

        return Math.max(0.0, Math.min(1.0, score));
    }

    private static boolean containsAny(String text, List<String> terms) {
        for (String term : terms) {
            if (text.contains(term)) return true;
        }
        return false;
    }
}
