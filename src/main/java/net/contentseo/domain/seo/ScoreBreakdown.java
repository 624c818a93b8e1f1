package net.contentseo.domain.seo;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-factor rubric result in checklist order.
 *
 * <p>Each factor appears exactly once, so the total never exceeds 100.</p>
 */
public record ScoreBreakdown(List<FactorScore> factors) {

    public ScoreBreakdown {
        factors = factors == null ? List.of() : List.copyOf(factors);
        Map<RubricFactor, Boolean> seen = new EnumMap<>(RubricFactor.class);
        for (FactorScore score : factors) {
            if (seen.put(score.factor(), Boolean.TRUE) != null) {
                throw new IllegalArgumentException("duplicate rubric factor " + score.factor());
            }
        }
    }

    /**
     * Sum of earned points across all factors.
     */
    public int total() {
        return factors.stream().mapToInt(FactorScore::pointsEarned).sum();
    }

    public int maxTotal() {
        return factors.stream().mapToInt(FactorScore::pointsMax).sum();
    }

    /**
     * Returns the score for a factor, or a zero score when the factor was not evaluated.
     */
    public FactorScore factor(RubricFactor factor) {
        return factors.stream()
            .filter(score -> score.factor() == factor)
            .findFirst()
            .orElse(FactorScore.of(factor, 0));
    }

    /**
     * Ordered factor to score view for checklist rendering.
     */
    public Map<RubricFactor, FactorScore> asMap() {
        Map<RubricFactor, FactorScore> ordered = new LinkedHashMap<>();
        factors.forEach(score -> ordered.put(score.factor(), score));
        return Collections.unmodifiableMap(ordered);
    }
}
