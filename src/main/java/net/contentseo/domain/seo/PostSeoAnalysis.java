package net.contentseo.domain.seo;

import java.util.Objects;

/**
 * Complete result of one scoring call.
 */
public record PostSeoAnalysis(SeoMetrics metrics, ScoreBreakdown breakdown, SuggestionBundle suggestions) {

    public PostSeoAnalysis {
        Objects.requireNonNull(metrics, "metrics must not be null");
        Objects.requireNonNull(breakdown, "breakdown must not be null");
        Objects.requireNonNull(suggestions, "suggestions must not be null");
    }

    public int totalScore() {
        return breakdown.total();
    }

    public boolean isPublishable(int threshold) {
        return breakdown.total() >= threshold;
    }
}
