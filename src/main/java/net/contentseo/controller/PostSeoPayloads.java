package net.contentseo.controller;

import java.util.List;
import net.contentseo.domain.seo.FactorScore;
import net.contentseo.domain.seo.PostSeoAnalysis;
import net.contentseo.domain.seo.ScoreBreakdown;
import net.contentseo.domain.seo.SeoFieldReview;
import net.contentseo.domain.seo.SeoMetrics;
import net.contentseo.domain.seo.SuggestionBundle;

/**
 * Typed API payloads returned by {@link PostSeoController} to the admin editor.
 */
public final class PostSeoPayloads {

    private PostSeoPayloads() {
    }

    /**
     * Full analysis payload rendered as the pre-publish checklist.
     *
     * @param metrics body metrics
     * @param breakdown rubric result
     * @param suggestions editorial suggestions
     * @param review required-field errors and warnings
     */
    public record AnalysisPayload(SeoMetrics metrics,
                                  BreakdownPayload breakdown,
                                  SuggestionBundle suggestions,
                                  ReviewPayload review) {

        static AnalysisPayload from(PostSeoAnalysis analysis, SeoFieldReview review, int publishableThreshold) {
            return new AnalysisPayload(
                analysis.metrics(),
                BreakdownPayload.from(analysis.breakdown(), publishableThreshold),
                analysis.suggestions(),
                new ReviewPayload(review.errors(), review.warnings())
            );
        }
    }

    /**
     * Suggestions-only payload for live editor hints.
     */
    public record SuggestionsPayload(SeoMetrics metrics, SuggestionBundle suggestions) {
    }

    /**
     * Rubric result with the publish gate applied.
     *
     * @param total earned points
     * @param maxTotal available points
     * @param publishable whether the total reaches the configured threshold
     * @param factors per-factor scores in checklist order
     */
    public record BreakdownPayload(int total, int maxTotal, boolean publishable, List<FactorPayload> factors) {

        static BreakdownPayload from(ScoreBreakdown breakdown, int publishableThreshold) {
            return new BreakdownPayload(
                breakdown.total(),
                breakdown.maxTotal(),
                breakdown.total() >= publishableThreshold,
                breakdown.factors().stream().map(FactorPayload::from).toList()
            );
        }
    }

    /**
     * Single checklist row.
     */
    public record FactorPayload(String factor, String label, int pointsEarned, int pointsMax) {

        static FactorPayload from(FactorScore score) {
            return new FactorPayload(score.factor().name(), score.factor().label(), score.pointsEarned(), score.pointsMax());
        }
    }

    /**
     * Field review result.
     */
    public record ReviewPayload(List<String> errors, List<String> warnings) {
    }
}
