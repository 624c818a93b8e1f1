package net.contentseo.application.seo;

import lombok.extern.slf4j.Slf4j;
import net.contentseo.domain.seo.ExtractedText;
import net.contentseo.domain.seo.PostContent;
import net.contentseo.domain.seo.PostSeoAnalysis;
import net.contentseo.domain.seo.PublishedPostFinder;
import net.contentseo.domain.seo.ScoreBreakdown;
import net.contentseo.domain.seo.SeoMetrics;
import net.contentseo.domain.seo.SuggestionBundle;
import net.contentseo.support.seo.PostTextExtractor;
import net.contentseo.support.seo.SeoMetricsCalculator;
import net.contentseo.support.seo.SeoRubricScorer;
import net.contentseo.support.seo.SeoSuggestionGenerator;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Single entry point for scoring a draft post.
 *
 * <p>Extracts the body once, derives metrics, then scores the rubric and
 * generates suggestions from the same derived values. Holds no mutable state,
 * so concurrent calls need no coordination.</p>
 */
@Slf4j
@Service
public class PostSeoScoringUseCase {

    private final PostTextExtractor textExtractor;
    private final SeoMetricsCalculator metricsCalculator;
    private final SeoRubricScorer rubricScorer;
    private final SeoSuggestionGenerator suggestionGenerator;

    public PostSeoScoringUseCase(PostTextExtractor textExtractor,
                                 SeoMetricsCalculator metricsCalculator,
                                 SeoRubricScorer rubricScorer,
                                 SeoSuggestionGenerator suggestionGenerator) {
        this.textExtractor = textExtractor;
        this.metricsCalculator = metricsCalculator;
        this.rubricScorer = rubricScorer;
        this.suggestionGenerator = suggestionGenerator;
    }

    /**
     * Scores a post and builds its suggestions.
     *
     * @param post post fields; optional fields may be empty
     * @param linkFinder lookup used for internal link suggestions
     * @return metrics, rubric breakdown and suggestions
     * @throws PostSeoValidationException when the post or its body is absent
     */
    public PostSeoAnalysis score(PostContent post, PublishedPostFinder linkFinder) {
        requireBody(post);

        ExtractedText extracted = textExtractor.extract(post.body());
        SeoMetrics metrics = metricsCalculator.calculate(extracted, post.primaryKeyword());
        ScoreBreakdown breakdown = rubricScorer.score(post, metrics);
        SuggestionBundle suggestions = suggestionGenerator.generate(post, extracted, metrics, linkFinder);

        log.debug("Scored post slug='{}': total={} words={} density={}",
            post.slug(), breakdown.total(), metrics.wordCount(), metrics.keywordDensityPercent());
        return new PostSeoAnalysis(metrics, breakdown, suggestions);
    }

    private static void requireBody(PostContent post) {
        if (post == null) {
            log.info("Rejected SEO analysis request without post content");
            throw new PostSeoValidationException(
                PostSeoValidationException.ErrorCode.POST_REQUIRED, "post", "Post content is required for SEO analysis");
        }
        if (!StringUtils.hasText(post.body())) {
            log.info("Rejected SEO analysis for slug='{}': body is empty", post.slug());
            throw PostSeoValidationException.bodyRequired();
        }
    }
}
