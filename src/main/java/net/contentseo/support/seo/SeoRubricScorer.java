package net.contentseo.support.seo;

import java.util.List;
import net.contentseo.domain.seo.FactorScore;
import net.contentseo.domain.seo.PostContent;
import net.contentseo.domain.seo.PostImage;
import net.contentseo.domain.seo.RubricFactor;
import net.contentseo.domain.seo.ScoreBreakdown;
import net.contentseo.domain.seo.SeoMetrics;
import net.contentseo.util.SlugGenerator;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Applies the fixed 100-point SEO rubric to a post and its metrics.
 *
 * <p>Every factor is evaluated independently; ranges are inclusive on both
 * ends unless a comment says otherwise.</p>
 */
@Component
public class SeoRubricScorer {

    private static final int TITLE_MIN_LENGTH = 30;
    private static final int TITLE_MAX_LENGTH = 60;
    private static final int META_DESCRIPTION_MIN_LENGTH = 120;
    private static final int META_DESCRIPTION_MAX_LENGTH = 155;
    private static final int LONG_FORM_WORDS = 1000;
    private static final int MEDIUM_FORM_WORDS = 500;
    private static final int SHORT_FORM_WORDS = 300;
    private static final int TARGET_HEADING_COUNT = 3;
    private static final double OPTIMAL_DENSITY_MIN = 1.0d;
    private static final double OPTIMAL_DENSITY_MAX = 2.5d;
    private static final double ACCEPTABLE_DENSITY_MAX = 4.0d;

    /**
     * Scores the post against every rubric factor.
     *
     * @param post post fields
     * @param metrics metrics derived from the post body
     * @return breakdown in {@link RubricFactor} order
     */
    public ScoreBreakdown score(PostContent post, SeoMetrics metrics) {
        return new ScoreBreakdown(List.of(
            FactorScore.of(RubricFactor.TITLE, scoreTitle(post)),
            FactorScore.of(RubricFactor.META_DESCRIPTION, scoreMetaDescription(post)),
            FactorScore.of(RubricFactor.PRIMARY_KEYWORD, scorePrimaryKeyword(post, metrics)),
            FactorScore.of(RubricFactor.CONTENT_LENGTH, scoreContentLength(metrics)),
            FactorScore.of(RubricFactor.HEADINGS, scoreHeadings(metrics)),
            FactorScore.of(RubricFactor.IMAGES, scoreImages(post)),
            FactorScore.of(RubricFactor.KEYWORD_DENSITY, scoreKeywordDensity(metrics)),
            FactorScore.of(RubricFactor.URL_SLUG, scoreSlug(post)),
            FactorScore.of(RubricFactor.EXCERPT, scoreExcerpt(post)),
            FactorScore.of(RubricFactor.SOCIAL_TAGS, scoreSocialTags(post))
        ));
    }

    int scoreTitle(PostContent post) {
        String title = post.title().trim();
        if (title.isEmpty()) {
            return 0;
        }
        boolean lengthInRange = title.length() >= TITLE_MIN_LENGTH && title.length() <= TITLE_MAX_LENGTH;
        boolean hasKeyword = KeywordMatcher.containsIgnoreCase(title, post.primaryKeyword());
        return bothOrEither(lengthInRange, hasKeyword, RubricFactor.TITLE);
    }

    int scoreMetaDescription(PostContent post) {
        String description = post.metaDescription().trim();
        if (description.isEmpty()) {
            return 0;
        }
        boolean lengthInRange = description.length() >= META_DESCRIPTION_MIN_LENGTH
            && description.length() <= META_DESCRIPTION_MAX_LENGTH;
        boolean hasKeyword = KeywordMatcher.containsIgnoreCase(description, post.primaryKeyword());
        return bothOrEither(lengthInRange, hasKeyword, RubricFactor.META_DESCRIPTION);
    }

    int scorePrimaryKeyword(PostContent post, SeoMetrics metrics) {
        if (!StringUtils.hasText(post.primaryKeyword()) || metrics.keywordOccurrences() < 1) {
            return 0;
        }
        return RubricFactor.PRIMARY_KEYWORD.maxPoints();
    }

    int scoreContentLength(SeoMetrics metrics) {
        int words = metrics.wordCount();
        if (words >= LONG_FORM_WORDS) {
            return RubricFactor.CONTENT_LENGTH.maxPoints();
        }
        if (words >= MEDIUM_FORM_WORDS) {
            return 10;
        }
        if (words >= SHORT_FORM_WORDS) {
            return 5;
        }
        return 0;
    }

    int scoreHeadings(SeoMetrics metrics) {
        int max = RubricFactor.HEADINGS.maxPoints();
        // integer division floors: 1 heading = 3, 2 headings = 6
        int proportional = metrics.headingCount() * max / TARGET_HEADING_COUNT;
        return Math.max(0, Math.min(max, proportional));
    }

    int scoreImages(PostContent post) {
        PostImage featured = post.featuredImage();
        if (!featured.isPresent()) {
            return 0;
        }
        return featured.hasAltText() ? RubricFactor.IMAGES.maxPoints() : 5;
    }

    int scoreKeywordDensity(SeoMetrics metrics) {
        double density = metrics.keywordDensityPercent();
        if (density >= OPTIMAL_DENSITY_MIN && density <= OPTIMAL_DENSITY_MAX) {
            return RubricFactor.KEYWORD_DENSITY.maxPoints();
        }
        // (0, 1.0) is under-optimized, (2.5, 4.0] is borderline stuffing
        if ((density > 0 && density < OPTIMAL_DENSITY_MIN)
            || (density > OPTIMAL_DENSITY_MAX && density <= ACCEPTABLE_DENSITY_MAX)) {
            return 5;
        }
        return 0;
    }

    int scoreSlug(PostContent post) {
        return SlugGenerator.isRubricCompliant(post.slug()) ? RubricFactor.URL_SLUG.maxPoints() : 0;
    }

    int scoreExcerpt(PostContent post) {
        return StringUtils.hasText(post.excerpt()) ? RubricFactor.EXCERPT.maxPoints() : 0;
    }

    int scoreSocialTags(PostContent post) {
        boolean openGraph = anyText(post.ogTitle(), post.ogDescription(), post.ogImage());
        boolean twitter = anyText(post.twitterTitle(), post.twitterDescription(), post.twitterImage());
        return bothOrEither(openGraph, twitter, RubricFactor.SOCIAL_TAGS);
    }

    private static int bothOrEither(boolean first, boolean second, RubricFactor factor) {
        if (first && second) {
            return factor.maxPoints();
        }
        return first || second ? factor.maxPoints() / 2 : 0;
    }

    private static boolean anyText(String... values) {
        for (String value : values) {
            if (StringUtils.hasText(value)) {
                return true;
            }
        }
        return false;
    }
}
