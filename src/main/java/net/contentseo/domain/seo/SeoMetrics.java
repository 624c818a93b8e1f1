package net.contentseo.domain.seo;

/**
 * Quantitative text metrics for a post.
 *
 * @param wordCount number of whitespace-delimited words in the plain text
 * @param readingTimeMinutes minutes at 200 words per minute, rounded up
 * @param keywordDensityPercent primary keyword occurrences per hundred words, one decimal
 * @param keywordOccurrences number of whole-phrase primary keyword matches
 * @param headingCount number of h1-h3 headings
 */
public record SeoMetrics(
    int wordCount,
    int readingTimeMinutes,
    double keywordDensityPercent,
    int keywordOccurrences,
    int headingCount
) {

    public SeoMetrics {
        if (wordCount < 0 || readingTimeMinutes < 0 || keywordOccurrences < 0 || headingCount < 0) {
            throw new IllegalArgumentException("metric counts must be non-negative");
        }
        if (keywordDensityPercent < 0) {
            throw new IllegalArgumentException("keyword density must be non-negative");
        }
    }
}
