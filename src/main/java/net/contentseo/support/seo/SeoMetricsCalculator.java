package net.contentseo.support.seo;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.contentseo.domain.seo.ExtractedText;
import net.contentseo.domain.seo.SeoMetrics;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Derives word count, reading time and keyword density from extracted text.
 */
@Component
public class SeoMetricsCalculator {

    static final int WORDS_PER_MINUTE = 200;

    private static final Pattern WORD = Pattern.compile("\\S+");

    /**
     * Computes metrics for the extracted body.
     *
     * @param extracted plain text and headings of the post
     * @param primaryKeyword focus keyword, may be blank
     * @return metrics; density is 0 when the keyword is blank or there are no words
     */
    public SeoMetrics calculate(ExtractedText extracted, String primaryKeyword) {
        ExtractedText source = extracted == null ? ExtractedText.EMPTY : extracted;
        String plainText = source.plainText();

        int wordCount = countWords(plainText);
        int readingTimeMinutes = readingTimeMinutes(wordCount);

        String keyword = primaryKeyword == null ? "" : primaryKeyword.trim();
        int occurrences = KeywordMatcher.countOccurrences(plainText, keyword);
        double density = keywordDensity(occurrences, wordCount, keyword);

        return new SeoMetrics(wordCount, readingTimeMinutes, density, occurrences, source.headingCount());
    }

    static int countWords(String plainText) {
        if (!StringUtils.hasText(plainText)) {
            return 0;
        }
        Matcher matcher = WORD.matcher(plainText);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    static int readingTimeMinutes(int wordCount) {
        if (wordCount <= 0) {
            return 0;
        }
        return (wordCount + WORDS_PER_MINUTE - 1) / WORDS_PER_MINUTE;
    }

    private static double keywordDensity(int occurrences, int wordCount, String keyword) {
        if (wordCount == 0 || keyword.isEmpty()) {
            return 0.0d;
        }
        double raw = occurrences * 100.0d / wordCount;
        return BigDecimal.valueOf(raw).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
