package net.contentseo.support.seo;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Case-insensitive whole-phrase keyword matching over plain text.
 *
 * <p>A match must not be preceded or followed by a letter or digit, so
 * {@code python} does not match inside {@code pythonic}. Whitespace inside a
 * phrase matches any whitespace run.</p>
 */
public final class KeywordMatcher {

    private static final String BOUNDARY_BEFORE = "(?<![\\p{L}\\p{N}])";
    private static final String BOUNDARY_AFTER = "(?![\\p{L}\\p{N}])";

    private KeywordMatcher() {
    }

    /**
     * Counts non-overlapping whole-phrase occurrences of {@code keyword} in {@code text}.
     *
     * @return occurrence count, 0 when either argument is blank
     */
    public static int countOccurrences(String text, String keyword) {
        if (!StringUtils.hasText(text) || !StringUtils.hasText(keyword)) {
            return 0;
        }
        Matcher matcher = phrasePattern(keyword).matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    /**
     * Plain case-insensitive substring containment, used for short fields like titles.
     */
    public static boolean containsIgnoreCase(String text, String keyword) {
        if (!StringUtils.hasText(text) || !StringUtils.hasText(keyword)) {
            return false;
        }
        return text.toLowerCase(Locale.ROOT).contains(keyword.trim().toLowerCase(Locale.ROOT));
    }

    private static Pattern phrasePattern(String keyword) {
        String[] words = keyword.trim().split("\\s+");
        StringBuilder regex = new StringBuilder(BOUNDARY_BEFORE);
        for (int i = 0; i < words.length; i++) {
            if (i > 0) {
                regex.append("\\s+");
            }
            regex.append(Pattern.quote(words[i]));
        }
        regex.append(BOUNDARY_AFTER);
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
