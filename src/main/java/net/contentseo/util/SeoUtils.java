package net.contentseo.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Utility class for search engine optimization text operations
 *
 * Handles description truncation, keyword extraction, and length-capped
 * social metadata values
 */
public final class SeoUtils {

    private static final String ELLIPSIS = "...";
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]$");
    private static final Pattern KEYWORD_CANDIDATE = Pattern.compile("\\b[a-zA-Z]{3,}\\b");
    private static final Pattern NON_WORD = Pattern.compile("[^\\w]");

    private static final Set<String> STOP_WORDS = Set.of(
        "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
        "from", "as", "is", "was", "are", "were", "been", "be", "have", "has", "had", "do", "does",
        "did", "will", "would", "should", "could", "may", "might", "must", "can", "this", "that",
        "these", "those", "what", "which", "who", "whom", "whose", "where", "when", "why", "how",
        "all", "each", "every", "both", "few", "more", "most", "other", "some", "such", "no", "nor",
        "not", "only", "own", "same", "so", "than", "too", "very", "just", "now"
    );

    private SeoUtils() {
    }

    /**
     * Truncates plain text to a maximum length while preserving whole words
     * - Reserves room for the ellipsis inside {@code maxLength}
     * - Breaks at the last space that fits, or hard-cuts a single long word
     *
     * @param text The plain text to truncate
     * @param maxLength The maximum length of the result, ellipsis included
     * @return The text unchanged when it fits, otherwise the truncated text with an ellipsis
     */
    public static String truncateDescription(String text, int maxLength) {
        if (!StringUtils.hasText(text)) {
            return "";
        }
        String plainText = text.replaceAll("\\s+", " ").trim();

        if (plainText.length() <= maxLength) {
            return plainText;
        }

        int truncatedLength = maxLength - ELLIPSIS.length();
        if (truncatedLength <= 0) {
            return ELLIPSIS.substring(0, Math.max(0, maxLength));
        }

        // Include the character at the cut so a word ending exactly there is kept
        String window = plainText.substring(0, Math.min(truncatedLength + 1, plainText.length()));
        int lastSpace = window.lastIndexOf(' ');

        String head;
        if (lastSpace > 0) {
            head = window.substring(0, lastSpace);
        } else {
            head = plainText.substring(0, truncatedLength);
        }
        return head.stripTrailing() + ELLIPSIS;
    }

    /**
     * Builds a description from the leading text, cut at the last whole word that fits.
     * An ellipsis is added unless the cut lands on a sentence end.
     *
     * @param plainText markup-free body text
     * @param maxLength maximum description length, ellipsis included
     * @return description, empty for blank input
     */
    public static String leadingSentences(String plainText, int maxLength) {
        if (!StringUtils.hasText(plainText)) {
            return "";
        }
        String normalized = plainText.replaceAll("\\s+", " ").trim();
        if (normalized.length() <= maxLength) {
            return normalized;
        }

        String window = normalized.substring(0, maxLength + 1);
        int lastSpace = window.lastIndexOf(' ');
        if (lastSpace > 0) {
            String head = window.substring(0, lastSpace);
            if (SENTENCE_END.matcher(head).find()) {
                return head;
            }
        }
        return truncateDescription(normalized, maxLength);
    }

    /**
     * Caps a value at {@code limit} characters, replacing the tail with an ellipsis when cut.
     */
    public static String capWithEllipsis(String value, int limit) {
        if (value == null) {
            return "";
        }
        if (value.length() <= limit) {
            return value;
        }
        return value.substring(0, limit - ELLIPSIS.length()) + ELLIPSIS;
    }

    /**
     * Picks the most significant word of a title as its primary keyword.
     * Longer non-stop-words win; ties keep title order.
     *
     * @param title post title
     * @return capitalized keyword, or an empty string when nothing qualifies
     */
    public static String extractPrimaryKeyword(String title) {
        if (!StringUtils.hasText(title)) {
            return "";
        }

        List<String> candidates = new ArrayList<>();
        Matcher matcher = KEYWORD_CANDIDATE.matcher(title.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String word = matcher.group();
            if (!STOP_WORDS.contains(word)) {
                candidates.add(word);
            }
        }
        if (!candidates.isEmpty()) {
            String longest = candidates.get(0);
            for (String candidate : candidates) {
                if (candidate.length() > longest.length()) {
                    longest = candidate;
                }
            }
            return capitalize(longest);
        }

        for (String token : title.trim().split("\\s+")) {
            String cleaned = NON_WORD.matcher(token).replaceAll("");
            if (cleaned.length() >= 3 && !STOP_WORDS.contains(cleaned.toLowerCase(Locale.ROOT))) {
                return cleaned;
            }
        }
        return "";
    }

    /**
     * Generates supporting keyword phrases around a primary keyword.
     */
    public static List<String> secondaryKeywordPatterns(String primaryKeyword, int count) {
        if (!StringUtils.hasText(primaryKeyword)) {
            return List.of();
        }
        String keyword = primaryKeyword.trim();
        List<String> patterns = List.of(
            keyword + " tutorial",
            keyword + " guide",
            keyword + " tips",
            "learn " + keyword,
            keyword + " best practices",
            keyword + " examples",
            "how to " + keyword,
            keyword + " for beginners"
        );
        return patterns.subList(0, Math.min(count, patterns.size()));
    }

    private static String capitalize(String word) {
        return Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }
}
