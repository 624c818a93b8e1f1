package net.contentseo.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Utility for generating and checking SEO-friendly post URL slugs.
 */
public final class SlugGenerator {
    private static final Pattern NON_LATIN = Pattern.compile("[^\\w\\s-]");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s_]+");
    private static final Pattern EDGE_DASHES = Pattern.compile("^-+|-+$");
    private static final Pattern MULTIPLE_DASHES = Pattern.compile("-{2,}");
    private static final Pattern RUBRIC_SLUG = Pattern.compile("^[a-z0-9](?:[a-z0-9-]*[a-z0-9])?$");

    public static final int MAX_SLUG_LENGTH = 75;

    private SlugGenerator() {}

    /**
     * Generate a slug from a post title, capped at {@link #MAX_SLUG_LENGTH}.
     * Example: "How to Learn Python Fast" becomes "how-to-learn-python-fast"
     *
     * @param title The post title
     * @return SEO-friendly slug, empty when the title has no sluggable characters
     */
    public static String generatePostSlug(String title) {
        String slug = slugify(title);
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = truncateAtWordBoundary(slug, MAX_SLUG_LENGTH);
        }
        return EDGE_DASHES.matcher(slug).replaceAll("");
    }

    /**
     * Convert any string to a slug format.
     * Handles Unicode, accents, and special characters.
     */
    public static String slugify(String input) {
        if (input == null) {
            return "";
        }

        String slug = input.toLowerCase(Locale.ROOT).trim();

        // Strip combining accents
        slug = Normalizer.normalize(slug, Normalizer.Form.NFD);
        slug = slug.replaceAll("[\\p{InCombiningDiacriticalMarks}]", "");

        slug = slug.replace("&", "and");
        slug = slug.replace("'", "");
        slug = slug.replace("\u2019", "");
        slug = slug.replace("\u201C", "");
        slug = slug.replace("\u201D", "");

        slug = NON_LATIN.matcher(slug).replaceAll("");
        slug = WHITESPACE.matcher(slug).replaceAll("-");
        slug = MULTIPLE_DASHES.matcher(slug).replaceAll("-");
        slug = EDGE_DASHES.matcher(slug).replaceAll("");

        // \w keeps non-ASCII letters that have no decomposition
        return slug.replaceAll("[^a-z0-9-]", "");
    }

    /**
     * Checks the URL slug rubric rule: lowercase ASCII letters, digits and hyphens,
     * at most {@link #MAX_SLUG_LENGTH} characters, no leading or trailing hyphen.
     */
    public static boolean isRubricCompliant(String slug) {
        if (slug == null || slug.isEmpty() || slug.length() > MAX_SLUG_LENGTH) {
            return false;
        }
        return RUBRIC_SLUG.matcher(slug).matches();
    }

    /**
     * Truncate a slug at the nearest word boundary.
     */
    private static String truncateAtWordBoundary(String slug, int maxLength) {
        if (slug.length() <= maxLength) {
            return slug;
        }

        int lastDash = slug.lastIndexOf('-', maxLength);

        if (lastDash <= 0 || lastDash < maxLength / 2) {
            return slug.substring(0, maxLength);
        }

        return slug.substring(0, lastDash);
    }
}
