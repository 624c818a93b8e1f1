package net.contentseo.domain.seo;

/**
 * Heading found in post markup.
 *
 * @param level heading level, 1 to 3
 * @param text visible heading text, empty when the tag had no text
 * @param anchorId positional anchor in the form {@code heading-<n>}
 */
public record ExtractedHeading(int level, String text, String anchorId) {

    public ExtractedHeading {
        if (level < 1 || level > 3) {
            throw new IllegalArgumentException("heading level must be between 1 and 3 but was " + level);
        }
        text = text == null ? "" : text;
    }
}
