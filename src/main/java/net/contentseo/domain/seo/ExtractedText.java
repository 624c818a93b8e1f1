package net.contentseo.domain.seo;

import java.util.List;

/**
 * Plain text and heading outline derived from post markup.
 */
public record ExtractedText(String plainText, List<ExtractedHeading> headings) {

    public static final ExtractedText EMPTY = new ExtractedText("", List.of());

    public ExtractedText {
        plainText = plainText == null ? "" : plainText;
        headings = headings == null ? List.of() : List.copyOf(headings);
    }

    public int headingCount() {
        return headings.size();
    }
}
