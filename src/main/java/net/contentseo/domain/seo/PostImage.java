package net.contentseo.domain.seo;

/**
 * Image reference attached to a post.
 *
 * @param url public or relative image URL
 * @param altText alternative text rendered for accessibility and crawlers
 */
public record PostImage(String url, String altText) {

    public static final PostImage NONE = new PostImage("", "");

    public PostImage {
        url = url == null ? "" : url.trim();
        altText = altText == null ? "" : altText.trim();
    }

    public boolean isPresent() {
        return !url.isEmpty();
    }

    public boolean hasAltText() {
        return !altText.isEmpty();
    }
}
