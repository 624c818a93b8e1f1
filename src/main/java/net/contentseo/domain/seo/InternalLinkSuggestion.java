package net.contentseo.domain.seo;

/**
 * Published post proposed as an internal link target.
 */
public record InternalLinkSuggestion(String title, String slug) {

    public InternalLinkSuggestion {
        title = title == null ? "" : title;
        slug = slug == null ? "" : slug;
    }
}
