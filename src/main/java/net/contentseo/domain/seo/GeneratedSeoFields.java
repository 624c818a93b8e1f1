package net.contentseo.domain.seo;

import java.util.List;

/**
 * SEO field values derived from a title and body for pre-filling the editor.
 */
public record GeneratedSeoFields(
    String primaryKeyword,
    List<String> secondaryKeywords,
    String metaTitle,
    String metaDescription,
    String ogTitle,
    String ogDescription,
    String twitterTitle,
    String twitterDescription,
    String slug
) {

    public GeneratedSeoFields {
        secondaryKeywords = secondaryKeywords == null ? List.of() : List.copyOf(secondaryKeywords);
    }
}
