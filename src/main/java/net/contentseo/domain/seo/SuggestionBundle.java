package net.contentseo.domain.seo;

import java.util.List;

/**
 * Editorial suggestions generated alongside the score.
 *
 * @param headingSuggestions keyword heading templates not yet used by the post
 * @param faqSuggestions FAQ prompts built around the primary keyword
 * @param internalLinkSuggestions published posts worth linking to
 * @param generatedMetaDescription description built from the body, empty when the post already has one
 */
public record SuggestionBundle(
    List<String> headingSuggestions,
    List<String> faqSuggestions,
    List<InternalLinkSuggestion> internalLinkSuggestions,
    String generatedMetaDescription
) {

    public SuggestionBundle {
        headingSuggestions = headingSuggestions == null ? List.of() : List.copyOf(headingSuggestions);
        faqSuggestions = faqSuggestions == null ? List.of() : List.copyOf(faqSuggestions);
        internalLinkSuggestions = internalLinkSuggestions == null ? List.of() : List.copyOf(internalLinkSuggestions);
        generatedMetaDescription = generatedMetaDescription == null ? "" : generatedMetaDescription;
    }
}
