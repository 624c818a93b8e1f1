package net.contentseo.support.seo;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import net.contentseo.domain.seo.ExtractedHeading;
import net.contentseo.domain.seo.ExtractedText;
import net.contentseo.domain.seo.InternalLinkSuggestion;
import net.contentseo.domain.seo.PostContent;
import net.contentseo.domain.seo.PublishedPostFinder;
import net.contentseo.domain.seo.SeoMetrics;
import net.contentseo.domain.seo.SuggestionBundle;
import net.contentseo.util.SeoUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Builds heading, FAQ, meta description and internal link suggestions for a draft.
 */
@Component
public class SeoSuggestionGenerator {

    static final int TARGET_HEADING_COUNT = 3;
    static final int MAX_FAQ_SUGGESTIONS = 4;
    static final int MAX_INTERNAL_LINKS = 5;
    static final int META_DESCRIPTION_MAX_LENGTH = 155;

    private static final List<String> HEADING_TEMPLATES = List.of(
        "What is %s",
        "How to %s",
        "%s vs Alternatives",
        "Benefits of %s",
        "Common Mistakes with %s"
    );

    private static final List<String> FAQ_TEMPLATES = List.of(
        "What is %s?",
        "How does %s work?",
        "Why is %s important?",
        "Is %s worth it?"
    );

    /**
     * Generates the suggestion bundle for a post.
     *
     * @param post post fields
     * @param extracted plain text and headings of the body
     * @param metrics metrics of the body
     * @param linkFinder lookup for published posts; called at most once
     * @return suggestions, never {@code null}
     */
    public SuggestionBundle generate(PostContent post,
                                     ExtractedText extracted,
                                     SeoMetrics metrics,
                                     PublishedPostFinder linkFinder) {
        String keyword = post.primaryKeyword();
        return new SuggestionBundle(
            headingSuggestions(keyword, extracted.headings(), metrics.headingCount()),
            faqSuggestions(keyword),
            internalLinkSuggestions(post, linkFinder),
            generatedMetaDescription(post, extracted.plainText())
        );
    }

    List<String> headingSuggestions(String keyword, List<ExtractedHeading> headings, int headingCount) {
        int needed = TARGET_HEADING_COUNT - headingCount;
        if (needed <= 0 || !StringUtils.hasText(keyword)) {
            return List.of();
        }
        List<String> existing = headings.stream()
            .map(ExtractedHeading::text)
            .filter(StringUtils::hasText)
            .map(text -> text.toLowerCase(Locale.ROOT))
            .toList();

        List<String> suggestions = new ArrayList<>();
        for (String template : HEADING_TEMPLATES) {
            if (suggestions.size() >= needed) {
                break;
            }
            String candidate = template.formatted(keyword);
            String lowered = candidate.toLowerCase(Locale.ROOT);
            if (existing.stream().noneMatch(heading -> heading.contains(lowered))) {
                suggestions.add(candidate);
            }
        }
        return suggestions;
    }

    List<String> faqSuggestions(String keyword) {
        if (!StringUtils.hasText(keyword)) {
            return List.of();
        }
        return FAQ_TEMPLATES.stream()
            .limit(MAX_FAQ_SUGGESTIONS)
            .map(template -> template.formatted(keyword))
            .toList();
    }

    String generatedMetaDescription(PostContent post, String plainText) {
        if (StringUtils.hasText(post.metaDescription())) {
            return "";
        }
        return SeoUtils.leadingSentences(plainText, META_DESCRIPTION_MAX_LENGTH);
    }

    List<InternalLinkSuggestion> internalLinkSuggestions(PostContent post, PublishedPostFinder linkFinder) {
        if (linkFinder == null || !StringUtils.hasText(post.primaryKeyword())) {
            return List.of();
        }
        List<InternalLinkSuggestion> candidates =
            linkFinder.searchByKeywords(post.primaryKeyword(), post.secondaryKeywords());
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        String currentSlug = post.slug().trim();
        return candidates.stream()
            .filter(Objects::nonNull)
            .filter(candidate -> currentSlug.isEmpty() || !currentSlug.equalsIgnoreCase(candidate.slug().trim()))
            .limit(MAX_INTERNAL_LINKS)
            .toList();
    }
}
