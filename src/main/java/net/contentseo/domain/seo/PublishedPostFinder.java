package net.contentseo.domain.seo;

import java.util.List;

/**
 * Read-side port for locating published posts related to a set of keywords.
 *
 * <p>Implementations own ranking, retry and timeout policy. Callers consume
 * the returned order as-is.</p>
 */
@FunctionalInterface
public interface PublishedPostFinder {

    /**
     * Finds published posts matching the supplied keywords.
     *
     * @param primaryKeyword focus keyword of the post being edited
     * @param secondaryKeywords supporting phrases, possibly empty
     * @return candidates ordered by relevance, most relevant first
     */
    List<InternalLinkSuggestion> searchByKeywords(String primaryKeyword, List<String> secondaryKeywords);

    /**
     * Finder that never returns candidates.
     */
    static PublishedPostFinder none() {
        return (primaryKeyword, secondaryKeywords) -> List.of();
    }
}
