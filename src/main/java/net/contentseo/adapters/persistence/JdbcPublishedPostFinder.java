package net.contentseo.adapters.persistence;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.contentseo.config.SeoScoringProperties;
import net.contentseo.domain.seo.InternalLinkSuggestion;
import net.contentseo.domain.seo.PublishedPostFinder;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Postgres adapter that ranks published posts as internal link candidates.
 *
 * <p>Owns the relevance SQL for the {@code posts} table so the scoring engine
 * stays free of storage concerns. Title hits on the primary keyword weigh 3,
 * body hits 1, and each secondary keyword found in the title adds 1.</p>
 */
@Slf4j
@Repository
public class JdbcPublishedPostFinder implements PublishedPostFinder {

    private static final String PUBLISHED_STATUS = "published";
    private static final RowMapper<InternalLinkSuggestion> SUGGESTION_MAPPER =
        (rs, rowNum) -> new InternalLinkSuggestion(rs.getString("title"), rs.getString("slug"));

    private final JdbcTemplate jdbcTemplate;
    private final SeoScoringProperties properties;

    public JdbcPublishedPostFinder(JdbcTemplate jdbcTemplate, SeoScoringProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
    }

    /**
     * Loads published posts ranked by keyword relevance.
     *
     * @param primaryKeyword focus keyword, may be blank
     * @param secondaryKeywords supporting phrases, may be empty
     * @return ranked candidates, empty when no keyword is usable
     */
    @Override
    @Transactional(readOnly = true)
    @CircuitBreaker(name = "publishedPostFinder", fallbackMethod = "searchFallback")
    public List<InternalLinkSuggestion> searchByKeywords(String primaryKeyword, List<String> secondaryKeywords) {
        RelevanceQuery query = buildQuery(primaryKeyword, secondaryKeywords, properties.getLinkCandidatePool());
        if (query == null) {
            return List.of();
        }
        return jdbcTemplate.query(query.sql(), SUGGESTION_MAPPER, query.args());
    }

    public List<InternalLinkSuggestion> searchFallback(String primaryKeyword,
                                                       List<String> secondaryKeywords,
                                                       Throwable cause) {
        log.warn("Internal link lookup unavailable for keyword '{}'; returning no candidates: {}",
            primaryKeyword, cause.getMessage());
        return List.of();
    }

    /**
     * Builds the ranking query, or {@code null} when there is nothing to search for.
     */
    static RelevanceQuery buildQuery(String primaryKeyword, List<String> secondaryKeywords, int limit) {
        List<String> scoreTerms = new ArrayList<>();
        List<Object> args = new ArrayList<>();

        if (StringUtils.hasText(primaryKeyword)) {
            String pattern = likePattern(primaryKeyword);
            scoreTerms.add("CASE WHEN title ILIKE ? THEN 3 ELSE 0 END");
            args.add(pattern);
            scoreTerms.add("CASE WHEN content ILIKE ? THEN 1 ELSE 0 END");
            args.add(pattern);
        }
        if (secondaryKeywords != null) {
            for (String keyword : secondaryKeywords) {
                if (StringUtils.hasText(keyword)) {
                    scoreTerms.add("CASE WHEN title ILIKE ? THEN 1 ELSE 0 END");
                    args.add(likePattern(keyword));
                }
            }
        }
        if (scoreTerms.isEmpty()) {
            return null;
        }

        String sql = """
            SELECT title, slug
            FROM (
                SELECT title, slug, published_at, (%s) AS relevance
                FROM posts
                WHERE status = ?
            ) ranked
            WHERE relevance > 0
            ORDER BY relevance DESC, published_at DESC
            LIMIT ?
            """.formatted(String.join(" + ", scoreTerms));
        args.add(PUBLISHED_STATUS);
        args.add(limit);
        return new RelevanceQuery(sql, args.toArray());
    }

    private static String likePattern(String keyword) {
        String escaped = keyword.trim()
            .replace("\\", "\\\\")
            .replace("%", "\\%")
            .replace("_", "\\_");
        return "%" + escaped + "%";
    }

    record RelevanceQuery(String sql, Object[] args) {
    }
}
