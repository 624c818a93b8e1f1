package net.contentseo.application.seo;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.contentseo.domain.seo.GeneratedSeoFields;
import net.contentseo.support.seo.KeywordMatcher;
import net.contentseo.support.seo.PostTextExtractor;
import net.contentseo.util.SeoUtils;
import net.contentseo.util.SlugGenerator;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Derives starter SEO field values from a post title and body.
 *
 * <p>Output is deterministic so editors can regenerate without surprises.</p>
 */
@Slf4j
@Service
public class SeoFieldAutoGenerationService {

    private static final int META_TITLE_MAX_LENGTH = 60;
    private static final int META_DESCRIPTION_MAX_LENGTH = 155;
    private static final int OG_TITLE_MAX_LENGTH = 100;
    private static final int OG_DESCRIPTION_MAX_LENGTH = 300;
    private static final int TWITTER_TITLE_MAX_LENGTH = 70;
    private static final int TWITTER_DESCRIPTION_MAX_LENGTH = 200;
    private static final int SECONDARY_KEYWORD_COUNT = 5;

    private final PostTextExtractor textExtractor;

    public SeoFieldAutoGenerationService(PostTextExtractor textExtractor) {
        this.textExtractor = textExtractor;
    }

    /**
     * Generates SEO fields.
     *
     * @param title post title, required
     * @param body post markup, may be blank
     * @param existingKeyword keyword already chosen by the editor, may be blank
     * @return generated values
     * @throws PostSeoValidationException when the title is blank
     */
    public GeneratedSeoFields generate(String title, String body, String existingKeyword) {
        if (!StringUtils.hasText(title)) {
            throw new PostSeoValidationException(
                PostSeoValidationException.ErrorCode.TITLE_REQUIRED, "title", "Title is required");
        }
        String trimmedTitle = title.trim();

        String primaryKeyword = StringUtils.hasText(existingKeyword)
            ? existingKeyword.trim()
            : SeoUtils.extractPrimaryKeyword(trimmedTitle);
        List<String> secondaryKeywords = SeoUtils.secondaryKeywordPatterns(primaryKeyword, SECONDARY_KEYWORD_COUNT);

        String plainText = textExtractor.extract(body).plainText();
        String metaDescription = SeoUtils.leadingSentences(plainText, META_DESCRIPTION_MAX_LENGTH);
        String socialDescription = StringUtils.hasText(metaDescription) ? metaDescription : trimmedTitle;

        log.debug("Generated SEO fields for title='{}' with keyword='{}'", trimmedTitle, primaryKeyword);
        return new GeneratedSeoFields(
            primaryKeyword,
            secondaryKeywords,
            metaTitle(trimmedTitle, primaryKeyword),
            metaDescription,
            SeoUtils.capWithEllipsis(trimmedTitle, OG_TITLE_MAX_LENGTH),
            SeoUtils.capWithEllipsis(socialDescription, OG_DESCRIPTION_MAX_LENGTH),
            SeoUtils.capWithEllipsis(trimmedTitle, TWITTER_TITLE_MAX_LENGTH),
            SeoUtils.capWithEllipsis(socialDescription, TWITTER_DESCRIPTION_MAX_LENGTH),
            SlugGenerator.generatePostSlug(trimmedTitle)
        );
    }

    String metaTitle(String title, String primaryKeyword) {
        String metaTitle = title;
        if (StringUtils.hasText(primaryKeyword) && !KeywordMatcher.containsIgnoreCase(title, primaryKeyword)) {
            String guide = title + " - " + primaryKeyword + " Guide";
            String plain = title + " - " + primaryKeyword;
            if (guide.length() <= META_TITLE_MAX_LENGTH) {
                metaTitle = guide;
            } else if (plain.length() <= META_TITLE_MAX_LENGTH) {
                metaTitle = plain;
            }
        }
        if (metaTitle.length() <= META_TITLE_MAX_LENGTH) {
            return metaTitle;
        }
        String cut = metaTitle.substring(0, META_TITLE_MAX_LENGTH);
        int lastSpace = cut.lastIndexOf(' ');
        return lastSpace > 0 ? cut.substring(0, lastSpace) : cut;
    }
}
