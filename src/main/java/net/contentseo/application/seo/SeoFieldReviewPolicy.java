package net.contentseo.application.seo;

import java.util.ArrayList;
import java.util.List;
import net.contentseo.domain.seo.PostContent;
import net.contentseo.domain.seo.PostImage;
import net.contentseo.domain.seo.SeoFieldReview;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Reports missing required SEO fields and recommendation warnings before publishing.
 */
@Component
public class SeoFieldReviewPolicy {

    private static final int RECOMMENDED_META_TITLE_LENGTH = 60;
    private static final int RECOMMENDED_META_DESCRIPTION_LENGTH = 155;

    /**
     * Reviews the SEO fields of a post. Never throws.
     *
     * @param post post fields
     * @return errors for required fields, warnings for recommendations
     */
    public SeoFieldReview review(PostContent post) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (!StringUtils.hasText(post.primaryKeyword())) {
            errors.add("Primary keyword is required");
        }

        String metaTitle = post.metaTitle().trim();
        if (metaTitle.isEmpty()) {
            errors.add("Meta title is required");
        } else if (metaTitle.length() > RECOMMENDED_META_TITLE_LENGTH) {
            warnings.add("Meta title should be %d characters or less (currently %d)"
                .formatted(RECOMMENDED_META_TITLE_LENGTH, metaTitle.length()));
        }

        String metaDescription = post.metaDescription().trim();
        if (metaDescription.isEmpty()) {
            errors.add("Meta description is required");
        } else if (metaDescription.length() > RECOMMENDED_META_DESCRIPTION_LENGTH) {
            warnings.add("Meta description should be %d characters or less (currently %d)"
                .formatted(RECOMMENDED_META_DESCRIPTION_LENGTH, metaDescription.length()));
        }

        recommend(post.ogTitle(), "OG title is recommended for social sharing", warnings);
        recommend(post.ogDescription(), "OG description is recommended for social sharing", warnings);
        recommend(post.ogImage(), "OG image is recommended for social sharing", warnings);

        checkAltText(post.featuredImage(), warnings);
        post.images().forEach(image -> checkAltText(image, warnings));

        return new SeoFieldReview(errors, warnings);
    }

    private static void recommend(String value, String warning, List<String> warnings) {
        if (!StringUtils.hasText(value)) {
            warnings.add(warning);
        }
    }

    private static void checkAltText(PostImage image, List<String> warnings) {
        if (image.isPresent() && !image.hasAltText()) {
            warnings.add("Image " + image.url() + " is missing ALT text");
        }
    }
}
