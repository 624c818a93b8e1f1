package net.contentseo.domain.seo;

import java.util.List;

/**
 * Draft post fields submitted for SEO analysis.
 *
 * <p>Absent optional fields are represented as empty strings or empty lists;
 * the compact constructor normalizes {@code null} inputs so every scoring rule
 * can treat "empty" and "absent" the same way.</p>
 *
 * @param title post title shown as the page headline
 * @param slug URL slug of the post
 * @param body rich markup content
 * @param excerpt short teaser text
 * @param primaryKeyword focus keyword or phrase
 * @param secondaryKeywords ordered supporting phrases
 * @param metaTitle HTML title override
 * @param metaDescription meta description tag value
 * @param ogTitle Open Graph title
 * @param ogDescription Open Graph description
 * @param ogImage Open Graph image URL
 * @param twitterTitle Twitter card title
 * @param twitterDescription Twitter card description
 * @param twitterImage Twitter card image URL
 * @param canonicalUrl canonical URL declared for the post
 * @param schemaType structured data type (for example {@code Article})
 * @param featuredImage hero image, {@link PostImage#NONE} when absent
 * @param images additional inline images
 */
public record PostContent(
    String title,
    String slug,
    String body,
    String excerpt,
    String primaryKeyword,
    List<String> secondaryKeywords,
    String metaTitle,
    String metaDescription,
    String ogTitle,
    String ogDescription,
    String ogImage,
    String twitterTitle,
    String twitterDescription,
    String twitterImage,
    String canonicalUrl,
    String schemaType,
    PostImage featuredImage,
    List<PostImage> images
) {

    public PostContent {
        title = emptyIfNull(title);
        slug = emptyIfNull(slug);
        body = emptyIfNull(body);
        excerpt = emptyIfNull(excerpt);
        primaryKeyword = emptyIfNull(primaryKeyword).trim();
        secondaryKeywords = secondaryKeywords == null
            ? List.of()
            : secondaryKeywords.stream().filter(keyword -> keyword != null).map(String::trim).toList();
        metaTitle = emptyIfNull(metaTitle);
        metaDescription = emptyIfNull(metaDescription);
        ogTitle = emptyIfNull(ogTitle);
        ogDescription = emptyIfNull(ogDescription);
        ogImage = emptyIfNull(ogImage);
        twitterTitle = emptyIfNull(twitterTitle);
        twitterDescription = emptyIfNull(twitterDescription);
        twitterImage = emptyIfNull(twitterImage);
        canonicalUrl = emptyIfNull(canonicalUrl);
        schemaType = emptyIfNull(schemaType);
        featuredImage = featuredImage == null ? PostImage.NONE : featuredImage;
        images = images == null
            ? List.of()
            : images.stream().filter(image -> image != null).toList();
    }

    /**
     * Starts a builder with every field empty.
     */
    public static Builder builder() {
        return new Builder();
    }

    private static String emptyIfNull(String value) {
        return value == null ? "" : value;
    }

    /**
     * Fluent builder used by request mappers and tests.
     */
    public static final class Builder {
        private String title;
        private String slug;
        private String body;
        private String excerpt;
        private String primaryKeyword;
        private List<String> secondaryKeywords;
        private String metaTitle;
        private String metaDescription;
        private String ogTitle;
        private String ogDescription;
        private String ogImage;
        private String twitterTitle;
        private String twitterDescription;
        private String twitterImage;
        private String canonicalUrl;
        private String schemaType;
        private PostImage featuredImage;
        private List<PostImage> images;

        private Builder() {
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder slug(String slug) {
            this.slug = slug;
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder excerpt(String excerpt) {
            this.excerpt = excerpt;
            return this;
        }

        public Builder primaryKeyword(String primaryKeyword) {
            this.primaryKeyword = primaryKeyword;
            return this;
        }

        public Builder secondaryKeywords(List<String> secondaryKeywords) {
            this.secondaryKeywords = secondaryKeywords;
            return this;
        }

        public Builder metaTitle(String metaTitle) {
            this.metaTitle = metaTitle;
            return this;
        }

        public Builder metaDescription(String metaDescription) {
            this.metaDescription = metaDescription;
            return this;
        }

        public Builder ogTitle(String ogTitle) {
            this.ogTitle = ogTitle;
            return this;
        }

        public Builder ogDescription(String ogDescription) {
            this.ogDescription = ogDescription;
            return this;
        }

        public Builder ogImage(String ogImage) {
            this.ogImage = ogImage;
            return this;
        }

        public Builder twitterTitle(String twitterTitle) {
            this.twitterTitle = twitterTitle;
            return this;
        }

        public Builder twitterDescription(String twitterDescription) {
            this.twitterDescription = twitterDescription;
            return this;
        }

        public Builder twitterImage(String twitterImage) {
            this.twitterImage = twitterImage;
            return this;
        }

        public Builder canonicalUrl(String canonicalUrl) {
            this.canonicalUrl = canonicalUrl;
            return this;
        }

        public Builder schemaType(String schemaType) {
            this.schemaType = schemaType;
            return this;
        }

        public Builder featuredImage(PostImage featuredImage) {
            this.featuredImage = featuredImage;
            return this;
        }

        public Builder images(List<PostImage> images) {
            this.images = images;
            return this;
        }

        public PostContent build() {
            return new PostContent(
                title,
                slug,
                body,
                excerpt,
                primaryKeyword,
                secondaryKeywords,
                metaTitle,
                metaDescription,
                ogTitle,
                ogDescription,
                ogImage,
                twitterTitle,
                twitterDescription,
                twitterImage,
                canonicalUrl,
                schemaType,
                featuredImage,
                images
            );
        }
    }
}
