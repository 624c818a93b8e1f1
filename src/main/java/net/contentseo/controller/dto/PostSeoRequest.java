package net.contentseo.controller.dto;

import jakarta.annotation.Nullable;
import java.util.List;
import net.contentseo.domain.seo.PostContent;
import net.contentseo.domain.seo.PostImage;

/**
 * Admin editor payload describing a draft post to analyse.
 *
 * <p>Every field is optional at the transport level; absent values are
 * mapped to empty strings and lists.</p>
 */
public record PostSeoRequest(
    @Nullable String title,
    @Nullable String slug,
    @Nullable String body,
    @Nullable String excerpt,
    @Nullable String primaryKeyword,
    @Nullable List<String> secondaryKeywords,
    @Nullable String metaTitle,
    @Nullable String metaDescription,
    @Nullable String ogTitle,
    @Nullable String ogDescription,
    @Nullable String ogImage,
    @Nullable String twitterTitle,
    @Nullable String twitterDescription,
    @Nullable String twitterImage,
    @Nullable String canonicalUrl,
    @Nullable String schemaType,
    @Nullable ImagePayload featuredImage,
    @Nullable List<ImagePayload> images
) {

    /**
     * Image reference as sent by the editor.
     */
    public record ImagePayload(@Nullable String url, @Nullable String altText) {

        PostImage toPostImage() {
            return new PostImage(url, altText);
        }
    }

    public PostContent toPostContent() {
        return PostContent.builder()
            .title(title)
            .slug(slug)
            .body(body)
            .excerpt(excerpt)
            .primaryKeyword(primaryKeyword)
            .secondaryKeywords(secondaryKeywords)
            .metaTitle(metaTitle)
            .metaDescription(metaDescription)
            .ogTitle(ogTitle)
            .ogDescription(ogDescription)
            .ogImage(ogImage)
            .twitterTitle(twitterTitle)
            .twitterDescription(twitterDescription)
            .twitterImage(twitterImage)
            .canonicalUrl(canonicalUrl)
            .schemaType(schemaType)
            .featuredImage(featuredImage == null ? null : featuredImage.toPostImage())
            .images(images == null ? null : images.stream()
                .filter(image -> image != null)
                .map(ImagePayload::toPostImage)
                .toList())
            .build();
    }
}
