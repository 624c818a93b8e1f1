package net.contentseo.controller.dto;

import jakarta.annotation.Nullable;

/**
 * Request for generating starter SEO fields from a title and body.
 *
 * @param title post title, required
 * @param content post markup
 * @param existingKeyword keyword already chosen by the editor
 */
public record AutoGenerateSeoRequest(
    @Nullable String title,
    @Nullable String content,
    @Nullable String existingKeyword
) {
}
