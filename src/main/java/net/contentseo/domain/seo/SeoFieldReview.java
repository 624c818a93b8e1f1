package net.contentseo.domain.seo;

import java.util.List;

/**
 * Required-field errors and recommendation warnings for a post's SEO fields.
 */
public record SeoFieldReview(List<String> errors, List<String> warnings) {

    public SeoFieldReview {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean isClean() {
        return errors.isEmpty();
    }
}
