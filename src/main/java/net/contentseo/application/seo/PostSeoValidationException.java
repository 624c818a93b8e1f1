package net.contentseo.application.seo;

import java.util.Objects;

/**
 * Thrown when a post cannot be analysed because a required input is missing.
 *
 * <p>Carries the offending field name so the admin UI can highlight it.
 * Missing optional fields never raise this; they only lower the score.</p>
 */
public class PostSeoValidationException extends RuntimeException {

    /**
     * Canonical validation failure categories.
     */
    public enum ErrorCode {
        POST_REQUIRED,
        BODY_REQUIRED,
        TITLE_REQUIRED
    }

    private final ErrorCode errorCode;
    private final String field;

    public PostSeoValidationException(ErrorCode errorCode, String field, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
        this.field = Objects.requireNonNull(field, "field must not be null");
    }

    public static PostSeoValidationException bodyRequired() {
        return new PostSeoValidationException(ErrorCode.BODY_REQUIRED, "body", "Post body is required for SEO analysis");
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    /**
     * Name of the input field that failed validation.
     */
    public String field() {
        return field;
    }
}
