package net.contentseo.domain.seo;

/**
 * Fixed rubric factors in checklist order. Maximum points sum to 100.
 */
public enum RubricFactor {
    TITLE("Title", 10),
    META_DESCRIPTION("Meta description", 10),
    PRIMARY_KEYWORD("Primary keyword presence", 15),
    CONTENT_LENGTH("Content length", 15),
    HEADINGS("Headings", 10),
    IMAGES("Images", 10),
    KEYWORD_DENSITY("Keyword density", 10),
    URL_SLUG("URL slug", 5),
    EXCERPT("Excerpt", 5),
    SOCIAL_TAGS("Social tags", 10);

    private final String label;
    private final int maxPoints;

    RubricFactor(String label, int maxPoints) {
        this.label = label;
        this.maxPoints = maxPoints;
    }

    public String label() {
        return label;
    }

    public int maxPoints() {
        return maxPoints;
    }
}
