package net.contentseo.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for SEO scoring.
 *
 * <p>The rubric thresholds are fixed in code; only the publish gate and the
 * internal link lookup size are tunable.</p>
 */
@Component
@ConfigurationProperties(prefix = "seo.scoring")
public class SeoScoringProperties {

    /**
     * Total score at or above which a draft is reported as publishable.
     */
    private int publishableThreshold = 70;

    /**
     * Number of ranked rows fetched when looking up internal link candidates.
     */
    private int linkCandidatePool = 20;

    @PostConstruct
    void validate() {
        Assert.isTrue(publishableThreshold >= 0 && publishableThreshold <= 100,
                "seo.scoring.publishable-threshold must be between 0 and 100");
        Assert.isTrue(linkCandidatePool >= 5,
                "seo.scoring.link-candidate-pool must be at least 5");
    }

    public int getPublishableThreshold() {
        return publishableThreshold;
    }

    public void setPublishableThreshold(int publishableThreshold) {
        this.publishableThreshold = publishableThreshold;
    }

    public int getLinkCandidatePool() {
        return linkCandidatePool;
    }

    public void setLinkCandidatePool(int linkCandidatePool) {
        this.linkCandidatePool = linkCandidatePool;
    }
}
