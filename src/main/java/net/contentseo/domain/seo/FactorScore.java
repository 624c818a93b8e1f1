package net.contentseo.domain.seo;

import java.util.Objects;

/**
 * Points earned for a single rubric factor.
 */
public record FactorScore(RubricFactor factor, int pointsEarned, int pointsMax) {

    public FactorScore {
        Objects.requireNonNull(factor, "factor must not be null");
        if (pointsMax != factor.maxPoints()) {
            throw new IllegalArgumentException(
                "pointsMax for " + factor + " must be " + factor.maxPoints() + " but was " + pointsMax
            );
        }
        if (pointsEarned < 0 || pointsEarned > pointsMax) {
            throw new IllegalArgumentException(
                "pointsEarned for " + factor + " must be within 0.." + pointsMax + " but was " + pointsEarned
            );
        }
    }

    public static FactorScore of(RubricFactor factor, int pointsEarned) {
        return new FactorScore(factor, pointsEarned, factor.maxPoints());
    }

    public boolean isFullCredit() {
        return pointsEarned == pointsMax;
    }
}
