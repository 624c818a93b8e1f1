package net.contentseo.domain.seo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ScoreBreakdownTest {

    @Test
    void should_RejectPointsOutsideFactorRange() {
        assertThatThrownBy(() -> FactorScore.of(RubricFactor.URL_SLUG, 6))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("0..5");
        assertThatThrownBy(() -> FactorScore.of(RubricFactor.TITLE, -1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FactorScore(RubricFactor.TITLE, 5, 20))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be 10");
    }

    @Test
    void should_RejectDuplicateFactors() {
        assertThatThrownBy(() -> new ScoreBreakdown(List.of(
            FactorScore.of(RubricFactor.TITLE, 5),
            FactorScore.of(RubricFactor.TITLE, 10)
        ))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void should_SumEarnedAndMaximumPoints() {
        ScoreBreakdown breakdown = new ScoreBreakdown(List.of(
            FactorScore.of(RubricFactor.TITLE, 5),
            FactorScore.of(RubricFactor.PRIMARY_KEYWORD, 15),
            FactorScore.of(RubricFactor.EXCERPT, 0)
        ));

        assertThat(breakdown.total()).isEqualTo(20);
        assertThat(breakdown.maxTotal()).isEqualTo(30);
        assertThat(breakdown.factor(RubricFactor.IMAGES).pointsEarned()).isZero();
        assertThat(breakdown.asMap().keySet())
            .containsExactly(RubricFactor.TITLE, RubricFactor.PRIMARY_KEYWORD, RubricFactor.EXCERPT);
    }

    @Test
    void should_AddUpToOneHundred_AcrossAllFactors() {
        int max = 0;
        for (RubricFactor factor : RubricFactor.values()) {
            max += factor.maxPoints();
        }
        assertThat(max).isEqualTo(100);
    }

    @Test
    void should_ComparePublishableAgainstThreshold() {
        ScoreBreakdown breakdown = new ScoreBreakdown(List.of(
            FactorScore.of(RubricFactor.CONTENT_LENGTH, 15),
            FactorScore.of(RubricFactor.PRIMARY_KEYWORD, 15)
        ));
        PostSeoAnalysis analysis = new PostSeoAnalysis(
            new SeoMetrics(1000, 5, 1.5d, 15, 3),
            breakdown,
            new SuggestionBundle(null, null, null, null)
        );

        assertThat(analysis.isPublishable(30)).isTrue();
        assertThat(analysis.isPublishable(31)).isFalse();
        assertThat(analysis.suggestions().generatedMetaDescription()).isEmpty();
    }
}
