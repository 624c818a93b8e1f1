package net.contentseo.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SeoUtilsTest {

    @Test
    void should_TruncateAtWordBoundaryWithEllipsisInsideLimit() {
        assertThat(SeoUtils.truncateDescription("The quick brown fox jumps", 15)).isEqualTo("The quick...");
        assertThat(SeoUtils.truncateDescription("The quick brown fox", 18)).isEqualTo("The quick brown...");
    }

    @Test
    void should_HardCutSingleLongWord() {
        assertThat(SeoUtils.truncateDescription("Supercalifragilistic", 10)).isEqualTo("Superca...");
    }

    @Test
    void should_ReturnTextUnchanged_When_ItFits() {
        assertThat(SeoUtils.truncateDescription("  Short   text ", 50)).isEqualTo("Short text");
        assertThat(SeoUtils.truncateDescription(" ", 50)).isEmpty();
    }

    @Test
    void should_OmitEllipsis_When_CutLandsOnSentenceEnd() {
        String text = "First sentence here. Second one. Third sentence is long.";

        assertThat(SeoUtils.leadingSentences(text, 35)).isEqualTo("First sentence here. Second one.");
    }

    @Test
    void should_CutMidSentenceWithEllipsis_When_NextSentenceOverflows() {
        String text = "Python rocks. It is used for scripting and automation everywhere";

        assertThat(SeoUtils.leadingSentences(text, 40)).isEqualTo("Python rocks. It is used for...");
    }

    @Test
    void should_FallBackToTruncation_When_FirstSentenceIsTooLong() {
        assertThat(SeoUtils.leadingSentences("A very long opening sentence without break", 20))
            .isEqualTo("A very long...");
    }

    @Test
    void should_PickLongestNonStopWordAsPrimaryKeyword() {
        assertThat(SeoUtils.extractPrimaryKeyword("How to Cook Pasta")).isEqualTo("Pasta");
        assertThat(SeoUtils.extractPrimaryKeyword("Bake Cake")).isEqualTo("Bake");
        assertThat(SeoUtils.extractPrimaryKeyword("The and of")).isEmpty();
        assertThat(SeoUtils.extractPrimaryKeyword("")).isEmpty();
    }

    @Test
    void should_ReturnRequestedNumberOfSecondaryPatterns() {
        assertThat(SeoUtils.secondaryKeywordPatterns("Rust", 3))
            .containsExactly("Rust tutorial", "Rust guide", "Rust tips");
        assertThat(SeoUtils.secondaryKeywordPatterns("Rust", 20)).hasSize(8);
        assertThat(SeoUtils.secondaryKeywordPatterns(" ", 3)).isEmpty();
    }

    @Test
    void should_CapWithEllipsis() {
        assertThat(SeoUtils.capWithEllipsis("abcdef", 5)).isEqualTo("ab...");
        assertThat(SeoUtils.capWithEllipsis("abc", 5)).isEqualTo("abc");
        assertThat(SeoUtils.capWithEllipsis(null, 5)).isEmpty();
    }
}
