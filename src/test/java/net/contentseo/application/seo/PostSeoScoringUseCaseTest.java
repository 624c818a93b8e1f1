package net.contentseo.application.seo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import net.contentseo.domain.seo.FactorScore;
import net.contentseo.domain.seo.InternalLinkSuggestion;
import net.contentseo.domain.seo.PostContent;
import net.contentseo.domain.seo.PostImage;
import net.contentseo.domain.seo.PostSeoAnalysis;
import net.contentseo.domain.seo.PublishedPostFinder;
import net.contentseo.domain.seo.RubricFactor;
import net.contentseo.support.seo.PostTextExtractor;
import net.contentseo.support.seo.SeoMetricsCalculator;
import net.contentseo.support.seo.SeoRubricScorer;
import net.contentseo.support.seo.SeoSuggestionGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PostSeoScoringUseCaseTest {

    private static final PublishedPostFinder RELATED_POSTS = (primary, secondary) -> List.of(
        new InternalLinkSuggestion("Python Basics", "python-basics"),
        new InternalLinkSuggestion("Python Programming Guide", "python-programming-guide"),
        new InternalLinkSuggestion("Django in Practice", "django-in-practice")
    );

    private PostSeoScoringUseCase useCase;

    @BeforeEach
    void setUp() {
        useCase = new PostSeoScoringUseCase(
            new PostTextExtractor(),
            new SeoMetricsCalculator(),
            new SeoRubricScorer(),
            new SeoSuggestionGenerator()
        );
    }

    @Test
    void should_RaiseBodyValidationFailure_When_EveryFieldIsEmpty() {
        PostContent empty = PostContent.builder().build();

        assertThatThrownBy(() -> useCase.score(empty, RELATED_POSTS))
            .isInstanceOfSatisfying(PostSeoValidationException.class, failure -> {
                assertThat(failure.errorCode()).isEqualTo(PostSeoValidationException.ErrorCode.BODY_REQUIRED);
                assertThat(failure.field()).isEqualTo("body");
            });
    }

    @Test
    void should_RaisePostValidationFailure_When_PostIsNull() {
        assertThatThrownBy(() -> useCase.score(null, RELATED_POSTS))
            .isInstanceOfSatisfying(PostSeoValidationException.class,
                failure -> assertThat(failure.field()).isEqualTo("post"));
    }

    @Test
    void should_ScoreShortBody_When_BodyIsPresentButTiny() {
        PostContent post = PostContent.builder().body("<p></p>").build();

        PostSeoAnalysis analysis = useCase.score(post, PublishedPostFinder.none());

        assertThat(analysis.metrics().wordCount()).isZero();
        assertThat(analysis.metrics().readingTimeMinutes()).isZero();
        assertThat(analysis.totalScore()).isZero();
    }

    @Test
    void should_AwardFullHeadingCredit_When_BodyHasExactlyThreeHeadings() {
        PostContent post = PostContent.builder()
            .body("<h2>One</h2><p>a</p><h2>Two</h2><p>b</p><h3>Three</h3>")
            .primaryKeyword("Python")
            .build();

        PostSeoAnalysis analysis = useCase.score(post, PublishedPostFinder.none());

        assertThat(analysis.breakdown().factor(RubricFactor.HEADINGS).pointsEarned()).isEqualTo(10);
        assertThat(analysis.suggestions().headingSuggestions()).isEmpty();
    }

    @Test
    void should_GenerateMetaDescriptionFromBody_When_MetaDescriptionIsEmpty() {
        PostContent post = PostContent.builder()
            .body("<p>Python is a language. It is popular.</p>")
            .primaryKeyword("Python")
            .build();

        PostSeoAnalysis analysis = useCase.score(post, PublishedPostFinder.none());

        assertThat(analysis.suggestions().generatedMetaDescription()).isEqualTo("Python is a language. It is popular.");
    }

    @Test
    void should_ScoreOneHundred_When_PostSatisfiesEveryFactor() {
        PostSeoAnalysis analysis = useCase.score(completePost(), RELATED_POSTS);

        assertThat(analysis.metrics().wordCount()).isEqualTo(1000);
        assertThat(analysis.metrics().keywordDensityPercent()).isEqualTo(1.5d);
        assertThat(analysis.metrics().headingCount()).isEqualTo(3);
        assertThat(analysis.breakdown().factors()).allMatch(FactorScore::isFullCredit);
        assertThat(analysis.totalScore()).isEqualTo(100);
        assertThat(analysis.isPublishable(70)).isTrue();
    }

    @Test
    void should_BuildSuggestionsAlongsideScore_ExcludingTheScoredPost() {
        PostSeoAnalysis analysis = useCase.score(completePost(), RELATED_POSTS);

        assertThat(analysis.suggestions().internalLinkSuggestions())
            .extracting(InternalLinkSuggestion::slug)
            .containsExactly("python-basics", "django-in-practice");
        assertThat(analysis.suggestions().faqSuggestions()).hasSize(4);
        assertThat(analysis.suggestions().headingSuggestions()).isEmpty();
        assertThat(analysis.suggestions().generatedMetaDescription()).isEmpty();
    }

    @Test
    void should_KeepEveryScoreWithinRubricBounds_ForVariedPosts() {
        Random random = new Random(42L);
        String[] fragments = {
            "<h2>Python tips</h2>", "<p>python</p>", "<p>lorem ipsum dolor</p>", "<h3></h3>",
            "<b>unclosed", "<h1>Python</h1>", "python python python", "<p>", "</div>"
        };
        for (int i = 0; i < 200; i++) {
            StringBuilder body = new StringBuilder("x");
            int pieces = random.nextInt(60);
            for (int p = 0; p < pieces; p++) {
                body.append(fragments[random.nextInt(fragments.length)]);
            }
            PostContent post = PostContent.builder()
                .title(random.nextBoolean() ? "Python ".repeat(random.nextInt(12)) : "")
                .slug(random.nextBoolean() ? "python-guide" : "Bad Slug")
                .body(body.toString())
                .primaryKeyword(random.nextBoolean() ? "python" : "")
                .metaDescription("python ".repeat(random.nextInt(30)))
                .featuredImage(random.nextBoolean() ? new PostImage("/hero.png", random.nextBoolean() ? "alt" : "") : null)
                .ogTitle(random.nextBoolean() ? "og" : "")
                .twitterImage(random.nextBoolean() ? "/tw.png" : "")
                .build();

            PostSeoAnalysis analysis = useCase.score(post, PublishedPostFinder.none());

            assertThat(analysis.totalScore()).isBetween(0, 100);
            assertThat(analysis.breakdown().factors()).allSatisfy(score ->
                assertThat(score.pointsEarned()).isBetween(0, score.pointsMax()));
            assertThat(analysis.suggestions().headingSuggestions())
                .hasSizeLessThanOrEqualTo(Math.max(0, 3 - analysis.metrics().headingCount()));
        }
    }

    @Test
    void should_ProduceSameResults_When_CalledConcurrently() throws Exception {
        List<PostContent> posts = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            posts.add(PostContent.builder()
                .title("Post number " + i + " about Python")
                .slug("post-" + i)
                .body("<h2>Part " + i + "</h2><p>" + "python word ".repeat(i + 1) + "</p>")
                .primaryKeyword("python")
                .build());
        }
        List<PostSeoAnalysis> sequential = posts.stream().map(post -> useCase.score(post, RELATED_POSTS)).toList();

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<PostSeoAnalysis>> futures = new ArrayList<>();
            for (PostContent post : posts) {
                futures.add(executor.submit(() -> useCase.score(post, RELATED_POSTS)));
            }
            for (int i = 0; i < posts.size(); i++) {
                assertThat(futures.get(i).get(10, TimeUnit.SECONDS)).isEqualTo(sequential.get(i));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    static PostContent completePost() {
        List<String> paragraphWords = new ArrayList<>(Collections.nCopies(12, "python"));
        paragraphWords.addAll(Collections.nCopies(981, "lorem"));
        String body = "<h2>What is Python</h2><h2>Python basics</h2><h2>Python tips</h2><p>"
            + String.join(" ", paragraphWords) + "</p>";

        return PostContent.builder()
            .title("Python Programming Guide for Absolute Beginners")
            .slug("python-programming-guide")
            .body(body)
            .excerpt("A friendly first step into Python.")
            .primaryKeyword("Python")
            .secondaryKeywords(List.of("django"))
            .metaTitle("Python Programming Guide")
            .metaDescription("Learn Python from scratch with practical examples, clear explanations and guided "
                + "exercises that build real confidence for beginners.")
            .ogTitle("Python Programming Guide")
            .twitterTitle("Python Programming Guide")
            .featuredImage(new PostImage("/images/python.png", "Python logo on a laptop screen"))
            .build();
    }
}
