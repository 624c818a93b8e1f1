package net.contentseo.application.seo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import net.contentseo.domain.seo.GeneratedSeoFields;
import net.contentseo.support.seo.PostTextExtractor;
import net.contentseo.util.SlugGenerator;
import org.junit.jupiter.api.Test;

class SeoFieldAutoGenerationServiceTest {

    private final SeoFieldAutoGenerationService service = new SeoFieldAutoGenerationService(new PostTextExtractor());

    @Test
    void should_RejectBlankTitle() {
        assertThatThrownBy(() -> service.generate("  ", "<p>body</p>", ""))
            .isInstanceOfSatisfying(PostSeoValidationException.class, failure -> {
                assertThat(failure.errorCode()).isEqualTo(PostSeoValidationException.ErrorCode.TITLE_REQUIRED);
                assertThat(failure.field()).isEqualTo("title");
            });
    }

    @Test
    void should_ExtractKeywordAndBuildFields_When_NoKeywordGiven() {
        GeneratedSeoFields fields = service.generate(
            "Learn Python Programming Quickly",
            "<h2>Intro</h2><p>Python is a language. It is popular.</p>",
            ""
        );

        assertThat(fields.primaryKeyword()).isEqualTo("Programming");
        assertThat(fields.secondaryKeywords()).containsExactly(
            "Programming tutorial",
            "Programming guide",
            "Programming tips",
            "learn Programming",
            "Programming best practices"
        );
        assertThat(fields.metaTitle()).isEqualTo("Learn Python Programming Quickly");
        assertThat(fields.metaDescription()).isEqualTo("Intro Python is a language. It is popular.");
        assertThat(fields.ogDescription()).isEqualTo(fields.metaDescription());
        assertThat(fields.slug()).isEqualTo("learn-python-programming-quickly");
    }

    @Test
    void should_KeepExistingKeywordAndAppendGuide_When_TitleLacksKeyword() {
        GeneratedSeoFields fields = service.generate("Getting Started", "", "Django");

        assertThat(fields.primaryKeyword()).isEqualTo("Django");
        assertThat(fields.metaTitle()).isEqualTo("Getting Started - Django Guide");
        assertThat(fields.metaDescription()).isEmpty();
        assertThat(fields.ogDescription()).isEqualTo("Getting Started");
        assertThat(fields.twitterDescription()).isEqualTo("Getting Started");
    }

    @Test
    void should_TrimMetaTitleAtWordBoundary_When_TitleIsTooLong() {
        String title = "An extremely detailed walkthrough of every single thing you need to know";

        String metaTitle = service.metaTitle(title, "");

        assertThat(metaTitle).hasSizeLessThanOrEqualTo(60).isEqualTo("An extremely detailed walkthrough of every single thing you");
    }

    @Test
    void should_CapSocialFieldsWithEllipsis() {
        String title = "Python ".repeat(20).trim();

        GeneratedSeoFields fields = service.generate(title, "", "Python");

        assertThat(fields.twitterTitle()).hasSize(70).endsWith("...");
        assertThat(fields.ogTitle()).hasSize(100).endsWith("...");
        assertThat(SlugGenerator.isRubricCompliant(fields.slug())).isTrue();
    }
}
