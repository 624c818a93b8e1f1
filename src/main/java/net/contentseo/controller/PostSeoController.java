package net.contentseo.controller;

import java.util.Map;
import net.contentseo.application.seo.PostSeoScoringUseCase;
import net.contentseo.application.seo.PostSeoValidationException;
import net.contentseo.application.seo.SeoFieldAutoGenerationService;
import net.contentseo.application.seo.SeoFieldReviewPolicy;
import net.contentseo.config.SeoScoringProperties;
import net.contentseo.controller.dto.AutoGenerateSeoRequest;
import net.contentseo.controller.dto.PostSeoRequest;
import net.contentseo.controller.support.ErrorResponseUtils;
import net.contentseo.domain.seo.GeneratedSeoFields;
import net.contentseo.domain.seo.PostContent;
import net.contentseo.domain.seo.PostSeoAnalysis;
import net.contentseo.domain.seo.PublishedPostFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admin endpoints for scoring drafts and pre-filling SEO fields.
 *
 * <p>Stateless: each request is scored on its own input. Nothing is persisted here.</p>
 */
@RestController
@RequestMapping("/api/admin/seo")
public class PostSeoController {

    private static final Logger log = LoggerFactory.getLogger(PostSeoController.class);

    private final PostSeoScoringUseCase scoringUseCase;
    private final SeoFieldReviewPolicy reviewPolicy;
    private final SeoFieldAutoGenerationService autoGenerationService;
    private final PublishedPostFinder publishedPostFinder;
    private final SeoScoringProperties properties;

    public PostSeoController(PostSeoScoringUseCase scoringUseCase,
                             SeoFieldReviewPolicy reviewPolicy,
                             SeoFieldAutoGenerationService autoGenerationService,
                             PublishedPostFinder publishedPostFinder,
                             SeoScoringProperties properties) {
        this.scoringUseCase = scoringUseCase;
        this.reviewPolicy = reviewPolicy;
        this.autoGenerationService = autoGenerationService;
        this.publishedPostFinder = publishedPostFinder;
        this.properties = properties;
    }

    /**
     * Scores a draft and returns the checklist, suggestions and field review.
     */
    @PostMapping("/analyze")
    public ResponseEntity<PostSeoPayloads.AnalysisPayload> analyze(@RequestBody PostSeoRequest request) {
        PostContent post = request.toPostContent();
        PostSeoAnalysis analysis = scoringUseCase.score(post, publishedPostFinder);
        return ResponseEntity.ok(PostSeoPayloads.AnalysisPayload.from(
            analysis,
            reviewPolicy.review(post),
            properties.getPublishableThreshold()
        ));
    }

    /**
     * Returns metrics and suggestions without the rubric checklist.
     */
    @PostMapping("/suggestions")
    public ResponseEntity<PostSeoPayloads.SuggestionsPayload> suggestions(@RequestBody PostSeoRequest request) {
        PostSeoAnalysis analysis = scoringUseCase.score(request.toPostContent(), publishedPostFinder);
        return ResponseEntity.ok(new PostSeoPayloads.SuggestionsPayload(analysis.metrics(), analysis.suggestions()));
    }

    /**
     * Generates starter SEO field values from a title and body.
     */
    @PostMapping("/auto-generate")
    public ResponseEntity<GeneratedSeoFields> autoGenerate(@RequestBody AutoGenerateSeoRequest request) {
        return ResponseEntity.ok(autoGenerationService.generate(
            request.title(),
            request.content(),
            request.existingKeyword()
        ));
    }

    @ExceptionHandler(PostSeoValidationException.class)
    public ResponseEntity<Map<String, String>> handleValidationFailure(PostSeoValidationException exception) {
        log.debug("SEO request rejected ({}): {}", exception.errorCode(), exception.getMessage());
        return ErrorResponseUtils.invalidField(
            exception.errorCode().name(),
            exception.getMessage(),
            exception.field()
        );
    }
}
