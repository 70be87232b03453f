package dev.aparikh.hybridsearch.evaluation;

import dev.aparikh.hybridsearch.search.HybridSearchService;
import dev.aparikh.hybridsearch.search.SearchOverrides;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.jspecify.annotations.Nullable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/eval")
@Tag(name = "Evaluation", description = "Offline MRR@N and Recall@N over labeled queries")
class EvalController {

    private final EvaluationService evaluationService;
    private final HybridSearchService searchService;

    EvalController(EvaluationService evaluationService, HybridSearchService searchService) {
        this.evaluationService = evaluationService;
        this.searchService = searchService;
    }

    @Operation(
        summary = "Evaluate the search pipeline",
        description = "Runs every judged query through the pipeline and reports per-query reciprocal rank and recall " +
                "in input order, plus their means. Judgments without a query, with an empty relevant set, or whose " +
                "search fails are flagged and left out of the affected mean."
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Evaluation completed",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = EvalResult.class))
        ),
        @ApiResponse(responseCode = "400", description = "Invalid request body or fusion parameters")
    })
    @PostMapping
    public EvalResult evaluate(
            @RequestBody List<RelevanceJudgment> judgments,
            @Parameter(description = "Cut-off N for MRR@N and Recall@N")
            @RequestParam(value = "topN", required = false) @Nullable Integer topN,
            @Parameter(description = "Fusion strategy: weighted or rrf")
            @RequestParam(value = "blend", required = false) @Nullable String blend,
            @Parameter(description = "Candidates requested from each source")
            @RequestParam(value = "k", required = false) @Nullable Integer candidatePool,
            @Parameter(description = "RRF damping constant")
            @RequestParam(value = "rrfK", required = false) @Nullable Integer rrfK,
            @Parameter(description = "Rerank the fused top candidates")
            @RequestParam(value = "rerank", required = false) @Nullable Boolean rerank) {
        SearchOverrides overrides = new SearchOverrides(blend, topN, candidatePool, null, null, rrfK, rerank);
        return evaluationService.evaluate(judgments, overrides.applyTo(searchService.defaultOptions()));
    }
}
