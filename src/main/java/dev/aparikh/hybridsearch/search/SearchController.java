package dev.aparikh.hybridsearch.search;

import dev.aparikh.hybridsearch.search.model.SearchResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.jspecify.annotations.Nullable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for hybrid search.
 *
 * <p>Every parameter besides the query is optional and overrides the configured default for this
 * request only.</p>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 * @see HybridSearchService
 */
@RestController
@RequestMapping("/api/v1/search")
@Tag(name = "Search", description = "Hybrid lexical and vector search")
class SearchController {

    private final HybridSearchService searchService;

    SearchController(HybridSearchService searchService) {
        this.searchService = searchService;
    }

    /**
     * Runs both retrieval sources, fuses them and optionally reranks the result.
     *
     * @param query the free-text query
     * @return the top-N documents with per-source status
     */
    @Operation(
        summary = "Hybrid search",
        description = "Retrieves candidates from the lexical and the vector index concurrently, fuses them with " +
                "weighted_sum or reciprocal rank fusion and optionally reranks the top candidates. " +
                "A source that fails or times out is reported in 'sources' and the search continues without it."
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Search completed successfully",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = SearchResponse.class))
        ),
        @ApiResponse(responseCode = "400", description = "Blank or malformed query, or invalid fusion parameters"),
        @ApiResponse(responseCode = "422", description = "Corrupt scores or reranking failure"),
        @ApiResponse(responseCode = "500", description = "Internal server error")
    })
    @GetMapping
    public SearchResponse search(
            @Parameter(description = "Search query string", required = true)
            @RequestParam("query") String query,
            @Parameter(description = "Fusion strategy: weighted or rrf")
            @RequestParam(value = "blend", required = false) @Nullable String blend,
            @Parameter(description = "Number of results to return")
            @RequestParam(value = "topN", required = false) @Nullable Integer topN,
            @Parameter(description = "Candidates requested from each source")
            @RequestParam(value = "k", required = false) @Nullable Integer candidatePool,
            @Parameter(description = "Lexical weight under weighted fusion")
            @RequestParam(value = "wLexical", required = false) @Nullable Double lexicalWeight,
            @Parameter(description = "Vector weight under weighted fusion")
            @RequestParam(value = "wVector", required = false) @Nullable Double vectorWeight,
            @Parameter(description = "RRF damping constant")
            @RequestParam(value = "rrfK", required = false) @Nullable Integer rrfK,
            @Parameter(description = "Rerank the fused top candidates")
            @RequestParam(value = "rerank", required = false) @Nullable Boolean rerank) {
        SearchOverrides overrides = new SearchOverrides(blend, topN, candidatePool, lexicalWeight, vectorWeight, rrfK, rerank);
        return searchService.search(query, overrides.applyTo(searchService.defaultOptions()));
    }
}
