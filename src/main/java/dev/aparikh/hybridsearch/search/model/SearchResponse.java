package dev.aparikh.hybridsearch.search.model;

import dev.aparikh.hybridsearch.fusion.FusionMethod;
import dev.aparikh.hybridsearch.fusion.ScoredDocument;

import java.util.List;

/**
 * Result of a hybrid search.
 *
 * @param query        the query as received
 * @param strategy     the fusion strategy that produced the ranking
 * @param documents    the final top-N
 * @param sources      per-source status, including degraded sources
 * @param reranked     whether the returned order comes from the reranker
 * @param rerankFailed whether reranking was requested but failed and the fused order was returned
 */
public record SearchResponse(
        String query,
        FusionMethod strategy,
        List<ScoredDocument> documents,
        List<SourceStatus> sources,
        boolean reranked,
        boolean rerankFailed
) {
}
