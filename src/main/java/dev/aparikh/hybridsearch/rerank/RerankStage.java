package dev.aparikh.hybridsearch.rerank;

import dev.aparikh.hybridsearch.fusion.ScoredDocument;

import java.util.List;

/**
 * The last stage of the search pipeline: either passes the fused ranking through untouched or
 * reranks its top candidates.
 */
@FunctionalInterface
public interface RerankStage {

    List<ScoredDocument> apply(String query, List<ScoredDocument> fused);

    static RerankStage identity() {
        return (query, fused) -> fused;
    }

    /**
     * Reranks the first {@code candidatePool} fused results. Results beyond the pool are dropped, so
     * the pool must be at least the number of results the caller returns.
     */
    static RerankStage reranking(Reranker reranker, RelevanceScorer scorer, int candidatePool) {
        if (candidatePool <= 0) {
            throw new IllegalArgumentException("candidatePool must be positive, got: " + candidatePool);
        }
        return (query, fused) -> reranker.rerank(query,
                fused.subList(0, Math.min(candidatePool, fused.size())), scorer);
    }
}
