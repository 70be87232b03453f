package dev.aparikh.hybridsearch.search;

import dev.aparikh.hybridsearch.ConfigurationException;
import dev.aparikh.hybridsearch.fusion.FusionConfig;
import dev.aparikh.hybridsearch.fusion.Sources;

/**
 * Per-request pipeline settings. Derived from the startup defaults with {@code with*} copies; never
 * mutated. A weighted_sum fusion must carry a weight for both the lexical and the vector source, so a
 * missing weight fails at startup or when a request override is applied, never at query time.
 *
 * @param fusion              fusion strategy, weights and RRF constant
 * @param topN                number of results returned
 * @param candidatePool       number of results requested from each retrieval source
 * @param rerank              whether the rerank stage runs
 * @param rerankCandidatePool number of fused results handed to the reranker
 */
public record SearchOptions(FusionConfig fusion, int topN, int candidatePool, boolean rerank, int rerankCandidatePool) {

    public SearchOptions {
        if (fusion == null) {
            throw new ConfigurationException("Fusion configuration must be set");
        }
        fusion.requireWeightsFor(Sources.LEXICAL, Sources.VECTOR);
        if (topN <= 0) {
            throw new ConfigurationException("top-n must be positive, got: " + topN);
        }
        if (candidatePool <= 0) {
            throw new ConfigurationException("Candidate pool must be positive, got: " + candidatePool);
        }
        if (rerank && rerankCandidatePool < topN) {
            throw new ConfigurationException("Rerank candidate pool (" + rerankCandidatePool
                    + ") must be at least top-n (" + topN + ")");
        }
    }

    public SearchOptions withFusion(FusionConfig newFusion) {
        return new SearchOptions(newFusion, topN, candidatePool, rerank, rerankCandidatePool);
    }

    public SearchOptions withTopN(int newTopN) {
        return new SearchOptions(fusion, newTopN, candidatePool, rerank, rerankCandidatePool);
    }

    public SearchOptions withCandidatePool(int newCandidatePool) {
        return new SearchOptions(fusion, topN, newCandidatePool, rerank, rerankCandidatePool);
    }

    public SearchOptions withRerank(boolean newRerank) {
        return new SearchOptions(fusion, topN, candidatePool, newRerank, rerankCandidatePool);
    }
}
