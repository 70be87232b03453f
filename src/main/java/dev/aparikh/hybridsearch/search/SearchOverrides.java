package dev.aparikh.hybridsearch.search;

import dev.aparikh.hybridsearch.fusion.FusionConfig;
import dev.aparikh.hybridsearch.fusion.FusionMethod;
import dev.aparikh.hybridsearch.fusion.Sources;
import org.jspecify.annotations.Nullable;

/**
 * Optional per-request overrides of the default {@link SearchOptions}, as supplied by the REST
 * endpoints and the CLI. Every {@code null} field keeps the default.
 *
 * @param blend         fusion strategy name, see {@link FusionMethod#fromString(String)}
 * @param topN          number of results returned
 * @param candidatePool per-source candidate pool
 * @param lexicalWeight weight of the lexical source under weighted_sum
 * @param vectorWeight  weight of the vector source under weighted_sum
 * @param rrfK          RRF damping constant
 * @param rerank        whether to run the rerank stage
 */
public record SearchOverrides(
        @Nullable String blend,
        @Nullable Integer topN,
        @Nullable Integer candidatePool,
        @Nullable Double lexicalWeight,
        @Nullable Double vectorWeight,
        @Nullable Integer rrfK,
        @Nullable Boolean rerank
) {

    public static SearchOverrides none() {
        return new SearchOverrides(null, null, null, null, null, null, null);
    }

    /**
     * Derives the effective options. The defaults are left untouched.
     *
     * @throws dev.aparikh.hybridsearch.ConfigurationException if an override is invalid
     */
    public SearchOptions applyTo(SearchOptions defaults) {
        FusionConfig fusion = defaults.fusion();
        if (blend != null) {
            fusion = fusion.withStrategy(FusionMethod.fromString(blend));
        }
        if (lexicalWeight != null) {
            fusion = fusion.withWeight(Sources.LEXICAL, lexicalWeight);
        }
        if (vectorWeight != null) {
            fusion = fusion.withWeight(Sources.VECTOR, vectorWeight);
        }
        if (rrfK != null) {
            fusion = fusion.withRrfK(rrfK);
        }
        SearchOptions options = defaults.withFusion(fusion);
        if (topN != null) {
            options = options.withTopN(topN);
        }
        if (candidatePool != null) {
            options = options.withCandidatePool(candidatePool);
        }
        if (rerank != null) {
            options = options.withRerank(rerank);
        }
        return options;
    }
}
