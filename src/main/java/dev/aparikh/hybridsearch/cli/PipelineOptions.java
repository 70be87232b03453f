package dev.aparikh.hybridsearch.cli;

import dev.aparikh.hybridsearch.search.SearchOverrides;
import org.jspecify.annotations.Nullable;
import picocli.CommandLine.Option;

/**
 * Pipeline options shared by {@code search} and {@code eval}. Unset options keep the configured
 * {@code hybrid.*} defaults.
 */
public class PipelineOptions {

    @Option(names = "--blend", description = "Fusion strategy: weighted or rrf")
    @Nullable String blend;

    @Option(names = "--top-n", description = "Number of results returned (and N of the metrics)")
    @Nullable Integer topN;

    @Option(names = "--k", description = "Candidates requested from each source")
    @Nullable Integer candidatePool;

    @Option(names = {"--w-lexical", "--w-bm25"}, description = "Lexical weight under weighted fusion")
    @Nullable Double lexicalWeight;

    @Option(names = {"--w-vector", "--w-vec"}, description = "Vector weight under weighted fusion")
    @Nullable Double vectorWeight;

    @Option(names = "--rrf-k", description = "RRF damping constant")
    @Nullable Integer rrfK;

    @Option(names = "--rerank", description = "Rerank the fused top candidates")
    @Nullable Boolean rerank;

    SearchOverrides toOverrides() {
        return new SearchOverrides(blend, topN, candidatePool, lexicalWeight, vectorWeight, rrfK, rerank);
    }
}
