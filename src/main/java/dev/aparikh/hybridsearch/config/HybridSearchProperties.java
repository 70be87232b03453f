package dev.aparikh.hybridsearch.config;

import dev.aparikh.hybridsearch.embedding.EmbeddingProvider;
import dev.aparikh.hybridsearch.fusion.FusionConfig;
import dev.aparikh.hybridsearch.fusion.FusionMethod;
import dev.aparikh.hybridsearch.fusion.Sources;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Externalized settings for the hybrid search pipeline, bound from the {@code hybrid.*} namespace.
 *
 * <pre>{@code
 * # application.properties
 * hybrid.fusion.strategy=rrf
 * hybrid.fusion.weights.lexical=0.7
 * hybrid.fusion.weights.vector=0.3
 * hybrid.retrieval.field-weights.title=2.0
 * hybrid.rerank.enabled=true
 * }</pre>
 *
 * @param fusion     default fusion strategy, weights and RRF constant
 * @param retrieval  candidate pool, result size, per-source timeouts and lexical field boosts
 * @param rerank     optional reranking stage
 * @param embedding  query embedding provider
 * @param solr       collection and field names of the backing Solr index
 * @param evaluation evaluation harness settings
 */
@ConfigurationProperties(prefix = "hybrid")
public record HybridSearchProperties(
        @DefaultValue Fusion fusion,
        @DefaultValue Retrieval retrieval,
        @DefaultValue Rerank rerank,
        @DefaultValue Embedding embedding,
        @DefaultValue Solr solr,
        @DefaultValue Evaluation evaluation
) {

    public record Fusion(
            @DefaultValue("weighted") String strategy,
            @Nullable Map<String, Double> weights,
            @DefaultValue("60") int rrfK
    ) {

        public Fusion {
            if (weights == null || weights.isEmpty()) {
                weights = Map.of(Sources.LEXICAL, 0.6, Sources.VECTOR, 0.4);
            }
        }

        /**
         * Builds and validates the default fusion configuration.
         *
         * @throws dev.aparikh.hybridsearch.ConfigurationException if any setting is invalid
         */
        public FusionConfig toFusionConfig() {
            return new FusionConfig(FusionMethod.fromString(strategy), weights, rrfK);
        }
    }

    public record Retrieval(
            @DefaultValue("50") int candidatePool,
            @DefaultValue("10") int topN,
            @DefaultValue("2s") Duration lexicalTimeout,
            @DefaultValue("2s") Duration vectorTimeout,
            @Nullable Map<String, Double> fieldWeights,
            @DefaultValue("6") int poolSize
    ) {

        public Retrieval {
            if (fieldWeights == null || fieldWeights.isEmpty()) {
                fieldWeights = Map.of("title", 2.0, "body", 1.0);
            }
        }
    }

    public record Rerank(
            @DefaultValue("false") boolean enabled,
            @DefaultValue("20") int candidatePool,
            @DefaultValue("cross-encoder") ScorerType scorer,
            @DefaultValue("http://localhost:8000") String crossEncoderUrl,
            @DefaultValue("10s") Duration timeout,
            @DefaultValue("false") boolean fallbackToFused,
            @DefaultValue("4") int poolSize
    ) {
    }

    public record Embedding(
            @DefaultValue("hashing") EmbeddingProvider provider,
            @DefaultValue("384") int dimensions
    ) {
    }

    public record Solr(
            @DefaultValue("tickets") String collection,
            @DefaultValue("id") String idField,
            @DefaultValue("vector") String vectorField,
            @DefaultValue({"title", "body"}) List<String> textFields
    ) {
    }

    public record Evaluation(
            @DefaultValue("1") int parallelism
    ) {
    }

    /**
     * The relevance scorer behind the rerank stage.
     */
    public enum ScorerType {
        /** HTTP cross-encoder scoring service. */
        CROSS_ENCODER,
        /** Anthropic chat model asked for a relevance judgment. */
        CHAT
    }
}
