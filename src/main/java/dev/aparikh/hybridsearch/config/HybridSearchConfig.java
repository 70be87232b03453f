package dev.aparikh.hybridsearch.config;

import dev.aparikh.hybridsearch.ConfigurationException;
import dev.aparikh.hybridsearch.embedding.DimensionCheckingEmbedder;
import dev.aparikh.hybridsearch.embedding.Embedder;
import dev.aparikh.hybridsearch.embedding.EmbeddingService;
import dev.aparikh.hybridsearch.embedding.HashingEmbedder;
import dev.aparikh.hybridsearch.evaluation.Evaluator;
import dev.aparikh.hybridsearch.fusion.FusionEngine;
import dev.aparikh.hybridsearch.rerank.ChatModelRelevanceScorer;
import dev.aparikh.hybridsearch.rerank.CrossEncoderClient;
import dev.aparikh.hybridsearch.rerank.DocumentTextSource;
import dev.aparikh.hybridsearch.rerank.RelevanceScorer;
import dev.aparikh.hybridsearch.rerank.Reranker;
import dev.aparikh.hybridsearch.search.SearchOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.util.concurrent.ExecutorService;

/**
 * Wires the search pipeline from {@link HybridSearchProperties}.
 *
 * <p>The default {@link SearchOptions} (and with them the default fusion configuration) are built
 * here, so an invalid strategy, weight or RRF constant stops the application before any query runs.</p>
 */
@Configuration
@EnableConfigurationProperties(HybridSearchProperties.class)
public class HybridSearchConfig {

    private static final Logger log = LoggerFactory.getLogger(HybridSearchConfig.class);

    @Bean
    public SearchOptions defaultSearchOptions(HybridSearchProperties properties) {
        SearchOptions options = new SearchOptions(
                properties.fusion().toFusionConfig(),
                properties.retrieval().topN(),
                properties.retrieval().candidatePool(),
                properties.rerank().enabled(),
                properties.rerank().candidatePool());
        log.info("Hybrid search defaults: strategy={}, weights={}, rrfK={}, topN={}, candidatePool={}, rerank={}",
                options.fusion().strategy(), options.fusion().weights(), options.fusion().rrfK(),
                options.topN(), options.candidatePool(), options.rerank());
        return options;
    }

    @Bean
    public FusionEngine fusionEngine() {
        return new FusionEngine();
    }

    @Bean
    public Embedder queryEmbedder(HybridSearchProperties properties, ObjectProvider<EmbeddingService> embeddingService) {
        int dimensions = properties.embedding().dimensions();
        Embedder delegate = switch (properties.embedding().provider()) {
            case HASHING -> new HashingEmbedder(dimensions);
            case OPENAI -> {
                EmbeddingService service = embeddingService.getIfAvailable();
                if (service == null) {
                    throw new ConfigurationException("Embedding provider 'openai' selected but no embedding model is available");
                }
                yield service::embed;
            }
        };
        return new DimensionCheckingEmbedder(delegate, dimensions);
    }

    @Bean
    public Reranker reranker(DocumentTextSource documentTextSource,
                             @Qualifier("rerankExecutor") ExecutorService rerankExecutor) {
        return new Reranker(documentTextSource, rerankExecutor);
    }

    @Bean
    public RelevanceScorer relevanceScorer(HybridSearchProperties properties,
                                           RestClient.Builder restClientBuilder,
                                           @Qualifier("rerankChatClient") ObjectProvider<ChatClient> rerankChatClient) {
        HybridSearchProperties.Rerank rerank = properties.rerank();
        return switch (rerank.scorer()) {
            case CROSS_ENCODER -> {
                JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(
                        HttpClient.newBuilder().connectTimeout(rerank.timeout()).build());
                requestFactory.setReadTimeout(rerank.timeout());
                RestClient restClient = restClientBuilder.clone()
                        .baseUrl(rerank.crossEncoderUrl())
                        .requestFactory(requestFactory)
                        .build();
                yield new CrossEncoderClient(restClient);
            }
            case CHAT -> {
                ChatClient chatClient = rerankChatClient.getIfAvailable();
                if (chatClient == null) {
                    throw new ConfigurationException("Rerank scorer 'chat' selected but no chat model is available");
                }
                yield new ChatModelRelevanceScorer(chatClient);
            }
        };
    }

    @Bean
    public Evaluator evaluator(@Qualifier("evaluationExecutor") ExecutorService evaluationExecutor) {
        return new Evaluator(evaluationExecutor);
    }
}
