package dev.aparikh.hybridsearch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools of the search pipeline. Retrieval and reranking get separate pools so that a slow
 * reranker cannot starve retrieval of the next query.
 */
@Configuration
public class SearchExecutionConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService retrievalExecutor(HybridSearchProperties properties) {
        return Executors.newFixedThreadPool(Math.max(2, properties.retrieval().poolSize()));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService rerankExecutor(HybridSearchProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.rerank().poolSize()));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService evaluationExecutor(HybridSearchProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.evaluation().parallelism()));
    }
}
