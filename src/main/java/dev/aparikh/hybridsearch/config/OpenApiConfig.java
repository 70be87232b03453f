package dev.aparikh.hybridsearch.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI document for the REST surface, split into one group for online search and one for offline
 * evaluation so the Swagger UI lists them separately.
 */
@Configuration
public class OpenApiConfig {

    static final String SEARCH_PATHS = "/api/v1/search/**";
    static final String EVALUATION_PATHS = "/api/v1/eval/**";

    @Bean
    public OpenAPI hybridSearchOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Hybrid Search API")
                        .description("Lexical and vector retrieval fused into one ranking by weighted sum or "
                                + "reciprocal rank fusion, optionally reranked, plus MRR@N and Recall@N "
                                + "evaluation against relevance judgments")
                        .version("v1")
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }

    @Bean
    public GroupedOpenApi searchApi() {
        return GroupedOpenApi.builder()
                .group("search")
                .displayName("Hybrid search")
                .pathsToMatch(SEARCH_PATHS)
                .build();
    }

    @Bean
    public GroupedOpenApi evaluationApi() {
        return GroupedOpenApi.builder()
                .group("evaluation")
                .displayName("Relevance evaluation")
                .pathsToMatch(EVALUATION_PATHS)
                .build();
    }
}
