package dev.aparikh.hybridsearch.config;

import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.advisor.SimpleLoggerAdvisor;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.document.MetadataMode;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.openai.OpenAiEmbeddingModel;
import org.springframework.ai.openai.OpenAiEmbeddingOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.springframework.web.client.RestClient.Builder;

/**
 * Spring AI model beans. Both are optional and only created when selected by configuration.
 *
 * <h3>Bean Definitions:</h3>
 * <ul>
 *   <li>OpenAI EmbeddingModel - query embeddings when {@code hybrid.embedding.provider=openai}</li>
 *   <li>Anthropic ChatModel and the {@code rerankChatClient} - LLM relevance judgments when
 *       {@code hybrid.rerank.scorer=chat}</li>
 * </ul>
 *
 * <p>The models are built by hand rather than auto-configured so that both providers can sit on the
 * classpath without one of them demanding an API key it will never use.</p>
 */
@Configuration
public class AiConfig {

    static final String EMBEDDING_MODEL = "text-embedding-3-small";
    static final String RERANK_CHAT_MODEL = "claude-sonnet-4-5";

    /**
     * Creates an OpenAI EmbeddingModel that returns vectors of the configured dimensionality.
     *
     * @param apiKey            the OpenAI API key
     * @param restClientBuilder the auto-configured builder, on the JDK HttpClient
     * @param properties        supplies the embedding dimensions
     * @return configured OpenAiEmbeddingModel instance
     */
    @Bean
    @ConditionalOnMissingBean(EmbeddingModel.class)
    @ConditionalOnProperty(name = "hybrid.embedding.provider", havingValue = "openai")
    public EmbeddingModel embeddingModel(@Value("${spring.ai.openai.api-key:${OPENAI_API_KEY:}}") String apiKey,
                                         Builder restClientBuilder,
                                         HybridSearchProperties properties) {
        OpenAiApi openAiApi = OpenAiApi.builder()
                .apiKey(apiKey)
                .restClientBuilder(restClientBuilder)
                .build();
        OpenAiEmbeddingOptions options = OpenAiEmbeddingOptions.builder()
                .model(EMBEDDING_MODEL)
                .dimensions(properties.embedding().dimensions())
                .build();
        return new OpenAiEmbeddingModel(openAiApi, MetadataMode.EMBED, options);
    }

    /**
     * Creates the Anthropic ChatModel used for relevance judgments. Temperature is pinned to zero so
     * the same pair is judged the same way across evaluation runs.
     */
    @Bean
    @ConditionalOnMissingBean(ChatModel.class)
    @ConditionalOnProperty(name = "hybrid.rerank.scorer", havingValue = "chat")
    public ChatModel anthropicChatModel(@Value("${spring.ai.anthropic.api-key:${ANTHROPIC_API_KEY:}}") String apiKey,
                                        Builder restClientBuilder) {
        AnthropicApi anthropicApi = AnthropicApi.builder()
                .apiKey(apiKey)
                .restClientBuilder(restClientBuilder)
                .build();
        return AnthropicChatModel.builder()
                .anthropicApi(anthropicApi)
                .defaultOptions(AnthropicChatOptions.builder()
                        .model(RERANK_CHAT_MODEL)
                        .temperature(0.0)
                        .maxTokens(64)
                        .build())
                .build();
    }

    @Bean
    @Qualifier("rerankChatClient")
    @ConditionalOnProperty(name = "hybrid.rerank.scorer", havingValue = "chat")
    public ChatClient rerankChatClient(ChatModel chatModel) {
        return ChatClient.builder(chatModel)
                .defaultAdvisors(SimpleLoggerAdvisor.builder().build())
                .build();
    }
}
