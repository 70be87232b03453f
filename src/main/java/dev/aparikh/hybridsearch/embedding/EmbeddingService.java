package dev.aparikh.hybridsearch.embedding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

/**
 * Generates query embeddings with a Spring AI {@link EmbeddingModel} (OpenAI) and automatic retry.
 *
 * <p>Embedding calls are retried with exponential backoff to ride out transient network failures
 * and API rate limits:
 * <ul>
 *   <li>Max attempts: 3</li>
 *   <li>Initial delay: 1 second</li>
 *   <li>Backoff multiplier: 2x (1s, 2s, 4s)</li>
 *   <li>Max delay: 10 seconds</li>
 * </ul>
 * </p>
 *
 * <p>Only active when {@code hybrid.embedding.provider=openai}.</p>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
@Service
@ConditionalOnProperty(name = "hybrid.embedding.provider", havingValue = "openai")
public class EmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    private final EmbeddingModel embeddingModel;

    /**
     * @param embeddingModel the OpenAI embedding model to use for generating embeddings
     */
    public EmbeddingService(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    /**
     * Generates an embedding vector for the given text.
     *
     * @param text the text to embed
     * @return the embedding as a primitive float array
     * @throws RuntimeException if all retry attempts fail
     */
    @Retryable(
            retryFor = {ResourceAccessException.class, RestClientException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000, multiplier = 2.0, maxDelay = 10000)
    )
    public float[] embed(String text) {
        log.debug("Generating embedding for text (length: {})", text.length());
        try {
            float[] embedding = embeddingModel.embed(text);
            log.debug("Successfully generated embedding with {} dimensions", embedding.length);
            return embedding;
        } catch (RuntimeException e) {
            log.warn("Embedding generation failed, will retry if attempts remain: {}", e.getMessage());
            throw e;
        }
    }
}
