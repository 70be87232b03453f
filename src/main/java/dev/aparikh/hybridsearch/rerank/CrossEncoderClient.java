package dev.aparikh.hybridsearch.rerank;

import dev.aparikh.hybridsearch.ScoringException;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

/**
 * {@link RelevanceScorer} backed by an HTTP cross-encoder scoring service.
 *
 * <p>Posts {@code {"query": ..., "text": ...}} to {@code <base-url>/score} and expects
 * {@code {"score": <float>}} back.</p>
 */
public class CrossEncoderClient implements RelevanceScorer {

    static final String SCORE_PATH = "/score";

    private final RestClient restClient;

    public CrossEncoderClient(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public double score(String query, String docText) {
        ScoreResponse response = restClient.post()
                .uri(SCORE_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ScoreRequest(query, docText))
                .retrieve()
                .body(ScoreResponse.class);
        if (response == null || response.score() == null) {
            throw new ScoringException("Cross-encoder returned no score");
        }
        return response.score();
    }

    record ScoreRequest(String query, String text) {
    }

    record ScoreResponse(Double score) {
    }
}
