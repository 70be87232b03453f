package dev.aparikh.hybridsearch.rerank;

import dev.aparikh.hybridsearch.ScoringException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * {@link RelevanceScorer} that asks a chat model for a relevance judgment of one
 * {@code (query, document)} pair.
 *
 * <p>The model answers with a structured {@link RelevanceVerdict} holding a score between 0 and 1.
 * Scores outside that range are clamped; a missing verdict is a scoring failure.</p>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public class ChatModelRelevanceScorer implements RelevanceScorer {

    static final String SYSTEM_PROMPT = """
            You judge search relevance. Given a query and a document, rate how well the document
            answers the query on a scale from 0.0 (unrelated) to 1.0 (fully answers it).
            Respond with a JSON object with a single numeric field "score".
            """;

    private static final Logger log = LoggerFactory.getLogger(ChatModelRelevanceScorer.class);

    private final ChatClient chatClient;

    public ChatModelRelevanceScorer(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public double score(String query, String docText) {
        String userMessage = String.format("""
                Query: %s
                Document: %s
                """, query, docText);

        RelevanceVerdict verdict = chatClient.prompt()
                .system(SYSTEM_PROMPT)
                .user(userMessage)
                .call()
                .entity(RelevanceVerdict.class);

        if (verdict == null || verdict.score() == null) {
            throw new ScoringException("Chat model returned no relevance verdict");
        }
        double score = Math.max(0.0, Math.min(1.0, verdict.score()));
        log.trace("Chat relevance verdict {} for query: {}", score, query);
        return score;
    }

    /**
     * Structured answer expected from the chat model.
     *
     * @param score relevance between 0 and 1
     */
    public record RelevanceVerdict(Double score) {
    }
}
