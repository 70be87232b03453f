package dev.aparikh.hybridsearch;

/**
 * Raised when a score cannot be trusted: a NaN or infinite raw score, a duplicated document in a
 * ranked list, or a reranker scoring failure. Fails the current request as a whole.
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public class ScoringException extends HybridSearchException {

    public ScoringException(String message) {
        super(message);
    }

    public ScoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
