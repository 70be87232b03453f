package dev.aparikh.hybridsearch;

/**
 * Raised for a blank query or when the lexical backend rejects the query syntax.
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public class InvalidQueryException extends HybridSearchException {

    public InvalidQueryException(String message) {
        super(message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
