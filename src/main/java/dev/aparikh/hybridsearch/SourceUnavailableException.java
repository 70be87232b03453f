package dev.aparikh.hybridsearch;

/**
 * Raised by a retrieval source adapter when its backend cannot be reached or answers with an error.
 *
 * <p>The search service recovers by treating the source as empty for that request.</p>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public class SourceUnavailableException extends HybridSearchException {

    private final String source;

    public SourceUnavailableException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
