package dev.aparikh.hybridsearch;

/**
 * Base type for failures raised by the hybrid search core.
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public class HybridSearchException extends RuntimeException {

    public HybridSearchException(String message) {
        super(message);
    }

    public HybridSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
