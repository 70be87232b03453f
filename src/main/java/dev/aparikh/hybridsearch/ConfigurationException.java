package dev.aparikh.hybridsearch;

/**
 * Raised for an invalid fusion, rerank or embedding configuration.
 *
 * <p>Configuration errors are fatal: the default configuration is validated at startup, and a
 * per-request override that fails validation is rejected before any retrieval call is made.</p>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public class ConfigurationException extends HybridSearchException {

    public ConfigurationException(String message) {
        super(message);
    }
}
