package dev.aparikh.hybridsearch.cli;

import dev.aparikh.hybridsearch.ConfigurationException;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Process exit codes of the command-line front end.
 */
public final class ExitCodes {

    public static final int OK = 0;
    public static final int FAILURE = 1;
    /** Invalid fusion, rerank or embedding configuration. Also picocli's code for bad arguments. */
    public static final int CONFIGURATION = 2;
    public static final int IO = 3;

    private ExitCodes() {
    }

    /**
     * Classifies a failure by the first recognized exception in its cause chain.
     */
    public static int of(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof ConfigurationException) {
                return CONFIGURATION;
            }
            if (t instanceof IOException || t instanceof UncheckedIOException) {
                return IO;
            }
        }
        return FAILURE;
    }
}
