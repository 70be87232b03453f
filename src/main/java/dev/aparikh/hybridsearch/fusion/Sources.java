package dev.aparikh.hybridsearch.fusion;

/**
 * Names of the retrieval sources. Fusion itself works with any source names; these are the two
 * the search service wires up.
 */
public final class Sources {

    public static final String LEXICAL = "lexical";
    public static final String VECTOR = "vector";

    private Sources() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
