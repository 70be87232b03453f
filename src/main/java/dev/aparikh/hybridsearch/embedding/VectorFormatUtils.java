package dev.aparikh.hybridsearch.embedding;

/**
 * Formats vectors for Apache Solr's KNN query parser.
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public final class VectorFormatUtils {

    private VectorFormatUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Converts an array like {@code [0.1, 0.2, 0.3]} to the string {@code "[0.1, 0.2, 0.3]"}.
     *
     * @param embedding the embedding vector
     * @return a string representation suitable for Solr KNN queries
     * @throws IllegalArgumentException if the vector is empty or holds a non-finite component
     */
    public static String formatVectorForSolr(float[] embedding) {
        if (embedding.length == 0) {
            throw new IllegalArgumentException("Cannot format an empty vector");
        }
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < embedding.length; i++) {
            if (!Float.isFinite(embedding[i])) {
                throw new IllegalArgumentException("Vector component " + i + " is not finite: " + embedding[i]);
            }
            if (i > 0) sb.append(", ");
            sb.append(embedding[i]);
        }
        sb.append("]");
        return sb.toString();
    }
}
