package dev.aparikh.hybridsearch.retrieval;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Utility class for building Apache Solr query parameters.
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public final class SolrQueryUtils {

    private SolrQueryUtils() {
        // Private constructor to prevent instantiation
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Builds a KNN (K-Nearest Neighbors) query string for Solr vector search.
     *
     * <p>Constructs a query in the format: {@code {!knn f=vector topK=10}[0.1, 0.2, 0.3, ...]}</p>
     *
     * @param vectorFieldName the name of the vector field in the Solr schema
     * @param topK            the number of nearest neighbors to return
     * @param vectorString    the vector as a formatted string (e.g., "[0.1, 0.2, 0.3]")
     * @return a KNN query string ready for use in Solr
     * @throws IllegalArgumentException if vectorFieldName is null or empty, topK <= 0, or vectorString is null
     */
    public static String buildKnnQuery(String vectorFieldName, int topK, String vectorString) {
        if (vectorFieldName == null || vectorFieldName.trim().isEmpty()) {
            throw new IllegalArgumentException("Vector field name cannot be null or empty");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be greater than 0");
        }
        if (vectorString == null) {
            throw new IllegalArgumentException("Vector string cannot be null");
        }

        return String.format(Locale.ROOT, "{!knn f=%s topK=%d}%s", vectorFieldName, topK, vectorString);
    }

    /**
     * Builds an edismax {@code qf} value from field boosts, e.g. {@code body^1.0 title^2.0}.
     *
     * <p>Fields are emitted in name order so the same weights always produce the same parameter.</p>
     *
     * @throws IllegalArgumentException if no fields are given or a boost is negative or not finite
     */
    public static String buildQueryFields(Map<String, Double> fieldWeights) {
        if (fieldWeights == null || fieldWeights.isEmpty()) {
            throw new IllegalArgumentException("At least one query field is required");
        }
        return new TreeMap<>(fieldWeights).entrySet().stream()
                .map(e -> {
                    Double boost = e.getValue();
                    if (boost == null || !Double.isFinite(boost) || boost < 0) {
                        throw new IllegalArgumentException("Invalid boost for field '" + e.getKey() + "': " + boost);
                    }
                    return e.getKey() + "^" + boost;
                })
                .collect(Collectors.joining(" "));
    }
}
