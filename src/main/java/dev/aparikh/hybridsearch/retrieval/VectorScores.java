package dev.aparikh.hybridsearch.retrieval;

/**
 * Conversions between vector distances and similarity scores.
 */
public final class VectorScores {

    private VectorScores() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * The similarity reported for a document at the given distance: {@code 1 / (1 + distance)}.
     *
     * @throws IllegalArgumentException if the distance is negative or not finite
     */
    public static double similarityFromDistance(double distance) {
        if (!Double.isFinite(distance) || distance < 0) {
            throw new IllegalArgumentException("Distance must be finite and non-negative, got: " + distance);
        }
        return 1.0 / (1.0 + distance);
    }

    /**
     * Recovers the euclidean distance from a Solr KNN score on a field using euclidean similarity,
     * which Solr reports as {@code 1 / (1 + d^2)}.
     *
     * @throws IllegalArgumentException if the score is not in (0, 1]
     */
    public static double distanceFromSolrEuclideanScore(double solrScore) {
        if (!(solrScore > 0.0) || solrScore > 1.0 + 1e-6) {
            throw new IllegalArgumentException("Euclidean similarity score must be in (0, 1], got: " + solrScore);
        }
        return Math.sqrt(Math.max(0.0, 1.0 / solrScore - 1.0));
    }
}
