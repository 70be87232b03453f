package dev.aparikh.hybridsearch.fusion;

import java.util.Comparator;

/**
 * The single ordering used by every ranking in the system: score descending, then document id
 * ascending. Since document ids are unique within a ranking this is a total order.
 */
public final class RankingOrder {

    public static final Comparator<ScoredDocument> SCORE_DESCENDING_THEN_ID =
            Comparator.comparingDouble(ScoredDocument::score).reversed()
                    .thenComparing(ScoredDocument::docId);

    private RankingOrder() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
