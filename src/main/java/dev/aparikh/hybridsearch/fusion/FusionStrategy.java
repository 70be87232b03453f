package dev.aparikh.hybridsearch.fusion;

import java.util.List;
import java.util.Map;

/**
 * One way of blending per-source rankings into a single ranking.
 */
public interface FusionStrategy {

    FusionMethod method();

    /**
     * Fuses the given source rankings.
     *
     * @param lists  ranking per source name; a source with no results is an empty list, never absent
     * @param config fusion settings for this call
     * @return the union of all documents, ordered by {@link RankingOrder#SCORE_DESCENDING_THEN_ID}
     */
    List<ScoredDocument> fuse(Map<String, RankedList> lists, FusionConfig config);
}
