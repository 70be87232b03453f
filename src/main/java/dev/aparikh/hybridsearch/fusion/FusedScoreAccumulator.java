package dev.aparikh.hybridsearch.fusion;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds a fused ranking by folding one source ranking at a time into a map of document id to
 * running score.
 *
 * <p>A document starts at {@code 0} the first time any source reports it and only receives
 * contributions from sources that contain it, which is the whole of the "missing source scores 0"
 * rule. Callers fold sources in a fixed order so floating point sums are reproducible.</p>
 */
final class FusedScoreAccumulator {

    /**
     * Contribution of a document at the given 1-based rank of a source ranking.
     */
    @FunctionalInterface
    interface Contribution {
        double of(int rank, ScoredDocument document);
    }

    private final Map<String, Entry> entries = new TreeMap<>();

    FusedScoreAccumulator fold(RankedList list, Contribution contribution) {
        int rank = 0;
        for (ScoredDocument document : list) {
            rank++;
            Entry entry = entries.computeIfAbsent(document.docId(), Entry::new);
            entry.score += contribution.of(rank, document);
            entry.rawScores.putAll(document.rawScores());
        }
        return this;
    }

    int size() {
        return entries.size();
    }

    List<ScoredDocument> toRanking() {
        List<ScoredDocument> ranking = new ArrayList<>(entries.size());
        for (Entry entry : entries.values()) {
            ranking.add(new ScoredDocument(entry.docId, entry.score, entry.rawScores));
        }
        ranking.sort(RankingOrder.SCORE_DESCENDING_THEN_ID);
        return ranking;
    }

    private static final class Entry {
        final String docId;
        final Map<String, Double> rawScores = new HashMap<>();
        double score;

        Entry(String docId) {
            this.docId = docId;
        }
    }
}
