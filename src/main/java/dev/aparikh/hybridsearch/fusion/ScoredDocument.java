package dev.aparikh.hybridsearch.fusion;

import dev.aparikh.hybridsearch.ScoringException;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A single document in a ranking, identified by an opaque document id.
 *
 * <p>{@code score} is the value the enclosing ranking is ordered by: the raw source score inside a
 * source {@link RankedList}, the normalized score after {@link ScoreNormalizer}, the fused score after
 * {@link FusionEngine} and the relevance score after reranking. {@code rawScores} keeps the raw score
 * each retrieval source reported for the document, keyed by source name.</p>
 *
 * @param docId     stable join key across sources, never interpreted as a number
 * @param score     the ranking score, always finite
 * @param rawScores raw score per source name, always finite
 */
public record ScoredDocument(String docId, double score, Map<String, Double> rawScores) {

    public ScoredDocument {
        Objects.requireNonNull(docId, "docId must not be null");
        requireFinite(docId, "score", score);
        TreeMap<String, Double> copy = new TreeMap<>();
        if (rawScores != null) {
            rawScores.forEach((source, raw) -> {
                requireFinite(docId, "raw score from " + source, raw == null ? Double.NaN : raw);
                copy.put(source, raw);
            });
        }
        rawScores = Collections.unmodifiableMap(copy);
    }

    /**
     * Creates the entry a retrieval source emits: the ranking score is the raw score itself.
     */
    public static ScoredDocument fromSource(String source, String docId, double rawScore) {
        return new ScoredDocument(docId, rawScore, Map.of(source, rawScore));
    }

    public ScoredDocument withScore(double newScore) {
        return new ScoredDocument(docId, newScore, rawScores);
    }

    public Optional<Double> rawScore(String source) {
        return Optional.ofNullable(rawScores.get(source));
    }

    private static void requireFinite(String docId, String what, double value) {
        if (!Double.isFinite(value)) {
            throw new ScoringException("Non-finite " + what + " (" + value + ") for document '" + docId + "'");
        }
    }
}
