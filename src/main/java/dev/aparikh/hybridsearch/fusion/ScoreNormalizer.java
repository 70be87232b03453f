package dev.aparikh.hybridsearch.fusion;

import dev.aparikh.hybridsearch.ScoringException;

import java.util.ArrayList;
import java.util.List;

/**
 * Min-max normalization of one source's scores into [0, 1].
 *
 * <p>When a source cannot discriminate between its results (every score equal, which includes a
 * single-element list) every entry normalizes to {@code 1.0}, so a non-discriminating source keeps its
 * full weight instead of collapsing to zero. This is the counterpart of the fusion rule that scores a
 * document absent from a source as {@code 0}: presence in a source is never worth less than absence.</p>
 *
 * <p>Min-max is monotonic, so the output preserves the input order and the raw scores are carried over
 * unchanged in {@link ScoredDocument#rawScores()}.</p>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public final class ScoreNormalizer {

    static final double UNIFORM_SCORE = 1.0;

    private ScoreNormalizer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static RankedList normalize(RankedList list) {
        if (list.isEmpty()) {
            return list;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (ScoredDocument document : list) {
            min = Math.min(min, document.score());
            max = Math.max(max, document.score());
        }
        double range = max - min;
        if (!Double.isFinite(range)) {
            throw new ScoringException("Score range of source '" + list.source() + "' overflows: ["
                    + min + ", " + max + "]");
        }

        List<ScoredDocument> normalized = new ArrayList<>(list.size());
        for (ScoredDocument document : list) {
            double score = range == 0.0 ? UNIFORM_SCORE : (document.score() - min) / range;
            normalized.add(document.withScore(score));
        }
        return RankedList.of(list.source(), normalized);
    }
}
