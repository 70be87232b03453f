package dev.aparikh.hybridsearch.fusion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Blends sources using Reciprocal Rank Fusion (RRF).
 *
 * <p>RRF combines results by position rather than by raw score, which makes it the right choice when
 * score scales are not comparable even after normalization.</p>
 *
 * <p>The RRF formula is: <code>score = sum(1 / (k + rank))</code> where:
 * <ul>
 *   <li>k is a constant (default 60) that keeps the top ranks from dominating</li>
 *   <li>rank is the 1-based position of the document in each source ranking; positions are taken
 *       after the source's own score-then-id ordering, so source ties are already broken</li>
 *   <li>a source that did not return the document contributes nothing (an infinite rank)</li>
 * </ul>
 * </p>
 *
 * <p>Example: a document at rank 3 in lexical results and rank 5 in vector results scores
 * <code>1/(60+3) + 1/(60+5) = 0.0159 + 0.0154 = 0.0313</code>.</p>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public class ReciprocalRankFusion implements FusionStrategy {

    private static final Logger log = LoggerFactory.getLogger(ReciprocalRankFusion.class);

    @Override
    public FusionMethod method() {
        return FusionMethod.RRF;
    }

    @Override
    public List<ScoredDocument> fuse(Map<String, RankedList> lists, FusionConfig config) {
        int k = config.rrfK();
        FusedScoreAccumulator accumulator = new FusedScoreAccumulator();
        for (Map.Entry<String, RankedList> source : new TreeMap<>(lists).entrySet()) {
            accumulator.fold(source.getValue(), (rank, document) -> contribution(k, rank));
            log.trace("Folded {} ranked results from source {} (k={})", source.getValue().size(), source.getKey(), k);
        }
        return accumulator.toRanking();
    }

    /**
     * The contribution of a single source to a document at the given 1-based rank.
     */
    static double contribution(int k, int rank) {
        return 1.0 / (k + rank);
    }
}
