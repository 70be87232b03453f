package dev.aparikh.hybridsearch.fusion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Blends sources by a weighted sum of their min-max normalized scores.
 *
 * <p>The formula is <code>score(doc) = sum(weight[source] * normalized[source][doc])</code>, where
 * a document absent from a source contributes {@code 0} for that source. Absence means "no evidence"
 * and is never imputed from another source. Combined with the {@link ScoreNormalizer} convention that
 * a non-discriminating source normalizes to {@code 1.0}, a document a source did return always scores
 * at least as high for that source as one it did not.</p>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public class WeightedSumFusion implements FusionStrategy {

    private static final Logger log = LoggerFactory.getLogger(WeightedSumFusion.class);

    @Override
    public FusionMethod method() {
        return FusionMethod.WEIGHTED_SUM;
    }

    @Override
    public List<ScoredDocument> fuse(Map<String, RankedList> lists, FusionConfig config) {
        FusedScoreAccumulator accumulator = new FusedScoreAccumulator();
        for (Map.Entry<String, RankedList> source : new TreeMap<>(lists).entrySet()) {
            double weight = config.weightOf(source.getKey());
            RankedList normalized = ScoreNormalizer.normalize(source.getValue());
            accumulator.fold(normalized, (rank, document) -> weight * document.score());
            log.trace("Folded {} normalized results from source {} with weight {}",
                    normalized.size(), source.getKey(), weight);
        }
        return accumulator.toRanking();
    }
}
