package dev.aparikh.hybridsearch.fusion;

import dev.aparikh.hybridsearch.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Merges per-source rankings into one blended ranking using the strategy named by a
 * {@link FusionConfig}.
 *
 * <p>The output contains the union of the document ids of all inputs, strictly ordered by fused score
 * descending and then by document id ascending. Fusing the same inputs with the same configuration
 * always yields the same ordering.</p>
 *
 * <p>Worked example for {@link FusionMethod#WEIGHTED_SUM} with weights 0.5/0.5: lexical returns
 * A (rank 1), B (rank 2) and C (rank 3) with evenly spaced scores, vector returns only B. A normalizes
 * lexically to 1.0 and B to 0.5; B's single vector hit normalizes to 1.0. So B scores
 * {@code 0.5*0.5 + 0.5*1.0 = 0.75} and outranks A at {@code 0.5*1.0 + 0 = 0.5}.</p>
 *
 * <p>Instances are stateless and safe to share across concurrent requests.</p>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public class FusionEngine {

    private static final Logger log = LoggerFactory.getLogger(FusionEngine.class);

    private final Map<FusionMethod, FusionStrategy> strategies = new EnumMap<>(FusionMethod.class);

    public FusionEngine() {
        this(List.of(new WeightedSumFusion(), new ReciprocalRankFusion()));
    }

    public FusionEngine(List<FusionStrategy> strategies) {
        for (FusionStrategy strategy : strategies) {
            this.strategies.put(strategy.method(), strategy);
        }
    }

    /**
     * Fuses the given source rankings.
     *
     * @param lists  ranking per source name; pass {@link RankedList#empty(String)} for a source that
     *               returned nothing or could not be queried
     * @param config the fusion settings
     * @return the fused ranking
     * @throws IllegalArgumentException if a source maps to {@code null}
     * @throws ConfigurationException if the strategy is not registered or a
     *         weighted source has no weight
     */
    public List<ScoredDocument> fuse(Map<String, RankedList> lists, FusionConfig config) {
        lists.forEach((source, list) -> {
            if (list == null) {
                throw new IllegalArgumentException("Source '" + source + "' has no ranking; pass an empty list instead");
            }
        });
        FusionStrategy strategy = strategies.get(config.strategy());
        if (strategy == null) {
            throw new ConfigurationException(
                    "No fusion strategy registered for " + config.strategy());
        }

        List<ScoredDocument> fused = strategy.fuse(lists, config);
        if (log.isDebugEnabled()) {
            log.debug("Fused {} sources using {}: {} unique documents", lists.size(), config.strategy(), fused.size());
        }
        return fused;
    }
}
