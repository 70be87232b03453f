package dev.aparikh.hybridsearch.fusion;

import dev.aparikh.hybridsearch.ConfigurationException;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable fusion settings, threaded explicitly through every fusion call.
 *
 * <p>Weights are relative: they need not sum to 1. They are only consulted by
 * {@link FusionMethod#WEIGHTED_SUM}; reciprocal rank fusion weighs every source equally.</p>
 *
 * @param strategy the fusion strategy
 * @param weights  relative weight per source name, each finite and non-negative
 * @param rrfK     the reciprocal rank fusion constant, strictly positive
 */
public record FusionConfig(FusionMethod strategy, Map<String, Double> weights, int rrfK) {

    public static final int DEFAULT_RRF_K = 60;

    public FusionConfig {
        if (strategy == null) {
            throw new ConfigurationException("Fusion strategy must be set");
        }
        if (rrfK <= 0) {
            throw new ConfigurationException("rrf_k must be positive, got: " + rrfK);
        }
        Objects.requireNonNull(weights, "weights must not be null");
        TreeMap<String, Double> copy = new TreeMap<>();
        weights.forEach((source, weight) -> {
            if (weight == null || !Double.isFinite(weight) || weight < 0) {
                throw new ConfigurationException(
                        "Weight for source '" + source + "' must be a finite non-negative number, got: " + weight);
            }
            copy.put(source, weight);
        });
        weights = Collections.unmodifiableMap(copy);
    }

    /**
     * Weighted sum over lexical 0.6 / vector 0.4 with the default RRF constant.
     */
    public static FusionConfig defaults() {
        return new FusionConfig(FusionMethod.WEIGHTED_SUM,
                Map.of(Sources.LEXICAL, 0.6, Sources.VECTOR, 0.4), DEFAULT_RRF_K);
    }

    /**
     * Returns the weight of a source.
     *
     * @throws ConfigurationException if no weight is configured for the source
     */
    public double weightOf(String source) {
        Double weight = weights.get(source);
        if (weight == null) {
            throw new ConfigurationException("No weight configured for source '" + source + "'");
        }
        return weight;
    }

    /**
     * Checks that every given source has a weight when this configuration is a weighted sum. Reciprocal
     * rank fusion ignores weights, so any weight map passes.
     *
     * @return this configuration
     * @throws ConfigurationException if the strategy is weighted_sum and a source has no weight
     */
    public FusionConfig requireWeightsFor(String... sources) {
        if (strategy != FusionMethod.WEIGHTED_SUM) {
            return this;
        }
        for (String source : sources) {
            if (!weights.containsKey(source)) {
                throw new ConfigurationException("weighted_sum needs a weight for source '" + source
                        + "', configured weights: " + weights);
            }
        }
        return this;
    }

    public FusionConfig withStrategy(FusionMethod newStrategy) {
        return new FusionConfig(newStrategy, weights, rrfK);
    }

    public FusionConfig withWeight(String source, double weight) {
        Map<String, Double> updated = new TreeMap<>(weights);
        updated.put(source, weight);
        return new FusionConfig(strategy, updated, rrfK);
    }

    public FusionConfig withRrfK(int newRrfK) {
        return new FusionConfig(strategy, weights, newRrfK);
    }
}
