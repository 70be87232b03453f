package dev.aparikh.hybridsearch.embedding;

import dev.aparikh.hybridsearch.ConfigurationException;

/**
 * Decorates an {@link Embedder} and rejects vectors whose length differs from the configured
 * dimensionality. A mismatch means the query embedder and the indexed vectors disagree, which no
 * retry can fix.
 */
public class DimensionCheckingEmbedder implements Embedder {

    private final Embedder delegate;
    private final int dimensions;

    public DimensionCheckingEmbedder(Embedder delegate, int dimensions) {
        if (dimensions <= 0) {
            throw new ConfigurationException("Embedding dimensions must be positive, got: " + dimensions);
        }
        this.delegate = delegate;
        this.dimensions = dimensions;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = delegate.embed(text);
        if (vector.length != dimensions) {
            throw new ConfigurationException("Embedding has " + vector.length
                    + " dimensions but the index is configured for " + dimensions);
        }
        return vector;
    }

    public int dimensions() {
        return dimensions;
    }
}
