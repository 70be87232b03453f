package dev.aparikh.hybridsearch.embedding;

/**
 * Turns text into a fixed-length dense vector. The same dimensionality must be used at ingestion
 * and at query time.
 */
@FunctionalInterface
public interface Embedder {

    float[] embed(String text);
}
