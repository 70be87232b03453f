package dev.aparikh.hybridsearch.retrieval;

import dev.aparikh.hybridsearch.fusion.RankedList;

/**
 * Nearest-neighbour retrieval over dense embeddings. Raw scores are similarities derived from the
 * distance as {@code 1 / (1 + distance)}, see {@link VectorScores}.
 */
public interface VectorSource {

    /**
     * @throws dev.aparikh.hybridsearch.SourceUnavailableException if the backend cannot be queried
     */
    RankedList search(float[] queryVector, int topK);
}
