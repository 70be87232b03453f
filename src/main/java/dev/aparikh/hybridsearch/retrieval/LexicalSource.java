package dev.aparikh.hybridsearch.retrieval;

import dev.aparikh.hybridsearch.fusion.RankedList;

import java.util.Map;

/**
 * Term-frequency (BM25-family) retrieval over weighted text fields.
 */
public interface LexicalSource {

    /**
     * Searches the text fields.
     *
     * @param query        the free-text query
     * @param fieldWeights boost per text field
     * @param topK         maximum number of results
     * @return the ranking, empty when nothing matches
     * @throws dev.aparikh.hybridsearch.InvalidQueryException if the query syntax is malformed
     * @throws dev.aparikh.hybridsearch.SourceUnavailableException if the backend cannot be queried
     */
    RankedList search(String query, Map<String, Double> fieldWeights, int topK);
}
