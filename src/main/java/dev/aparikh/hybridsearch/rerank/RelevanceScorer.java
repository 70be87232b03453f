package dev.aparikh.hybridsearch.rerank;

/**
 * Scores how relevant a document text is to a query; higher is more relevant. Typically backed by a
 * cross-encoder and potentially slow.
 */
@FunctionalInterface
public interface RelevanceScorer {

    double score(String query, String docText);
}
