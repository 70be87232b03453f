package dev.aparikh.hybridsearch.rerank;

import java.util.List;
import java.util.Map;

/**
 * Looks up the text a relevance scorer reads for each candidate.
 */
@FunctionalInterface
public interface DocumentTextSource {

    /**
     * @param docIds the candidate ids
     * @return text per document id; ids without stored text may be missing from the map
     */
    Map<String, String> fetchTexts(List<String> docIds);
}
