package dev.aparikh.hybridsearch.evaluation;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A labeled query: the query text and the ids of every document judged relevant to it.
 *
 * <p>Read from {@code {"query": "...", "relevant": ["T-1", "T-7"]}}; {@code relevant_doc_ids} is
 * accepted in place of {@code relevant}. A judgment without a query is kept so that the evaluator can
 * report it as malformed instead of dropping it.</p>
 *
 * @param query          the query text, {@code null} or blank for a malformed judgment
 * @param relevantDocIds ids of the relevant documents, may be empty
 */
public record RelevanceJudgment(
        @Nullable String query,
        @JsonProperty("relevant") @JsonAlias({"relevant_doc_ids", "relevantDocIds"}) Set<String> relevantDocIds
) {

    public RelevanceJudgment {
        relevantDocIds = relevantDocIds == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(relevantDocIds));
    }

    public static RelevanceJudgment of(String query, String... relevantDocIds) {
        return new RelevanceJudgment(query, new LinkedHashSet<>(List.of(relevantDocIds)));
    }

    boolean hasQuery() {
        return query != null && !query.isBlank();
    }
}
