package dev.aparikh.hybridsearch.evaluation;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Set;

/**
 * Metrics of a single labeled query.
 *
 * @param query          the query text as given in the judgment
 * @param reciprocalRank {@code 1 / position} of the first relevant document in the top-n, or 0
 * @param recall         share of the relevant documents found in the top-n, {@code null} when undefined
 * @param retrieved      ids of the top-n documents, in ranked order
 * @param flags          reasons this query is excluded from an aggregate; empty for a normal query
 * @param error          pipeline failure message for {@link EvaluationFlag#PIPELINE_FAILED}
 */
public record QueryEvaluation(
        @Nullable String query,
        double reciprocalRank,
        @Nullable Double recall,
        List<String> retrieved,
        Set<EvaluationFlag> flags,
        @Nullable String error
) {

    public QueryEvaluation {
        retrieved = List.copyOf(retrieved);
        flags = Set.copyOf(flags);
    }

    public boolean countsTowardsReciprocalRank() {
        return !flags.contains(EvaluationFlag.MALFORMED_JUDGMENT) && !flags.contains(EvaluationFlag.PIPELINE_FAILED);
    }

    public boolean countsTowardsRecall() {
        return countsTowardsReciprocalRank() && recall != null;
    }
}
