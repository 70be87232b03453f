package dev.aparikh.hybridsearch.evaluation;

import java.util.List;

/**
 * Outcome of an evaluation run.
 *
 * @param perQuery  one entry per judgment, in input order
 * @param aggregate means over the queries that count towards each metric
 * @param rejected  judgment-file lines that never became judgments
 */
public record EvalResult(List<QueryEvaluation> perQuery, Aggregate aggregate, List<RejectedJudgment> rejected) {

    public EvalResult {
        perQuery = List.copyOf(perQuery);
        rejected = List.copyOf(rejected);
    }

    /**
     * @param n                cut-off the metrics were computed at
     * @param mrrAtN           mean reciprocal rank over {@code queriesEvaluated} queries, 0 when there are none
     * @param recallAtN        mean recall over {@code recallQueries} queries, 0 when there are none
     * @param queriesEvaluated number of queries in the MRR mean
     * @param recallQueries    number of queries in the recall mean
     */
    public record Aggregate(int n, double mrrAtN, double recallAtN, int queriesEvaluated, int recallQueries) {
    }
}
