package dev.aparikh.hybridsearch.evaluation;

/**
 * Why a query was left out of one or both aggregate metrics.
 */
public enum EvaluationFlag {
    /** The judgment lists no relevant documents; recall is undefined and the query is left out of the recall mean. */
    EMPTY_RELEVANT_SET,
    /** The judgment has no query; the pipeline was not run and the query is left out of both means. */
    MALFORMED_JUDGMENT,
    /** The pipeline failed for this query; it is left out of both means. */
    PIPELINE_FAILED
}
