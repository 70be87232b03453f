package dev.aparikh.hybridsearch.evaluation;

import dev.aparikh.hybridsearch.ConfigurationException;
import dev.aparikh.hybridsearch.fusion.ScoredDocument;
import dev.aparikh.hybridsearch.search.SearchPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Computes MRR@n and Recall@n of a {@link SearchPipeline} over a set of labeled queries.
 *
 * <p>For every judgment the pipeline runs once and its output is cut to the first {@code n} ids:</p>
 * <ul>
 *   <li>reciprocal rank is {@code 1 / position} of the first relevant id, 0 when none appears</li>
 *   <li>recall is {@code |relevant ∩ top-n| / |relevant|}; undefined for an empty relevant set, which
 *       is flagged {@link EvaluationFlag#EMPTY_RELEVANT_SET} and left out of the recall mean</li>
 * </ul>
 *
 * <p>A judgment without a query, or one whose pipeline call throws, is flagged and left out of both
 * means; the rest of the batch still runs. A {@link ConfigurationException} from the pipeline is not
 * a per-query failure: it would fail every query alike, so it fails the whole evaluation. Queries may
 * run concurrently on the supplied executor, but per-query results always come back in input order.</p>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public class Evaluator {

    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    private final Executor executor;

    public Evaluator(Executor executor) {
        this.executor = executor;
    }

    public EvalResult evaluate(List<RelevanceJudgment> judgments, SearchPipeline pipeline, int n) {
        return evaluate(new LoadedJudgments(judgments, List.of()), pipeline, n);
    }

    /**
     * Evaluates the pipeline and carries the loader's rejected lines into the result.
     *
     * @throws ConfigurationException if {@code n} is not positive or the pipeline is misconfigured
     */
    public EvalResult evaluate(LoadedJudgments loaded, SearchPipeline pipeline, int n) {
        if (n <= 0) {
            throw new ConfigurationException("Evaluation cut-off n must be positive, got: " + n);
        }
        List<CompletableFuture<QueryEvaluation>> futures = new ArrayList<>(loaded.judgments().size());
        for (RelevanceJudgment judgment : loaded.judgments()) {
            futures.add(CompletableFuture.supplyAsync(() -> evaluateOne(judgment, pipeline, n), executor));
        }
        List<QueryEvaluation> perQuery;
        try {
            perQuery = futures.stream().map(CompletableFuture::join).toList();
        } catch (CompletionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }

        EvalResult result = new EvalResult(perQuery, aggregate(perQuery, n), loaded.rejected());
        log.info("Evaluated {} judgments at n={}: MRR={}, Recall={} ({} in MRR, {} in recall, {} rejected lines)",
                perQuery.size(), n, result.aggregate().mrrAtN(), result.aggregate().recallAtN(),
                result.aggregate().queriesEvaluated(), result.aggregate().recallQueries(), loaded.rejected().size());
        return result;
    }

    static QueryEvaluation evaluateOne(RelevanceJudgment judgment, SearchPipeline pipeline, int n) {
        if (!judgment.hasQuery()) {
            return new QueryEvaluation(judgment.query(), 0.0, null, List.of(),
                    EnumSet.of(EvaluationFlag.MALFORMED_JUDGMENT), "Judgment has no query");
        }

        List<String> topN;
        try {
            topN = pipeline.search(judgment.query()).stream()
                    .limit(n)
                    .map(ScoredDocument::docId)
                    .toList();
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Pipeline failed for query '{}': {}", judgment.query(), e.getMessage());
            return new QueryEvaluation(judgment.query(), 0.0, null, List.of(),
                    EnumSet.of(EvaluationFlag.PIPELINE_FAILED), e.getMessage());
        }

        Set<String> relevant = judgment.relevantDocIds();
        double reciprocalRank = reciprocalRank(topN, relevant);
        if (relevant.isEmpty()) {
            return new QueryEvaluation(judgment.query(), reciprocalRank, null, topN,
                    EnumSet.of(EvaluationFlag.EMPTY_RELEVANT_SET), null);
        }
        long found = topN.stream().filter(relevant::contains).count();
        double recall = (double) found / relevant.size();
        return new QueryEvaluation(judgment.query(), reciprocalRank, recall, topN, Set.of(), null);
    }

    static double reciprocalRank(List<String> topN, Set<String> relevant) {
        for (int i = 0; i < topN.size(); i++) {
            if (relevant.contains(topN.get(i))) {
                return 1.0 / (i + 1);
            }
        }
        return 0.0;
    }

    private static EvalResult.Aggregate aggregate(List<QueryEvaluation> perQuery, int n) {
        double rrSum = 0.0;
        int rrCount = 0;
        double recallSum = 0.0;
        int recallCount = 0;
        for (QueryEvaluation evaluation : perQuery) {
            if (evaluation.countsTowardsReciprocalRank()) {
                rrSum += evaluation.reciprocalRank();
                rrCount++;
            }
            if (evaluation.countsTowardsRecall()) {
                recallSum += evaluation.recall();
                recallCount++;
            }
        }
        return new EvalResult.Aggregate(n,
                rrCount == 0 ? 0.0 : rrSum / rrCount,
                recallCount == 0 ? 0.0 : recallSum / recallCount,
                rrCount,
                recallCount);
    }
}
