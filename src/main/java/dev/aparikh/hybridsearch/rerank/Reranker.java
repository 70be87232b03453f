package dev.aparikh.hybridsearch.rerank;

import dev.aparikh.hybridsearch.ScoringException;
import dev.aparikh.hybridsearch.fusion.RankingOrder;
import dev.aparikh.hybridsearch.fusion.ScoredDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Reorders a candidate pool by pairwise relevance.
 *
 * <p>Each candidate's score is replaced by the value the {@link RelevanceScorer} returns for
 * {@code (query, docText)} and the pool is re-sorted with the usual score-then-id order. The previous
 * (fused) score is kept in {@link ScoredDocument#rawScores()} under {@link #FUSED_SCORE}.</p>
 *
 * <p>Candidates are scored concurrently on the supplied executor; the reorder happens only once every
 * score is in. If any candidate cannot be scored the whole call fails with a {@link ScoringException}
 * and no partial ordering is returned. The pool is reranked as given: it is the caller's job to pass a
 * pool at least as large as the number of results it will return.</p>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public class Reranker {

    public static final String FUSED_SCORE = "fused";

    private static final Logger log = LoggerFactory.getLogger(Reranker.class);

    private final DocumentTextSource textSource;
    private final Executor executor;

    public Reranker(DocumentTextSource textSource, Executor executor) {
        this.textSource = textSource;
        this.executor = executor;
    }

    /**
     * Reranks the candidates.
     *
     * @param query      the user query
     * @param candidates the top-M fused results
     * @param scorer     the pairwise relevance function
     * @return the candidates reordered by relevance
     * @throws ScoringException if text lookup or scoring fails for any candidate, or a score is not finite
     */
    public List<ScoredDocument> rerank(String query, List<ScoredDocument> candidates, RelevanceScorer scorer) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        Map<String, String> texts = fetchTexts(candidates);

        List<CompletableFuture<ScoredDocument>> futures = new ArrayList<>(candidates.size());
        for (ScoredDocument candidate : candidates) {
            String text = texts.getOrDefault(candidate.docId(), "");
            futures.add(CompletableFuture.supplyAsync(() -> rescore(query, candidate, text, scorer), executor));
        }

        List<ScoredDocument> reranked = new ArrayList<>(candidates.size());
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            for (CompletableFuture<ScoredDocument> future : futures) {
                reranked.add(future.join());
            }
        } catch (CompletionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ScoringException scoringException) {
                throw scoringException;
            }
            throw new ScoringException("Reranking failed: " + cause.getMessage(), cause);
        }

        reranked.sort(RankingOrder.SCORE_DESCENDING_THEN_ID);
        log.debug("Reranked {} candidates for query: {}", reranked.size(), query);
        return reranked;
    }

    private Map<String, String> fetchTexts(List<ScoredDocument> candidates) {
        List<String> ids = candidates.stream().map(ScoredDocument::docId).toList();
        try {
            return textSource.fetchTexts(ids);
        } catch (RuntimeException e) {
            throw new ScoringException("Could not load candidate text for reranking: " + e.getMessage(), e);
        }
    }

    private static ScoredDocument rescore(String query, ScoredDocument candidate, String text, RelevanceScorer scorer) {
        double relevance;
        try {
            relevance = scorer.score(query, text);
        } catch (RuntimeException e) {
            throw new ScoringException("Relevance scoring failed for document '" + candidate.docId() + "'", e);
        }
        if (!Double.isFinite(relevance)) {
            throw new ScoringException("Relevance score for document '" + candidate.docId() + "' is not finite: " + relevance);
        }
        Map<String, Double> rawScores = new HashMap<>(candidate.rawScores());
        rawScores.put(FUSED_SCORE, candidate.score());
        return new ScoredDocument(candidate.docId(), relevance, rawScores);
    }
}
