package dev.aparikh.hybridsearch.search;

import dev.aparikh.hybridsearch.ConfigurationException;
import dev.aparikh.hybridsearch.InvalidQueryException;
import dev.aparikh.hybridsearch.ScoringException;
import dev.aparikh.hybridsearch.config.HybridSearchProperties;
import dev.aparikh.hybridsearch.embedding.Embedder;
import dev.aparikh.hybridsearch.fusion.FusionEngine;
import dev.aparikh.hybridsearch.fusion.RankedList;
import dev.aparikh.hybridsearch.fusion.ScoredDocument;
import dev.aparikh.hybridsearch.fusion.Sources;
import dev.aparikh.hybridsearch.rerank.RelevanceScorer;
import dev.aparikh.hybridsearch.rerank.RerankStage;
import dev.aparikh.hybridsearch.rerank.Reranker;
import dev.aparikh.hybridsearch.retrieval.LexicalSource;
import dev.aparikh.hybridsearch.retrieval.VectorSource;
import dev.aparikh.hybridsearch.search.model.SearchResponse;
import dev.aparikh.hybridsearch.search.model.SourceStatus;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs the hybrid search pipeline: retrieve from both sources concurrently, fuse, optionally rerank,
 * and cut to the top-N.
 *
 * <p>Each source runs on the retrieval executor with its own timeout, measured from the start of the
 * request, so end-to-end retrieval latency is the slower of the two calls rather than their sum. A
 * source that fails or times out is replaced by an empty ranking and reported in
 * {@link SearchResponse#sources()}; the other source still produces results. Errors that say the
 * request itself is wrong (configuration, malformed query, corrupt scores) are not degraded: they fail
 * the request.</p>
 *
 * <p>A timed-out source is abandoned rather than stopped: cancelling its future completes it but does
 * not interrupt the Solr call underneath. The Solr client's request timeout, which is never longer
 * than the retrieval timeouts, bounds how long that call keeps its worker thread.</p>
 *
 * <p>The rerank stage is {@link RerankStage#identity()} unless reranking is enabled for the request.
 * A reranker failure fails the request, or, with {@code hybrid.rerank.fallback-to-fused=true}, returns
 * the fused order flagged with {@code rerankFailed}.</p>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
@Service
public class HybridSearchService {

    private static final Logger log = LoggerFactory.getLogger(HybridSearchService.class);

    private final LexicalSource lexicalSource;
    private final VectorSource vectorSource;
    private final Embedder embedder;
    private final FusionEngine fusionEngine;
    private final Reranker reranker;
    private final RelevanceScorer relevanceScorer;
    private final ExecutorService retrievalExecutor;
    private final HybridSearchProperties properties;
    private final SearchOptions defaultOptions;

    public HybridSearchService(LexicalSource lexicalSource,
                               VectorSource vectorSource,
                               Embedder embedder,
                               FusionEngine fusionEngine,
                               Reranker reranker,
                               RelevanceScorer relevanceScorer,
                               @Qualifier("retrievalExecutor") ExecutorService retrievalExecutor,
                               HybridSearchProperties properties,
                               SearchOptions defaultOptions) {
        this.lexicalSource = lexicalSource;
        this.vectorSource = vectorSource;
        this.embedder = embedder;
        this.fusionEngine = fusionEngine;
        this.reranker = reranker;
        this.relevanceScorer = relevanceScorer;
        this.retrievalExecutor = retrievalExecutor;
        this.properties = properties;
        this.defaultOptions = defaultOptions;
    }

    /**
     * The options built from {@code hybrid.*} at startup; requests derive overrides from these.
     */
    public SearchOptions defaultOptions() {
        return defaultOptions;
    }

    /**
     * Pipeline view of this service with fixed options, as consumed by the evaluator.
     */
    public SearchPipeline pipeline(SearchOptions options) {
        return query -> search(query, options).documents();
    }

    /**
     * Executes a hybrid search.
     *
     * @param query   the free-text query
     * @param options per-request settings
     * @return the top-N results with per-source status
     * @throws InvalidQueryException  if the query is blank or rejected by the lexical backend
     * @throws ConfigurationException if the fusion settings cannot be applied to the retrieved lists
     * @throws ScoringException       if a raw score is corrupt or reranking fails without fallback
     */
    public SearchResponse search(String query, SearchOptions options) {
        if (query == null || query.isBlank()) {
            throw new InvalidQueryException("Query must not be blank");
        }
        long started = System.nanoTime();
        HybridSearchProperties.Retrieval retrieval = properties.retrieval();
        int k = options.candidatePool();

        CompletableFuture<TimedList> lexicalFuture = submit(
                () -> lexicalSource.search(query, retrieval.fieldWeights(), k));
        CompletableFuture<TimedList> vectorFuture = submit(
                () -> vectorSource.search(embedder.embed(query), k));

        SourceOutcome lexical;
        SourceOutcome vector;
        try {
            lexical = await(Sources.LEXICAL, lexicalFuture, started, retrieval.lexicalTimeout());
            vector = await(Sources.VECTOR, vectorFuture, started, retrieval.vectorTimeout());
        } finally {
            vectorFuture.cancel(true);
        }

        Map<String, RankedList> lists = new TreeMap<>();
        lists.put(Sources.LEXICAL, lexical.list());
        lists.put(Sources.VECTOR, vector.list());
        List<SourceStatus> statuses = List.of(lexical.status(), vector.status());

        long fusionStarted = System.nanoTime();
        List<ScoredDocument> fused = fusionEngine.fuse(lists, options.fusion());
        log.debug("Fused {} lexical and {} vector candidates into {} with {} in {} ms",
                lexical.list().size(), vector.list().size(), fused.size(), options.fusion().strategy(),
                elapsedMs(fusionStarted));

        RerankStage stage = options.rerank()
                ? RerankStage.reranking(reranker, relevanceScorer, options.rerankCandidatePool())
                : RerankStage.identity();
        List<ScoredDocument> ranked;
        boolean reranked = options.rerank();
        boolean rerankFailed = false;
        try {
            ranked = stage.apply(query, fused);
        } catch (ScoringException e) {
            if (!properties.rerank().fallbackToFused()) {
                log.error("Reranking failed for query '{}': {}", query, e.getMessage());
                throw e;
            }
            log.warn("Reranking failed for query '{}', returning fused order: {}", query, e.getMessage());
            ranked = fused;
            reranked = false;
            rerankFailed = true;
        }

        List<ScoredDocument> top = List.copyOf(ranked.subList(0, Math.min(options.topN(), ranked.size())));
        log.debug("Search '{}' returned {} results in {} ms", query, top.size(), elapsedMs(started));
        return new SearchResponse(query, options.fusion().strategy(), top, statuses, reranked, rerankFailed);
    }

    private CompletableFuture<TimedList> submit(Supplier<RankedList> call) {
        return CompletableFuture.supplyAsync(() -> {
            long started = System.nanoTime();
            RankedList list = call.get();
            return new TimedList(list, elapsedMs(started));
        }, retrievalExecutor);
    }

    private SourceOutcome await(String source, CompletableFuture<TimedList> future, long started, Duration timeout) {
        long remaining = Math.max(0, timeout.toNanos() - (System.nanoTime() - started));
        try {
            TimedList result = future.get(remaining, TimeUnit.NANOSECONDS);
            return new SourceOutcome(result.list(), SourceStatus.ok(source, result.list().size(), result.tookMs()));
        } catch (TimeoutException e) {
            future.cancel(true);
            return degraded(source, SourceStatus.State.TIMED_OUT, started,
                    "No response within " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ConfigurationException
                    || cause instanceof InvalidQueryException
                    || cause instanceof ScoringException) {
                throw (RuntimeException) cause;
            }
            return degraded(source, SourceStatus.State.FAILED, started, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return degraded(source, SourceStatus.State.FAILED, started, "interrupted");
        }
    }

    private static SourceOutcome degraded(String source, SourceStatus.State state, long started,
                                          @Nullable String message) {
        log.warn("Source '{}' {}; continuing without it: {}", source, state, message);
        SourceStatus status = new SourceStatus(source, state, 0, elapsedMs(started), message);
        return new SourceOutcome(RankedList.empty(source), status);
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }

    private record TimedList(RankedList list, long tookMs) {
    }

    private record SourceOutcome(RankedList list, SourceStatus status) {
    }
}
