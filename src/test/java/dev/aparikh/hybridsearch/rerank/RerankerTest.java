package dev.aparikh.hybridsearch.rerank;

import dev.aparikh.hybridsearch.ScoringException;
import dev.aparikh.hybridsearch.fusion.ScoredDocument;
import dev.aparikh.hybridsearch.fusion.Sources;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RerankerTest {

    private ExecutorService executor;

    private final Map<String, String> texts = Map.of(
            "d1", "printer offline",
            "d2", "vpn disconnects",
            "d3", "password reset");

    private Reranker reranker;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        reranker = new Reranker(ids -> texts, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static ScoredDocument fused(String docId, double score) {
        return new ScoredDocument(docId, score, Map.of(Sources.LEXICAL, score * 10));
    }

    private static List<String> ids(List<ScoredDocument> documents) {
        return documents.stream().map(ScoredDocument::docId).toList();
    }

    @Nested
    class Reordering {

        @Test
        void shouldOrderByRelevanceScore() {
            RelevanceScorer scorer = (query, text) -> text.equals("printer offline") ? 0.2 : 0.9;

            List<ScoredDocument> reranked = reranker.rerank("q", List.of(fused("d1", 0.8), fused("d2", 0.7)), scorer);

            assertThat(ids(reranked)).containsExactly("d2", "d1");
            assertThat(reranked.get(0).score()).isEqualTo(0.9);
        }

        @Test
        void shouldBreakRelevanceTiesByDocId() {
            List<ScoredDocument> reranked = reranker.rerank("q",
                    List.of(fused("d3", 0.9), fused("d1", 0.5), fused("d2", 0.1)), (query, text) -> 0.5);

            assertThat(ids(reranked)).containsExactly("d1", "d2", "d3");
        }

        @Test
        void shouldKeepFusedScoreAndRawScores() {
            ScoredDocument reranked = reranker.rerank("q", List.of(fused("d1", 0.8)), (query, text) -> 0.3).get(0);

            assertThat(reranked.rawScores())
                    .containsEntry(Reranker.FUSED_SCORE, 0.8)
                    .containsEntry(Sources.LEXICAL, 8.0);
        }

        @Test
        void shouldScoreMissingTextAsEmptyString() {
            Map<String, String> seen = new ConcurrentHashMap<>();

            reranker.rerank("q", List.of(fused("unknown", 0.8)), (query, text) -> {
                seen.put("unknown", text);
                return 0.1;
            });

            assertThat(seen).containsEntry("unknown", "");
        }

        @Test
        void shouldReturnEmptyForNoCandidates() {
            assertThat(reranker.rerank("q", List.of(), (query, text) -> 1.0)).isEmpty();
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldFailWholeCallWhenAnyCandidateFails() {
            RelevanceScorer scorer = (query, text) -> {
                if (text.equals("vpn disconnects")) {
                    throw new IllegalStateException("model unavailable");
                }
                return 0.5;
            };

            assertThatThrownBy(() -> reranker.rerank("q",
                    List.of(fused("d1", 0.9), fused("d2", 0.8), fused("d3", 0.7)), scorer))
                    .isInstanceOf(ScoringException.class)
                    .hasMessageContaining("d2");
        }

        @Test
        void shouldRejectNonFiniteRelevance() {
            assertThatThrownBy(() -> reranker.rerank("q", List.of(fused("d1", 0.9)), (query, text) -> Double.NaN))
                    .isInstanceOf(ScoringException.class)
                    .hasMessageContaining("not finite");
        }

        @Test
        void shouldWrapTextLookupFailure() {
            Reranker failingLookup = new Reranker(ids -> {
                throw new IllegalStateException("solr down");
            }, executor);

            assertThatThrownBy(() -> failingLookup.rerank("q", List.of(fused("d1", 0.9)), (query, text) -> 0.5))
                    .isInstanceOf(ScoringException.class)
                    .hasMessageContaining("solr down");
        }
    }

    @Nested
    class Stage {

        @Test
        void identityShouldReturnFusedOrderUnchanged() {
            List<ScoredDocument> fused = List.of(fused("d1", 0.9), fused("d2", 0.5));

            assertThat(RerankStage.identity().apply("q", fused)).isSameAs(fused);
        }

        @Test
        void rerankingStageShouldOnlyRerankCandidatePool() {
            RerankStage stage = RerankStage.reranking(reranker, (query, text) -> text.equals("password reset") ? 1.0 : 0.0, 2);

            List<ScoredDocument> result = stage.apply("q", List.of(fused("d1", 0.9), fused("d2", 0.8), fused("d3", 0.7)));

            // d3 is outside the pool of 2 and is never considered
            assertThat(ids(result)).containsExactly("d1", "d2");
        }

        @Test
        void shouldRejectNonPositivePool() {
            assertThatThrownBy(() -> RerankStage.reranking(reranker, (query, text) -> 0.0, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
