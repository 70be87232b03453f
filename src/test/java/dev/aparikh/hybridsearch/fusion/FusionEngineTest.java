package dev.aparikh.hybridsearch.fusion;

import dev.aparikh.hybridsearch.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FusionEngineTest {

    private FusionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new FusionEngine();
    }

    private static Map<String, RankedList> lists(RankedList lexical, RankedList vector) {
        return Map.of(Sources.LEXICAL, lexical, Sources.VECTOR, vector);
    }

    private static List<String> ids(List<ScoredDocument> documents) {
        return documents.stream().map(ScoredDocument::docId).toList();
    }

    private static ScoredDocument find(List<ScoredDocument> documents, String docId) {
        return documents.stream().filter(d -> d.docId().equals(docId)).findFirst().orElseThrow();
    }

    // ==================== Weighted Sum ====================

    @Nested
    class WeightedSum {

        private final FusionConfig equalWeights = new FusionConfig(FusionMethod.WEIGHTED_SUM,
                Map.of(Sources.LEXICAL, 0.5, Sources.VECTOR, 0.5), FusionConfig.DEFAULT_RRF_K);

        @Test
        void shouldFuseWorkedExample() {
            RankedList lexical = RankedList.builder(Sources.LEXICAL).add("A", 10).add("B", 5).add("C", 0).build();
            RankedList vector = RankedList.builder(Sources.VECTOR).add("B", 0.9).add("C", 0.4).build();
            FusionConfig config = FusionConfig.defaults();

            List<ScoredDocument> fused = engine.fuse(lists(lexical, vector), config);

            // B: 0.6 * 0.5 + 0.4 * 1.0 = 0.7; A: 0.6 * 1.0 = 0.6; C: 0.6 * 0 + 0.4 * 0 = 0
            assertThat(ids(fused)).containsExactly("B", "A", "C");
            assertThat(fused.get(0).score()).isCloseTo(0.7, within(1e-12));
            assertThat(fused.get(1).score()).isCloseTo(0.6, within(1e-12));
            assertThat(fused.get(2).score()).isCloseTo(0.0, within(1e-12));
        }

        @Test
        void documentInBothSourcesShouldOutrankSingleSourceTopHitWithEqualWeights() {
            // A: lexical rank 1 only. B: lexical rank 2 (normalized 0.5) and vector rank 1.
            RankedList lexical = RankedList.builder(Sources.LEXICAL).add("A", 4.0).add("B", 2.0).add("Z", 0.0).build();
            RankedList vector = RankedList.builder(Sources.VECTOR).add("B", 0.8).build();

            List<ScoredDocument> fused = engine.fuse(lists(lexical, vector), equalWeights);

            assertThat(find(fused, "B").score()).isCloseTo(0.75, within(1e-12));
            assertThat(find(fused, "A").score()).isCloseTo(0.5, within(1e-12));
            assertThat(ids(fused)).startsWith("B", "A");
        }

        @Test
        void zeroVectorWeightShouldRankByLexicalAlone() {
            RankedList lexical = RankedList.builder(Sources.LEXICAL)
                    .add("a", 9.0).add("b", 6.5).add("c", 3.0).add("d", 1.0).build();
            RankedList vector = RankedList.builder(Sources.VECTOR)
                    .add("d", 0.99).add("c", 0.7).add("e", 0.5).build();
            FusionConfig config = FusionConfig.defaults().withWeight(Sources.VECTOR, 0.0);

            List<ScoredDocument> fused = engine.fuse(lists(lexical, vector), config);

            List<String> lexicalOrder = ids(lexical.documents());
            assertThat(ids(fused).subList(0, lexicalOrder.size())).isEqualTo(lexicalOrder);
            // the vector-only document scores 0 and sorts last
            assertThat(fused.get(fused.size() - 1).docId()).isEqualTo("e");
        }

        @Test
        void shouldKeepRawScoresFromEverySource() {
            RankedList lexical = RankedList.builder(Sources.LEXICAL).add("a", 7.5).build();
            RankedList vector = RankedList.builder(Sources.VECTOR).add("a", 0.33).build();

            ScoredDocument fused = engine.fuse(lists(lexical, vector), FusionConfig.defaults()).get(0);

            assertThat(fused.rawScores()).containsEntry(Sources.LEXICAL, 7.5).containsEntry(Sources.VECTOR, 0.33);
        }

        @Test
        void shouldDegradeToSingleSourceRankingWhenOtherSourceIsEmpty() {
            RankedList lexical = RankedList.builder(Sources.LEXICAL).add("a", 3.0).add("b", 2.0).build();

            List<ScoredDocument> fused = engine.fuse(lists(lexical, RankedList.empty(Sources.VECTOR)),
                    FusionConfig.defaults());

            assertThat(ids(fused)).containsExactly("a", "b");
        }

        @Test
        void shouldRejectSourceWithoutWeight() {
            FusionConfig lexicalOnly = new FusionConfig(FusionMethod.WEIGHTED_SUM,
                    Map.of(Sources.LEXICAL, 1.0), FusionConfig.DEFAULT_RRF_K);
            RankedList lexical = RankedList.builder(Sources.LEXICAL).add("a", 1.0).build();
            RankedList vector = RankedList.builder(Sources.VECTOR).add("b", 1.0).build();

            assertThatThrownBy(() -> engine.fuse(lists(lexical, vector), lexicalOnly))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining(Sources.VECTOR);
        }
    }

    // ==================== Reciprocal Rank Fusion ====================

    @Nested
    class Rrf {

        private final FusionConfig rrf = FusionConfig.defaults().withStrategy(FusionMethod.RRF);

        @Test
        void shouldSumReciprocalRanks() {
            RankedList lexical = RankedList.builder(Sources.LEXICAL).add("a", 10).add("b", 5).build();
            RankedList vector = RankedList.builder(Sources.VECTOR).add("b", 0.9).add("c", 0.1).build();

            List<ScoredDocument> fused = engine.fuse(lists(lexical, vector), rrf);

            assertThat(find(fused, "b").score()).isCloseTo(1.0 / 62 + 1.0 / 61, within(1e-12));
            assertThat(find(fused, "a").score()).isCloseTo(1.0 / 61, within(1e-12));
            assertThat(find(fused, "c").score()).isCloseTo(1.0 / 62, within(1e-12));
            assertThat(ids(fused)).containsExactly("b", "a", "c");
        }

        @Test
        void shouldIgnoreWeights() {
            RankedList lexical = RankedList.builder(Sources.LEXICAL).add("a", 10).build();
            RankedList vector = RankedList.builder(Sources.VECTOR).add("b", 0.9).build();

            List<ScoredDocument> fused = engine.fuse(lists(lexical, vector), rrf.withWeight(Sources.VECTOR, 0.0));

            assertThat(find(fused, "a").score()).isEqualTo(find(fused, "b").score());
            assertThat(ids(fused)).containsExactly("a", "b");
        }

        @Test
        void shouldOnlyUseRanksNotScoreMagnitudes() {
            RankedList close = RankedList.builder(Sources.LEXICAL).add("a", 1.01).add("b", 1.0).build();
            RankedList far = RankedList.builder(Sources.LEXICAL).add("a", 1000).add("b", 0.001).build();
            Map<String, RankedList> closeLists = Map.of(Sources.LEXICAL, close);
            Map<String, RankedList> farLists = Map.of(Sources.LEXICAL, far);

            assertThat(engine.fuse(closeLists, rrf)).extracting(ScoredDocument::score)
                    .isEqualTo(engine.fuse(farLists, rrf).stream().map(ScoredDocument::score).toList());
        }
    }

    // ==================== Ordering Guarantees ====================

    @Nested
    class Ordering {

        @Test
        void fusedOutputShouldBeTotalOrder() {
            RankedList lexical = RankedList.builder(Sources.LEXICAL)
                    .add("d3", 1.0).add("d1", 1.0).add("d2", 1.0).build();
            RankedList vector = RankedList.builder(Sources.VECTOR)
                    .add("d5", 0.5).add("d4", 0.5).build();

            for (FusionMethod method : FusionMethod.values()) {
                List<ScoredDocument> fused = engine.fuse(lists(lexical, vector),
                        FusionConfig.defaults().withStrategy(method));

                Set<String> keys = new HashSet<>();
                for (ScoredDocument doc : fused) {
                    assertThat(keys.add(doc.score() + "|" + doc.docId())).isTrue();
                }
                for (int i = 1; i < fused.size(); i++) {
                    assertThat(RankingOrder.SCORE_DESCENDING_THEN_ID.compare(fused.get(i - 1), fused.get(i)))
                            .isNegative();
                }
            }
        }

        @Test
        void tiesShouldBreakByDocIdAscending() {
            RankedList lexical = RankedList.builder(Sources.LEXICAL).add("b", 2.0).add("a", 2.0).build();
            RankedList vector = RankedList.empty(Sources.VECTOR);

            List<ScoredDocument> fused = engine.fuse(lists(lexical, vector), FusionConfig.defaults());

            assertThat(ids(fused)).containsExactly("a", "b");
        }

        @Test
        void fusionShouldBeIdempotentRegardlessOfMapOrder() {
            RankedList lexical = RankedList.builder(Sources.LEXICAL)
                    .add("t1", 3.3).add("t2", 2.2).add("t3", 1.1).add("t4", 1.1).build();
            RankedList vector = RankedList.builder(Sources.VECTOR)
                    .add("t4", 0.8).add("t5", 0.8).add("t1", 0.2).build();
            Map<String, RankedList> forward = new LinkedHashMap<>();
            forward.put(Sources.LEXICAL, lexical);
            forward.put(Sources.VECTOR, vector);
            Map<String, RankedList> backward = new LinkedHashMap<>();
            backward.put(Sources.VECTOR, vector);
            backward.put(Sources.LEXICAL, lexical);

            for (FusionMethod method : FusionMethod.values()) {
                FusionConfig config = FusionConfig.defaults().withStrategy(method);
                List<ScoredDocument> first = engine.fuse(forward, config);
                for (int run = 0; run < 5; run++) {
                    assertThat(engine.fuse(forward, config)).isEqualTo(first);
                    assertThat(engine.fuse(backward, config)).isEqualTo(first);
                }
            }
        }
    }

    @Nested
    class Inputs {

        @Test
        void shouldReturnEmptyWhenEverySourceIsEmpty() {
            assertThat(engine.fuse(lists(RankedList.empty(Sources.LEXICAL), RankedList.empty(Sources.VECTOR)),
                    FusionConfig.defaults())).isEmpty();
        }

        @Test
        void shouldRejectMissingRanking() {
            Map<String, RankedList> withNull = new HashMap<>();
            withNull.put(Sources.LEXICAL, RankedList.empty(Sources.LEXICAL));
            withNull.put(Sources.VECTOR, null);

            assertThatThrownBy(() -> engine.fuse(withNull, FusionConfig.defaults()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining(Sources.VECTOR);
        }

        @Test
        void shouldRejectUnregisteredStrategy() {
            FusionEngine weightedOnly = new FusionEngine(List.of(new WeightedSumFusion()));

            assertThatThrownBy(() -> weightedOnly.fuse(Map.of(), FusionConfig.defaults().withStrategy(FusionMethod.RRF)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("RRF");
        }
    }
}
