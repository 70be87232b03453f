package dev.aparikh.hybridsearch.retrieval;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class VectorScoresTest {

    @Test
    void similarityShouldBeOneAtZeroDistance() {
        assertThat(VectorScores.similarityFromDistance(0.0)).isEqualTo(1.0);
    }

    @Test
    void similarityShouldDecreaseWithDistance() {
        assertThat(VectorScores.similarityFromDistance(1.0)).isEqualTo(0.5);
        assertThat(VectorScores.similarityFromDistance(4.0)).isEqualTo(0.2);
    }

    @Test
    void shouldRejectNegativeDistance() {
        assertThatThrownBy(() -> VectorScores.similarityFromDistance(-0.1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRecoverDistanceFromSolrScore() {
        assertThat(VectorScores.distanceFromSolrEuclideanScore(1.0)).isEqualTo(0.0);
        assertThat(VectorScores.distanceFromSolrEuclideanScore(0.2)).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void shouldRejectScoreOutsideUnitInterval() {
        assertThatThrownBy(() -> VectorScores.distanceFromSolrEuclideanScore(0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> VectorScores.distanceFromSolrEuclideanScore(1.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
