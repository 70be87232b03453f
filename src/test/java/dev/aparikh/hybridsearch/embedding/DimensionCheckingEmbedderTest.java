package dev.aparikh.hybridsearch.embedding;

import dev.aparikh.hybridsearch.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DimensionCheckingEmbedderTest {

    @Test
    void shouldPassThroughMatchingVector() {
        DimensionCheckingEmbedder embedder = new DimensionCheckingEmbedder(text -> new float[]{1f, 0f, 0f}, 3);

        assertThat(embedder.embed("q")).containsExactly(1f, 0f, 0f);
        assertThat(embedder.dimensions()).isEqualTo(3);
    }

    @Test
    void shouldRejectMismatchedVector() {
        DimensionCheckingEmbedder embedder = new DimensionCheckingEmbedder(text -> new float[1536], 384);

        assertThatThrownBy(() -> embedder.embed("q"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("1536")
                .hasMessageContaining("384");
    }

    @Test
    void shouldRejectNonPositiveDimensions() {
        assertThatThrownBy(() -> new DimensionCheckingEmbedder(text -> new float[0], 0))
                .isInstanceOf(ConfigurationException.class);
    }
}
