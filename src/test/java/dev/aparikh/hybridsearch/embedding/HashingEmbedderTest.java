package dev.aparikh.hybridsearch.embedding;

import dev.aparikh.hybridsearch.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HashingEmbedderTest {

    private final HashingEmbedder embedder = new HashingEmbedder(384);

    @Test
    void shouldProduceConfiguredDimensions() {
        assertThat(embedder.embed("cannot connect to vpn")).hasSize(384);
    }

    @Test
    void shouldBeDeterministic() {
        assertThat(new HashingEmbedder(384).embed("Outlook keeps crashing"))
                .containsExactly(embedder.embed("Outlook keeps crashing"));
    }

    @Test
    void shouldL2Normalize() {
        float[] vector = embedder.embed("disk full on build server, disk cleanup failed");

        double norm = 0.0;
        for (float v : vector) {
            norm += v * v;
        }
        assertThat(Math.sqrt(norm)).isCloseTo(1.0, within(1e-5));
    }

    @Test
    void shouldIgnoreCaseAndPunctuation() {
        assertThat(embedder.embed("VPN, Timeout!")).containsExactly(embedder.embed("vpn timeout"));
    }

    @Test
    void shouldCountRepeatedTokensInSameBucket() {
        float[] vector = embedder.embed("wifi wifi");

        int bucket = embedder.bucket("wifi");
        assertThat(vector[bucket]).isCloseTo(1.0f, within(1e-6f));
    }

    @Test
    void shouldReturnZeroVectorWhenNoTokens() {
        assertThat(embedder.embed("  ?! ")).containsOnly(0.0f);
    }

    @Test
    void shouldRejectNonPositiveDimensions() {
        assertThatThrownBy(() -> new HashingEmbedder(0)).isInstanceOf(ConfigurationException.class);
    }
}
