package dev.aparikh.hybridsearch.embedding;

import dev.aparikh.hybridsearch.ConfigurationException;
import org.springframework.util.DigestUtils;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Feature-hashing embedder that needs no model.
 *
 * <p>The text is lower-cased and split into {@code [a-z0-9]+} tokens. Each token is hashed with MD5,
 * the digest read as an unsigned integer modulo the dimensionality picks a bucket, and bucket counts
 * are L2-normalized. MD5 keeps bucket assignment stable across JVMs and machines, so vectors written
 * at ingestion time match the ones computed for queries.</p>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public class HashingEmbedder implements Embedder {

    private static final Pattern TOKEN = Pattern.compile("[a-z0-9]+");

    private final int dimensions;
    private final BigInteger modulus;

    public HashingEmbedder(int dimensions) {
        if (dimensions <= 0) {
            throw new ConfigurationException("Embedding dimensions must be positive, got: " + dimensions);
        }
        this.dimensions = dimensions;
        this.modulus = BigInteger.valueOf(dimensions);
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimensions];
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            vector[bucket(matcher.group())] += 1.0f;
        }
        return l2Normalize(vector);
    }

    int bucket(String token) {
        byte[] digest = DigestUtils.md5Digest(token.getBytes(StandardCharsets.UTF_8));
        return new BigInteger(1, digest).mod(modulus).intValue();
    }

    private static float[] l2Normalize(float[] vector) {
        double sumOfSquares = 0.0;
        for (float v : vector) {
            sumOfSquares += v * v;
        }
        if (sumOfSquares == 0.0) {
            return vector;
        }
        float norm = (float) Math.sqrt(sumOfSquares);
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
        return vector;
    }
}
