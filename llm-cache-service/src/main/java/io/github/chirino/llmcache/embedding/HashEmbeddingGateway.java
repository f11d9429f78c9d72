package io.github.chirino.llmcache.embedding;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic feature-hashing embedding. Texts sharing tokens land close together, which is
 * enough for offline development and tests without a provider.
 */
public class HashEmbeddingGateway implements EmbeddingGateway {

    private final int dimension;

    public HashEmbeddingGateway(int dimension) {
        this.dimension = Math.max(8, dimension);
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts == null) {
            throw new IllegalArgumentException("texts must not be null");
        }
        return texts.stream().map(this::hashEmbedding).toList();
    }

    @Override
    public int dimensions() {
        return dimension;
    }

    @Override
    public String modelId() {
        return "hash/" + dimension;
    }

    private float[] hashEmbedding(String text) {
        float[] vector = new float[dimension];
        if (text == null) {
            return vector;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.isBlank()) {
                continue;
            }
            int hash = stableHash(token);
            int index = Math.floorMod(hash, dimension);
            float sign = (hash & 1) == 0 ? 1.0f : -1.0f;
            vector[index] += sign;
        }
        normalize(vector);
        return vector;
    }

    // FNV-1a
    private static int stableHash(String token) {
        int hash = 0x811C9DC5;
        for (byte b : token.getBytes(StandardCharsets.UTF_8)) {
            hash ^= b & 0xff;
            hash *= 0x01000193;
        }
        return hash;
    }

    private static void normalize(float[] vector) {
        double sum = 0.0;
        for (float v : vector) {
            sum += v * v;
        }
        if (sum <= 0.0) {
            return;
        }
        float norm = (float) Math.sqrt(sum);
        for (int i = 0; i < vector.length; i++) {
            vector[i] = vector[i] / norm;
        }
    }
}
