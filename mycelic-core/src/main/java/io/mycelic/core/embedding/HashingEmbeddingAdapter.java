package io.mycelic.core.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Offline hashed bag-of-words vectors. Texts that share words get a positive cosine; useful
 * without an embedding server and deterministic in tests.
 */
public final class HashingEmbeddingAdapter implements EmbeddingAdapter {
    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "the", "and", "or", "is", "are", "was", "were", "to", "of", "in", "for", "on", "with",
        "at", "by", "from", "it", "this", "that", "these", "those", "be", "been", "being", "as", "if", "but",
        "not", "no", "you", "your", "we", "our", "they", "their", "he", "she", "his", "her"
    );

    private final int dimensions;

    public HashingEmbeddingAdapter() {
        this(256);
    }

    public HashingEmbeddingAdapter(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String model() {
        return "hashing-" + dimensions;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimensions];
        for (String token : tokenize(text)) {
            vector[Math.floorMod(token.hashCode(), dimensions)] += 1.0f;
        }
        return Vectors.normalize(vector);
    }

    static List<String> tokenize(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) {
            return out;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (token.length() > 1 && !STOP_WORDS.contains(token)) {
                out.add(token);
            }
        }
        return out;
    }
}
