package io.mycelic.core.embedding;

import io.mycelic.core.error.DependencyUnavailableException;

public final class UnavailableEmbeddingAdapter implements EmbeddingAdapter {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public String model() {
        return "none";
    }

    @Override
    public float[] embed(String text) {
        throw new DependencyUnavailableException("No embedding adapter is configured");
    }
}
