package io.mycelic.core.memory;

import io.mycelic.core.embedding.EmbeddingAdapter;
import io.mycelic.core.embedding.HashingEmbeddingAdapter;
import io.mycelic.core.error.DependencyUnavailableException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hashing embeddings that can be switched off or made to fail mid-call.
 */
public final class StubEmbeddingAdapter implements EmbeddingAdapter {
    private final HashingEmbeddingAdapter delegate = new HashingEmbeddingAdapter(64);
    private final AtomicBoolean available = new AtomicBoolean(true);
    private final AtomicBoolean failing = new AtomicBoolean(false);
    private final AtomicInteger calls = new AtomicInteger();

    public void setAvailable(boolean value) {
        available.set(value);
    }

    public void setFailing(boolean value) {
        failing.set(value);
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public boolean isAvailable() {
        return available.get();
    }

    @Override
    public String model() {
        return delegate.model();
    }

    @Override
    public float[] embed(String text) {
        calls.incrementAndGet();
        if (failing.get()) {
            throw new DependencyUnavailableException("embedding backend timed out");
        }
        return delegate.embed(text);
    }
}
