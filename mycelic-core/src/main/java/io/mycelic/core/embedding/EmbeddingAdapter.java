package io.mycelic.core.embedding;

/**
 * Turns text into a fixed-length vector. Implementations must be safe to call from several
 * threads and must never be called while a database transaction is open.
 */
public interface EmbeddingAdapter {

    boolean isAvailable();

    String model();

    /**
     * @throws io.mycelic.core.error.DependencyUnavailableException when the backend cannot be reached
     */
    float[] embed(String text);
}
