package com.openforge.recall.retrieval;

import java.util.function.Supplier;

/**
 * Lazily computed, memoized embedding of the query text.
 *
 * Shared by the semantic branches of one turn: the first branch to ask pays
 * for the embedding call, the rest reuse the vector.  A failure is memoized
 * too, so an embedding outage costs one call per turn rather than one per
 * semantic source.
 */
public final class QueryEmbedding {

    private final Supplier<float[]> loader;

    private float[]          vector;
    private RuntimeException failure;
    private boolean          resolved;

    public QueryEmbedding(Supplier<float[]> loader) {
        this.loader = loader;
    }

    public static QueryEmbedding of(float[] vector) {
        return new QueryEmbedding(() -> vector);
    }

    public static QueryEmbedding unavailable(String reason) {
        return new QueryEmbedding(() -> {
            throw new IllegalStateException(reason);
        });
    }

    /** @throws RuntimeException when the embedding could not be computed */
    public synchronized float[] get() {
        if (!resolved) {
            try {
                vector = loader.get();
            } catch (RuntimeException e) {
                failure = e;
            }
            resolved = true;
        }
        if (failure != null) throw failure;
        return vector;
    }
}
