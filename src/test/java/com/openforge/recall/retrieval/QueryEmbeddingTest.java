package com.openforge.recall.retrieval;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class QueryEmbeddingTest {

    @Test
    void shouldComputeOnceAndReuse() {
        AtomicInteger calls = new AtomicInteger();
        QueryEmbedding embedding = new QueryEmbedding(() -> {
            calls.incrementAndGet();
            return new float[]{0.1f, 0.2f};
        });

        assertEquals(0, calls.get());
        float[] first = embedding.get();
        float[] second = embedding.get();
        assertSame(first, second);
        assertEquals(1, calls.get());
    }

    @Test
    void shouldMemoizeFailures() {
        AtomicInteger calls = new AtomicInteger();
        QueryEmbedding embedding = new QueryEmbedding(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("embedding service down");
        });

        assertThrows(IllegalStateException.class, embedding::get);
        assertThrows(IllegalStateException.class, embedding::get);
        assertEquals(1, calls.get());
    }
}
