package com.openforge.recall.retrieval;

import com.openforge.recall.memory.EmbeddingClient;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Embeds query text for the semantic sources.
 *
 *   CircuitBreaker("embedding")
 *     → Retry("embedding")
 *       → EmbeddingClient.embedAsArray()
 *
 * An open circuit fails fast with CallNotPermittedException, so an embedding
 * outage costs the semantic branches nothing and the turn falls back to
 * keyword search.
 */
@Slf4j
@Component
public class QueryEmbedder {

    private final EmbeddingClient embeddingClient;
    private final CircuitBreaker  circuitBreaker;
    private final Retry           retry;

    public QueryEmbedder(EmbeddingClient embeddingClient,
                         @Qualifier("embeddingCircuitBreaker") CircuitBreaker circuitBreaker,
                         @Qualifier("embeddingRetry") Retry retry) {
        this.embeddingClient = embeddingClient;
        this.circuitBreaker  = circuitBreaker;
        this.retry           = retry;
    }

    public float[] embed(String text) {
        Supplier<float[]> call = () -> embeddingClient.embedAsArray(text);
        Supplier<float[]> decorated =
                CircuitBreaker.decorateSupplier(circuitBreaker,
                        Retry.decorateSupplier(retry, call));
        return decorated.get();
    }

    /** A memoized embedding of {@code text} for one turn; nothing is computed until a branch asks. */
    public QueryEmbedding lazily(String text) {
        return new QueryEmbedding(() -> {
            long start = System.currentTimeMillis();
            float[] vector = embed(text);
            log.debug("[Embed] Query embedded in {} ms ({} dims)", System.currentTimeMillis() - start, vector.length);
            return vector;
        });
    }
}
