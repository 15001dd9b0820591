package com.openforge.recall.retrieval;

import com.openforge.recall.memory.ScoredMemory;

import java.util.List;

/**
 * One independent branch of the hybrid search.
 *
 * Implementations run on the retrieval executor, concurrently with the other
 * sources, and must return a fresh list they own.  They should honour thread
 * interruption: a branch that overruns its timeout is cancelled.
 */
public interface RetrievalSource {

    /** Stable name, used in traces and as the circuit breaker name. */
    String name();

    SourceKind kind();

    /** Whether this source takes part in the given turn (rumor sources only run in THEATER). */
    default boolean appliesTo(RetrievalQuery query) {
        return true;
    }

    /**
     * @return up to {@code query.perSourceLimit()} hits with a source-local raw score
     * @throws Exception on any backend failure; the engine records it and moves on
     */
    List<ScoredMemory> retrieve(RetrievalQuery query) throws Exception;
}
