package com.openforge.recall.retrieval;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Result of {@link ContextRetrievalService#retrieveContext}.
 *
 * @param entries      context for generation, best first
 * @param trace        how the entries were chosen
 * @param knowledgeGap missing CANON coverage, if any was detected
 */
public record RetrievedContext(List<ContextEntry> entries, RetrievalTrace trace, @Nullable GapReport knowledgeGap) {

    public RetrievedContext {
        entries = List.copyOf(entries);
    }

    public static RetrievedContext empty(RetrievalTrace trace) {
        return new RetrievedContext(List.of(), trace, null);
    }

    public RetrievedContext withKnowledgeGap(GapReport gap) {
        return new RetrievedContext(entries, trace, gap);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
