package com.openforge.recall.retrieval;

import com.openforge.recall.memory.MemorySnapshot;

import java.util.SortedSet;

/** One memory handed to generation, with the score that earned its place. */
public record ContextEntry(MemorySnapshot memory, double score, SortedSet<String> sources) {

    static ContextEntry from(RankedCandidate rc) {
        return new ContextEntry(rc.memory(), rc.finalScore(), rc.candidate().sources());
    }

    public long id() {
        return memory.id();
    }
}
