package com.openforge.recall.retrieval;

import com.openforge.recall.memory.MemorySnapshot;

import java.util.SortedSet;

/**
 * One distinct memory after merging hits from every source.
 *
 * @param semanticSimilarity best cosine similarity any SEMANTIC source reported, 0 for lexical-only hits
 * @param lexicalScore       best keyword coverage any LEXICAL source reported
 * @param sources            names of the sources that returned this memory
 */
public record Candidate(MemorySnapshot memory,
                        double semanticSimilarity,
                        double lexicalScore,
                        SortedSet<String> sources) {

    public long id() {
        return memory.id();
    }
}
