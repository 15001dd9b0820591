package com.openforge.recall.memory;

/**
 * A memory paired with the raw score its index produced
 * (cosine similarity for semantic indexes, term coverage for lexical ones).
 */
public record ScoredMemory(MemorySnapshot memory, double score) {}
