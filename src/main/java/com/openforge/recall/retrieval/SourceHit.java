package com.openforge.recall.retrieval;

import com.openforge.recall.memory.MemorySnapshot;

/**
 * A single hit tagged with the source that produced it.
 *
 * @param rawScore cosine similarity for SEMANTIC sources, keyword coverage for LEXICAL ones
 */
public record SourceHit(MemorySnapshot memory, double rawScore, String source, SourceKind kind) {}
