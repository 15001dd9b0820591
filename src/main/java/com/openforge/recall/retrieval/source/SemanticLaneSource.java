package com.openforge.recall.retrieval.source;

import com.openforge.recall.domain.MemoryLane;
import com.openforge.recall.memory.ScoredMemory;
import com.openforge.recall.memory.SemanticMemoryIndex;
import com.openforge.recall.retrieval.RetrievalQuery;
import com.openforge.recall.retrieval.RetrievalSource;
import com.openforge.recall.retrieval.SourceKind;

import java.util.List;

/**
 * Vector similarity over one lane.  RUMOR lanes only run in THEATER.
 *
 * The query embedding is computed on first use and shared with the other
 * semantic branch; if it cannot be computed this source fails and the turn
 * degrades to keyword search.
 */
public class SemanticLaneSource implements RetrievalSource {

    private final String              name;
    private final MemoryLane          lane;
    private final SemanticMemoryIndex index;
    private final double              minSimilarity;

    public SemanticLaneSource(String name, MemoryLane lane, SemanticMemoryIndex index, double minSimilarity) {
        this.name          = name;
        this.lane          = lane;
        this.index         = index;
        this.minSimilarity = minSimilarity;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.SEMANTIC;
    }

    @Override
    public boolean appliesTo(RetrievalQuery query) {
        return lane == MemoryLane.CANON || query.theater();
    }

    @Override
    public List<ScoredMemory> retrieve(RetrievalQuery query) {
        float[] vector = query.embedding().get();
        return index.similaritySearch(vector, query.perSourceLimit(), query.profileId(), lane, minSimilarity);
    }
}
