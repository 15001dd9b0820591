package com.openforge.recall.retrieval.source;

import com.openforge.recall.domain.MemoryEntry;
import com.openforge.recall.memory.ScoredMemory;
import com.openforge.recall.repository.MemoryEntryRepository;
import com.openforge.recall.retrieval.RetrievalQuery;
import com.openforge.recall.retrieval.RetrievalSource;
import com.openforge.recall.retrieval.SourceKind;
import org.springframework.data.domain.PageRequest;

import java.util.List;

/**
 * Domain sub-store: entries ingested from one origin (podcast transcripts,
 * document excerpts, training examples), matched by keyword coverage.
 *
 * Both lanes are returned; the zone policy decides what survives.
 */
public class SubStoreSource implements RetrievalSource {

    private final String                name;
    private final String                sourceTag;
    private final MemoryEntryRepository repository;
    private final int                   scanLimit;

    public SubStoreSource(String name, String sourceTag, MemoryEntryRepository repository, int scanLimit) {
        this.name       = name;
        this.sourceTag  = sourceTag;
        this.repository = repository;
        this.scanLimit  = scanLimit;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.LEXICAL;
    }

    @Override
    public List<ScoredMemory> retrieve(RetrievalQuery query) {
        if (query.keywords().isEmpty() || query.perSourceLimit() <= 0) return List.of();
        List<MemoryEntry> scanned = repository.findBySource(query.profileId(), sourceTag, PageRequest.of(0, scanLimit));
        return LexicalLaneSource.rankByCoverage(scanned, query.keywords(), query.perSourceLimit());
    }
}
