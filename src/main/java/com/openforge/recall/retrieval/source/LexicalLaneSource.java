package com.openforge.recall.retrieval.source;

import com.openforge.recall.domain.MemoryEntry;
import com.openforge.recall.domain.MemoryLane;
import com.openforge.recall.memory.MemorySnapshot;
import com.openforge.recall.memory.ScoredMemory;
import com.openforge.recall.repository.MemoryEntryRepository;
import com.openforge.recall.retrieval.KeywordMatcher;
import com.openforge.recall.retrieval.RetrievalQuery;
import com.openforge.recall.retrieval.RetrievalSource;
import com.openforge.recall.retrieval.SourceKind;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword search over one lane.
 *
 * Candidates are entries whose keyword set overlaps the query, plus entries
 * whose content contains one of the leading query terms.  Each is scored by
 * keyword coverage (matched / total query keywords).
 */
public class LexicalLaneSource implements RetrievalSource {

    /** Only the leading terms get a content LIKE scan; the rest rely on the keyword join. */
    static final int CONTENT_SCAN_TERMS = 3;

    private final String                name;
    private final MemoryLane            lane;
    private final MemoryEntryRepository repository;

    public LexicalLaneSource(String name, MemoryLane lane, MemoryEntryRepository repository) {
        this.name       = name;
        this.lane       = lane;
        this.repository = repository;
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
    public boolean appliesTo(RetrievalQuery query) {
        return lane == MemoryLane.CANON || query.theater();
    }

    @Override
    public List<ScoredMemory> retrieve(RetrievalQuery query) throws InterruptedException {
        List<String> terms = query.keywords();
        if (terms.isEmpty() || query.perSourceLimit() <= 0) return List.of();

        Pageable page = PageRequest.of(0, query.perSourceLimit() * 2);
        Map<Long, MemoryEntry> found = new LinkedHashMap<>();
        for (MemoryEntry e : repository.findByKeywordOverlap(query.profileId(), lane, terms, page)) {
            found.putIfAbsent(e.getId(), e);
        }
        for (String term : terms.subList(0, Math.min(CONTENT_SCAN_TERMS, terms.size()))) {
            if (Thread.interrupted()) throw new InterruptedException("lexical search cancelled");
            for (MemoryEntry e : repository.findByContentTerm(query.profileId(), lane, term, page)) {
                found.putIfAbsent(e.getId(), e);
            }
        }
        return rankByCoverage(found.values(), terms, query.perSourceLimit());
    }

    static List<ScoredMemory> rankByCoverage(Iterable<MemoryEntry> entries, List<String> terms, int limit) {
        List<ScoredMemory> hits = new ArrayList<>();
        for (MemoryEntry e : entries) {
            MemorySnapshot m = MemorySnapshot.of(e);
            double coverage = KeywordMatcher.coverage(m, terms);
            if (coverage > 0) hits.add(new ScoredMemory(m, coverage));
        }
        hits.sort(Comparator.comparingDouble(ScoredMemory::score).reversed()
                            .thenComparingLong(h -> h.memory().id()));
        return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : hits;
    }
}
