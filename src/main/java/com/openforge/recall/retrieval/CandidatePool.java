package com.openforge.recall.retrieval;

import com.openforge.recall.memory.MemorySnapshot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Deduplicated union of all source hits, keyed by memory id.
 *
 * The merge is order-independent: the same hits in any arrival order give
 * the same pool.  Scores keep the maximum per kind, the source set is a
 * union, and when two sources hand back different snapshots of the same row
 * the one from the alphabetically first source wins.
 */
public final class CandidatePool {

    private final List<Candidate> candidates;

    private CandidatePool(List<Candidate> candidates) {
        this.candidates = candidates;
    }

    private static final class Acc {
        MemorySnapshot  memory;
        String          memorySource;
        double          semantic;
        double          lexical;
        TreeSet<String> sources = new TreeSet<>();
    }

    public static CandidatePool merge(Collection<SourceHit> hits) {
        Map<Long, Acc> byId = new TreeMap<>();
        for (SourceHit hit : hits) {
            Acc acc = byId.computeIfAbsent(hit.memory().id(), id -> new Acc());
            if (acc.memory == null || hit.source().compareTo(acc.memorySource) < 0) {
                acc.memory       = hit.memory();
                acc.memorySource = hit.source();
            }
            double score = Math.max(0.0, hit.rawScore());
            if (hit.kind() == SourceKind.SEMANTIC) acc.semantic = Math.max(acc.semantic, score);
            else                                   acc.lexical  = Math.max(acc.lexical, score);
            acc.sources.add(hit.source());
        }

        List<Candidate> out = new ArrayList<>(byId.size());
        for (Acc acc : byId.values()) {
            out.add(new Candidate(acc.memory, Math.min(1.0, acc.semantic), acc.lexical,
                    Collections.unmodifiableSortedSet(acc.sources)));
        }
        return new CandidatePool(List.copyOf(out));
    }

    /** Candidates in ascending id order. */
    public List<Candidate> candidates() {
        return candidates;
    }

    public int size() {
        return candidates.size();
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }
}
