package com.openforge.recall.retrieval;

import com.openforge.recall.domain.MemoryType;
import com.openforge.recall.memory.MemoryWriteBehind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Final stage: turns the admitted ranking into the context handed to
 * generation.
 *
 *   1. dedup by canonicalKey, best-ranked copy wins
 *   2. top-K: the best entry of each type first, then fill by rank
 *   3. character budget, greedy in rank order; an entry that does not fit
 *      is skipped and smaller ones below it may still go in
 *   4. trace, then an asynchronous retrievalCount bump for what was returned
 */
@Slf4j
@Component
public class ContextAssembler {

    private final int               maxEntries;
    private final int               maxCharacters;
    private final boolean           distinctTypes;
    private final MemoryWriteBehind writeBehind;

    public ContextAssembler(RetrievalProperties props, MemoryWriteBehind writeBehind) {
        this.maxEntries    = Math.max(0, props.maxEntries());
        this.maxCharacters = Math.max(0, props.maxCharacters());
        this.distinctTypes = props.enforceDistinctTypes();
        this.writeBehind   = writeBehind;
    }

    public RetrievedContext assemble(RetrievalQuery query,
                                     TheaterZonePolicy.Admission admission,
                                     SearchResult search,
                                     int candidatesConsidered,
                                     long startedNanos) {
        List<RankedCandidate> unique   = dedupByCanonicalKey(admission.admitted());
        List<RankedCandidate> topK     = selectTopK(unique);
        List<RankedCandidate> selected = new ArrayList<>(topK.size());
        int used = 0;
        for (RankedCandidate rc : topK) {
            int length = rc.memory().content().length();
            if (used + length > maxCharacters) {
                log.debug("[Retrieval] #{} skipped: {} chars would exceed budget ({}/{})",
                        rc.id(), length, used, maxCharacters);
                continue;
            }
            selected.add(rc);
            used += length;
        }

        List<ContextEntry>         entries = new ArrayList<>(selected.size());
        List<RetrievalTrace.Entry> traced  = new ArrayList<>(selected.size());
        int rumors = 0;
        for (RankedCandidate rc : selected) {
            entries.add(ContextEntry.from(rc));
            traced.add(RetrievalTrace.Entry.from(rc));
            if (!rc.memory().isCanon()) rumors++;
        }

        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        RetrievalTrace trace = new RetrievalTrace(query.message(), Instant.now(), search.retrievalMethod(),
                elapsed, admission.zone(), query.intent().label(), query.keywords(), candidatesConsidered,
                rumors, admission.rejected(), used, traced, search.outcomes());

        if (!entries.isEmpty()) {
            writeBehind.recordRetrievals(entries.stream().map(ContextEntry::id).toList());
        }
        return new RetrievedContext(entries, trace, null);
    }

    static List<RankedCandidate> dedupByCanonicalKey(List<RankedCandidate> admitted) {
        List<RankedCandidate> sorted = new ArrayList<>(admitted);
        sorted.sort(RankedCandidate.BY_RANK);
        Set<String> seen = new HashSet<>();
        List<RankedCandidate> out = new ArrayList<>(sorted.size());
        for (RankedCandidate rc : sorted) {
            if (seen.add(rc.memory().canonicalKey())) out.add(rc);
        }
        return out;
    }

    /** Input must be rank-sorted; output is rank-sorted. */
    List<RankedCandidate> selectTopK(List<RankedCandidate> ranked) {
        if (maxEntries == 0 || ranked.isEmpty()) return List.of();
        if (!distinctTypes) return List.copyOf(ranked.subList(0, Math.min(maxEntries, ranked.size())));

        Set<RankedCandidate> picked = new LinkedHashSet<>();
        Set<MemoryType> seenTypes = EnumSet.noneOf(MemoryType.class);
        for (RankedCandidate rc : ranked) {
            if (picked.size() == maxEntries) break;
            if (seenTypes.add(rc.memory().type())) picked.add(rc);
        }
        for (RankedCandidate rc : ranked) {
            if (picked.size() == maxEntries) break;
            picked.add(rc);
        }
        List<RankedCandidate> out = new ArrayList<>(picked);
        out.sort(RankedCandidate.BY_RANK);
        return out;
    }
}
