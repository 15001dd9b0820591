package com.openforge.recall.retrieval;

import com.openforge.recall.domain.MemoryLane;
import com.openforge.recall.domain.MemoryType;

import java.time.Instant;
import java.util.List;
import java.util.SortedSet;

/**
 * Explains one retrieval turn: what was asked, which sources answered, and
 * how every returned entry was scored.  Published to the memory debug panel.
 */
public record RetrievalTrace(
        String              query,
        Instant             timestamp,
        String              retrievalMethod,
        long                executionTimeMs,
        ZoneState           zone,
        String              intent,
        List<String>        keywords,
        int                 candidatesConsidered,
        int                 rumorsAdmitted,
        int                 rejected,
        int                 charactersUsed,
        List<Entry>         entries,
        List<SourceOutcome> sources
) {

    public record Entry(long id, MemoryType type, MemoryLane lane, double finalScore,
                        ScoreBreakdown breakdown, SortedSet<String> sources) {

        static Entry from(RankedCandidate rc) {
            return new Entry(rc.id(), rc.memory().type(), rc.memory().lane(), rc.finalScore(),
                    rc.score(), rc.candidate().sources());
        }
    }

    public RetrievalTrace {
        keywords = List.copyOf(keywords);
        entries  = List.copyOf(entries);
        sources  = List.copyOf(sources);
    }

    /** Trace for a turn that never reached the sources (empty query or internal error). */
    public static RetrievalTrace skipped(String query, String method, ZoneState zone, long executionTimeMs) {
        return new RetrievalTrace(query == null ? "" : query, Instant.now(), method, executionTimeMs,
                zone, QueryIntent.GENERAL.label(), List.of(), 0, 0, 0, 0, List.of(), List.of());
    }
}
