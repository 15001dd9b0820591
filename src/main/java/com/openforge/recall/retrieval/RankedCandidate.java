package com.openforge.recall.retrieval;

import com.openforge.recall.memory.MemorySnapshot;

import java.util.Comparator;

/** A candidate with its score. */
public record RankedCandidate(Candidate candidate, ScoreBreakdown score) {

    /** Final score descending, then id ascending. */
    public static final Comparator<RankedCandidate> BY_RANK =
            Comparator.comparingDouble((RankedCandidate r) -> r.score().finalScore()).reversed()
                      .thenComparingLong(RankedCandidate::id);

    public MemorySnapshot memory() {
        return candidate.memory();
    }

    public long id() {
        return candidate.id();
    }

    public double finalScore() {
        return score.finalScore();
    }

    public RankedCandidate withDiversityFactor(double factor) {
        return new RankedCandidate(candidate, score.withDiversityFactor(factor));
    }
}
