package com.openforge.recall.retrieval;

import com.openforge.recall.domain.MemoryType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.openforge.recall.retrieval.Memories.*;
import static org.junit.jupiter.api.Assertions.*;

class DiversityScorerTest {

    private static final double EPS = 1e-9;

    private final DiversityScorer diversity = new DiversityScorer(RetrievalProperties.Weights.defaults());

    @Test
    void shouldPenaliseSameTypeAndKeywordOverlap() {
        RankedCandidate a = ranked(canon(1, MemoryType.FACT, 90, "likes pepperoni pizza", "pizza"), 10.0);
        RankedCandidate b = ranked(canon(2, MemoryType.FACT, 90, "pizza every friday", "pizza"), 9.9);
        RankedCandidate c = ranked(canon(3, MemoryType.LORE, 90, "bowling league champion", "bowling"), 9.5);

        List<RankedCandidate> out = diversity.diversify(List.of(a, b, c));

        assertEquals(List.of(1L, 3L, 2L), out.stream().map(RankedCandidate::id).toList());
        assertEquals(1.0, out.get(0).score().diversityFactor(), EPS);
        assertEquals(1.0, out.get(1).score().diversityFactor(), EPS);
        assertEquals(0.7, out.get(2).score().diversityFactor(), EPS);
        assertEquals(9.9 * 0.7, out.get(2).finalScore(), EPS);
    }

    @Test
    void shouldAccumulatePenaltiesAndFloorAtZero() {
        RankedCandidate[] many = new RankedCandidate[6];
        for (int i = 0; i < many.length; i++) {
            many[i] = ranked(canon(i + 1, MemoryType.FACT, 90, "pizza fact " + i, "pizza"), 10.0 - i);
        }
        List<RankedCandidate> out = diversity.diversify(List.of(many));

        RankedCandidate last = out.stream().filter(r -> r.id() == 6L).findFirst().orElseThrow();
        // five earlier FACTs sharing a keyword: 5 * (0.1 + 0.2) > 1
        assertEquals(0.0, last.score().diversityFactor(), EPS);
        assertEquals(0.0, last.finalScore(), EPS);
    }

    @Test
    void shouldReturnEmptyForEmptyInput() {
        assertTrue(diversity.diversify(List.of()).isEmpty());
    }
}
