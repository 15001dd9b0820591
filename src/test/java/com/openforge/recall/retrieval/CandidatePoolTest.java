package com.openforge.recall.retrieval;

import com.openforge.recall.domain.MemoryType;
import com.openforge.recall.memory.MemorySnapshot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.openforge.recall.retrieval.Memories.*;
import static org.junit.jupiter.api.Assertions.*;

class CandidatePoolTest {

    private final MemorySnapshot pizza  = canon(2, MemoryType.FACT, 90, "likes pizza", "pizza");
    private final MemorySnapshot newark = canon(1, MemoryType.LORE, 80, "from newark", "newark");

    @Test
    void shouldMergeHitsForTheSameMemory() {
        CandidatePool pool = CandidatePool.merge(List.of(
                new SourceHit(pizza, 0.62, "semantic-canon", SourceKind.SEMANTIC),
                new SourceHit(pizza, 0.50, "lexical-canon", SourceKind.LEXICAL),
                new SourceHit(pizza, 0.80, "podcast", SourceKind.LEXICAL),
                new SourceHit(newark, 0.33, "lexical-canon", SourceKind.LEXICAL)));

        assertEquals(2, pool.size());
        Candidate first = pool.candidates().get(0);
        Candidate second = pool.candidates().get(1);
        assertEquals(1L, first.id());
        assertEquals(0.0, first.semanticSimilarity());
        assertEquals(2L, second.id());
        assertEquals(0.62, second.semanticSimilarity(), 1e-9);
        assertEquals(0.80, second.lexicalScore(), 1e-9);
        assertEquals(List.of("lexical-canon", "podcast", "semantic-canon"), List.copyOf(second.sources()));
    }

    @Test
    void shouldMergeIndependentlyOfArrivalOrder() {
        List<SourceHit> hits = new ArrayList<>(List.of(
                new SourceHit(pizza, 0.62, "semantic-canon", SourceKind.SEMANTIC),
                new SourceHit(pizza, 0.50, "lexical-canon", SourceKind.LEXICAL),
                new SourceHit(newark, 0.91, "semantic-canon", SourceKind.SEMANTIC),
                new SourceHit(newark, 0.33, "document", SourceKind.LEXICAL)));
        List<Candidate> expected = CandidatePool.merge(hits).candidates();

        Random random = new Random(42);
        for (int i = 0; i < 20; i++) {
            Collections.shuffle(hits, random);
            assertEquals(expected, CandidatePool.merge(hits).candidates());
        }
    }

    @Test
    void shouldGiveEmptyPoolForEmptyHits() {
        assertTrue(CandidatePool.merge(List.of()).isEmpty());
    }
}
