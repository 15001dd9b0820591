package com.openforge.recall.memory;

import com.openforge.recall.domain.MemoryEntry;
import com.openforge.recall.domain.MemoryLane;
import com.openforge.recall.domain.MemoryType;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MemorySnapshotTest {

    private static MemoryEntry entry(int importance, int confidence) {
        MemoryEntry e = MemoryEntry.builder()
                .profileId("p1")
                .content("Hates the new patch")
                .type(MemoryType.PREFERENCE)
                .importance(importance)
                .confidence(confidence)
                .keywords(new LinkedHashSet<>(List.of("Patch", " KILLER ", "")))
                .build();
        e.setId(12L);
        return e;
    }

    @Test
    void shouldClampOutOfRangeNumbers() {
        MemorySnapshot high = MemorySnapshot.of(entry(250, 140));
        assertEquals(100, high.importance());
        assertEquals(100, high.confidence());

        MemorySnapshot low = MemorySnapshot.of(entry(-5, -1));
        assertEquals(0, low.importance());
        assertEquals(0, low.confidence());
    }

    @Test
    void shouldLowercaseKeywordsAndFillDefaults() {
        MemoryEntry e = entry(60, 70);
        e.setLane(null);
        MemorySnapshot s = MemorySnapshot.of(e);

        assertEquals(Set.of("patch", "killer"), s.keywords());
        assertEquals(MemoryLane.CANON, s.lane());
        assertEquals(CanonicalKeys.of("Hates the new patch"), s.canonicalKey());
        assertTrue(s.isCanon());
        assertFalse(s.hasEmbedding());
    }

    @Test
    void shouldExposeImmutableKeywords() {
        MemorySnapshot s = MemorySnapshot.of(entry(60, 70));
        assertThrows(UnsupportedOperationException.class, () -> s.keywords().add("extra"));
    }
}
