package com.openforge.recall.retrieval;

import com.openforge.recall.domain.KnowledgeGap;
import com.openforge.recall.domain.MemoryType;
import com.openforge.recall.memory.MemorySnapshot;
import com.openforge.recall.persona.PersonaState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

import static com.openforge.recall.retrieval.Memories.*;
import static org.junit.jupiter.api.Assertions.*;

class KnowledgeGapDetectorTest {

    private final KnowledgeGapDetector detector = new KnowledgeGapDetector(RetrievalProperties.Gap.defaults());

    private static ContextEntry entry(MemorySnapshot m) {
        return new ContextEntry(m, 1.0, new TreeSet<>(List.of("lexical-canon")));
    }

    private static RetrievalQuery tellAbout(String... keywords) {
        return query("tell me about it", List.of(keywords), QueryIntent.TELL_ABOUT, null,
                PersonaState.calm(), ZoneState.NORMAL);
    }

    @Test
    void shouldReportHighPriorityWhenNoCanonCoversTheQuery() {
        Optional<GapReport> gap = detector.detect(tellAbout("grandma", "bowling"), List.of());

        assertTrue(gap.isPresent());
        assertEquals(KnowledgeGap.Priority.HIGH, gap.get().priority());
        assertEquals("tell_about", gap.get().category());
        assertEquals(List.of("grandma", "bowling"), gap.get().missingTopics());
    }

    @Test
    void shouldNotCountRumorsOrWeakCanon() {
        List<ContextEntry> entries = List.of(
                entry(rumor(1, MemoryType.STORY, 90, "grandma bowling story")),
                entry(canon(2, MemoryType.FACT, 30, "grandma went bowling")));

        assertEquals(KnowledgeGap.Priority.HIGH,
                detector.detect(tellAbout("grandma", "bowling"), entries).orElseThrow().priority());
    }

    @Test
    void shouldReportMediumWhenMostTopicsAreMissing() {
        List<ContextEntry> entries = List.of(entry(canon(1, MemoryType.FACT, 90, "grandma cooked")));

        GapReport gap = detector.detect(tellAbout("grandma", "bowling", "league"), entries).orElseThrow();

        assertEquals(KnowledgeGap.Priority.MEDIUM, gap.priority());
        assertEquals(List.of("bowling", "league"), gap.missingTopics());
        assertEquals(1, gap.coveringEntries());
    }

    @Test
    void shouldReportLowWhenFewEntriesCoverMostTopics() {
        List<ContextEntry> entries = List.of(entry(canon(1, MemoryType.FACT, 90, "grandma loved her bowling")));

        GapReport gap = detector.detect(tellAbout("grandma", "bowling", "league"), entries).orElseThrow();

        assertEquals(KnowledgeGap.Priority.LOW, gap.priority());
        assertEquals(List.of("league"), gap.missingTopics());
    }

    @Test
    void shouldReportNoGapWhenEverythingIsCovered() {
        List<ContextEntry> entries = List.of(entry(canon(1, MemoryType.FACT, 90, "bowling", "grandma")));
        assertTrue(detector.detect(tellAbout("grandma", "bowling"), entries).isEmpty());
    }

    @Test
    void shouldNotTreatShortKeywordsAsTopics() {
        assertTrue(detector.detect(tellAbout("pie", "dbd", "42"), List.of()).isEmpty());
    }

    @Test
    void shouldConvertToEntity() {
        GapReport gap = new GapReport("opinion", KnowledgeGap.Priority.LOW, List.of("killer", "patch"), 2);
        KnowledgeGap entity = gap.toEntity("profile-9", "thoughts on the patch?");
        assertEquals("profile-9", entity.getProfileId());
        assertEquals("killer,patch", entity.getMissingTopics());
        assertEquals("opinion", entity.getCategory());
    }
}
