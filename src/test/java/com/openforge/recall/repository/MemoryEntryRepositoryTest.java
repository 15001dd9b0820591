package com.openforge.recall.repository;

import com.openforge.recall.config.JpaConfig;
import com.openforge.recall.domain.MemoryEntry;
import com.openforge.recall.domain.MemoryLane;
import com.openforge.recall.domain.MemoryType;
import com.openforge.recall.memory.CanonicalKeys;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(JpaConfig.class)
class MemoryEntryRepositoryTest {

    @Autowired private MemoryEntryRepository repository;
    @Autowired private TestEntityManager     em;

    private MemoryEntry persist(String profile, MemoryLane lane, int importance, String content,
                                String source, String... keywords) {
        return em.persistAndFlush(MemoryEntry.builder()
                .profileId(profile)
                .content(content)
                .type(MemoryType.FACT)
                .lane(lane)
                .importance(importance)
                .keywords(new LinkedHashSet<>(List.of(keywords)))
                .canonicalKey(CanonicalKeys.of(content))
                .source(source)
                .build());
    }

    private static List<Long> ids(List<MemoryEntry> entries) {
        return entries.stream().map(MemoryEntry::getId).toList();
    }

    @Test
    void shouldScopeKeywordOverlapToProfileAndLaneOrderedByImportance() {
        MemoryEntry low  = persist("p1", MemoryLane.CANON, 30, "Mains the Nurse", null, "nurse", "killer");
        MemoryEntry high = persist("p1", MemoryLane.CANON, 90, "Hates the new patch", null, "patch", "killer");
        persist("p1", MemoryLane.RUMOR, 99, "Secretly loves the patch", null, "patch");
        persist("p2", MemoryLane.CANON, 99, "Other profile patch", null, "patch");
        persist("p1", MemoryLane.CANON, 99, "Grandma pizza", null, "pizza");

        List<MemoryEntry> found = repository.findByKeywordOverlap(
                "p1", MemoryLane.CANON, List.of("killer", "patch"), PageRequest.of(0, 10));

        assertEquals(List.of(high.getId(), low.getId()), ids(found));
    }

    @Test
    void shouldMatchContentTermsCaseInsensitively() {
        MemoryEntry hit = persist("p1", MemoryLane.CANON, 50, "Grew up in NEWARK with grandma", null);
        persist("p1", MemoryLane.CANON, 50, "Plays killer every night", null);

        List<MemoryEntry> found = repository.findByContentTerm(
                "p1", MemoryLane.CANON, "newark", PageRequest.of(0, 10));

        assertEquals(List.of(hit.getId()), ids(found));
    }

    @Test
    void shouldFindOnlyEntriesOfTheGivenSource() {
        MemoryEntry episode = persist("p1", MemoryLane.CANON, 50, "Episode 12 talked about pizza", "podcast", "pizza");
        persist("p1", MemoryLane.CANON, 50, "Doc about pizza", "document", "pizza");

        assertEquals(List.of(episode.getId()),
                ids(repository.findBySource("p1", "podcast", PageRequest.of(0, 10))));
    }

    @Test
    void shouldSkipRowsWithoutVectorsWhenFindingEmbedded() {
        MemoryEntry withVector = persist("p1", MemoryLane.CANON, 50, "Has a vector", null);
        withVector.setEmbedding(new float[]{0.1f, 0.2f});
        em.persistAndFlush(withVector);
        persist("p1", MemoryLane.CANON, 50, "No vector", null);
        em.clear();

        List<MemoryEntry> found = repository.findEmbedded("p1", MemoryLane.CANON);

        assertEquals(List.of(withVector.getId()), ids(found));
        assertArrayEquals(new float[]{0.1f, 0.2f}, found.get(0).getEmbedding());
    }

    @Test
    void shouldBumpRetrievalCountOfEachId() {
        MemoryEntry a = persist("p1", MemoryLane.CANON, 50, "First", null);
        MemoryEntry b = persist("p1", MemoryLane.CANON, 50, "Second", null);

        assertEquals(2, repository.incrementRetrievalCount(Set.of(a.getId(), b.getId())));
        repository.incrementRetrievalCount(Set.of(a.getId()));
        em.clear();

        assertEquals(2, em.find(MemoryEntry.class, a.getId()).getRetrievalCount());
        assertEquals(1, em.find(MemoryEntry.class, b.getId()).getRetrievalCount());
    }

    @Test
    void shouldPopulateAuditColumns() {
        MemoryEntry e = persist("p1", MemoryLane.CANON, 50, "Audited", null);
        assertNotNull(e.getCreateTime());
        assertNotNull(e.getUpdateTime());
    }
}
