package com.openforge.recall.repository;

import com.openforge.recall.domain.MemoryEntry;
import com.openforge.recall.domain.MemoryLane;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface MemoryEntryRepository extends JpaRepository<MemoryEntry, Long> {

    Optional<MemoryEntry> findByProfileIdAndCanonicalKey(String profileId, String canonicalKey);

    List<MemoryEntry> findByParentFactId(Long parentFactId);

    /** Entries in one lane whose keyword set shares at least one of the given terms. */
    @Query("""
            select e from MemoryEntry e
            where e.profileId = :profileId and e.lane = :lane
              and e.id in (select x.id from MemoryEntry x join x.keywords k where k in :terms)
            order by e.importance desc, e.id asc
            """)
    List<MemoryEntry> findByKeywordOverlap(@Param("profileId") String profileId,
                                           @Param("lane") MemoryLane lane,
                                           @Param("terms") Collection<String> terms,
                                           Pageable page);

    /** Case-insensitive substring match on content, one term at a time. */
    @Query("""
            select e from MemoryEntry e
            where e.profileId = :profileId and e.lane = :lane
              and lower(e.content) like lower(concat('%', :term, '%'))
            order by e.importance desc, e.id asc
            """)
    List<MemoryEntry> findByContentTerm(@Param("profileId") String profileId,
                                        @Param("lane") MemoryLane lane,
                                        @Param("term") String term,
                                        Pageable page);

    /** Sub-store scan: every entry ingested from one source (podcast, document, training). */
    @Query("""
            select e from MemoryEntry e
            where e.profileId = :profileId and e.source = :source
            order by e.importance desc, e.id asc
            """)
    List<MemoryEntry> findBySource(@Param("profileId") String profileId,
                                   @Param("source") String source,
                                   Pageable page);

    /** Local cosine fallback when Milvus is not connected. */
    @Query("""
            select e from MemoryEntry e
            where e.profileId = :profileId and e.lane = :lane and e.embedding is not null
            """)
    List<MemoryEntry> findEmbedded(@Param("profileId") String profileId,
                                   @Param("lane") MemoryLane lane);

    /**
     * Single-statement counter bump.  No row lock is taken beyond the UPDATE
     * itself; concurrent bumps may interleave and that is acceptable.
     */
    @Modifying
    @Transactional
    @Query("update MemoryEntry e set e.retrievalCount = e.retrievalCount + 1 where e.id in :ids")
    int incrementRetrievalCount(@Param("ids") Collection<Long> ids);
}
