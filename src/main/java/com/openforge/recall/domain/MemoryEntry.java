package com.openforge.recall.domain;

import jakarta.persistence.*;
import lombok.*;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A unit of retrievable persona knowledge.
 *
 * Key design notes:
 *
 *  canonicalKey: normalized-content identity, unique per profile.  Ingestion
 *   goes through MemoryStoreService which upserts on this key,
 *   so the same fact never re-enters the store twice.
 *
 *  lane: CANON or RUMOR.  ATOMIC children of a STORY take the lane
 *   of their parent (enforced by MemoryStoreService).
 *
 *  embedding: optional vector, mirrored into Milvus.  Kept here too so
 *   the semantic index can fall back to a local cosine scan.
 *
 *  retrievalCount: bumped asynchronously after each turn that returns the
 *   entry.  Lost updates are acceptable.
 *
 *  successRate / qualityScore: tracked for curation tooling; the ranking
 *   pipeline does not read them.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "memory_entries",
    uniqueConstraints = @UniqueConstraint(name = "uq_profile_canonical_key",
            columnNames = {"profile_id", "canonical_key"}),
    indexes = {
        @Index(name = "idx_memory_profile_lane", columnList = "profile_id, lane"),
        @Index(name = "idx_memory_profile_source", columnList = "profile_id, source")
    }
)
public class MemoryEntry extends MutableEntity {

    @Column(name = "profile_id", nullable = false, length = 64)
    private String profileId;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    @Enumerated(EnumType.STRING)
    @Column(name = "memory_type", nullable = false, length = 16)
    private MemoryType type;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "lane", nullable = false, length = 16)
    private MemoryLane lane = MemoryLane.CANON;

    /** 0 – 100. */
    @Builder.Default
    @Column(name = "importance", nullable = false)
    private int importance = 50;

    /** 0 – 100. */
    @Builder.Default
    @Column(name = "confidence", nullable = false)
    private int confidence = 50;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "memory_keywords", joinColumns = @JoinColumn(name = "memory_id"))
    @Column(name = "keyword", length = 128)
    private Set<String> keywords = new LinkedHashSet<>();

    @Convert(converter = EmbeddingConverter.class)
    @Column(name = "embedding", columnDefinition = "LONGTEXT")
    private float[] embedding;

    @Column(name = "canonical_key", nullable = false, length = 128)
    private String canonicalKey;

    @Builder.Default
    @Column(name = "retrieval_count", nullable = false)
    private int retrievalCount = 0;

    /** manual | podcast | document | training | discord | ... */
    @Column(name = "source", length = 32)
    private String source;

    @Column(name = "source_id", length = 128)
    private String sourceId;

    /** Conversation in which this memory was learned, if any. */
    @Column(name = "conversation_id", length = 64)
    private String conversationId;

    /** ATOMIC facts point back at the STORY they were decomposed from. */
    @Column(name = "parent_fact_id")
    private Long parentFactId;

    @Column(name = "success_rate")
    private Double successRate;

    @Column(name = "quality_score")
    private Integer qualityScore;
}
