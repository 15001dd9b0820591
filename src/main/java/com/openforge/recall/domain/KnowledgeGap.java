package com.openforge.recall.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * A retrieval turn that found no adequate CANON coverage.
 * Rows are reviewed by curation tooling; the retrieval pipeline only appends.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "knowledge_gaps")
public class KnowledgeGap extends BaseEntity {

    public enum Priority {
        LOW,
        MEDIUM,
        HIGH
    }

    @Column(name = "profile_id", nullable = false, length = 64)
    private String profileId;

    /** Query intent of the turn that exposed the gap (tell_about, opinion, ...). */
    @Column(name = "category", nullable = false, length = 32)
    private String category;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 16)
    private Priority priority;

    /** Comma-separated topics that no CANON entry covered. */
    @Column(name = "missing_topics", columnDefinition = "TEXT")
    private String missingTopics;

    @Column(name = "query_text", columnDefinition = "TEXT")
    private String queryText;
}
