package com.openforge.recall.retrieval;

import com.openforge.recall.domain.KnowledgeGap;

import java.util.List;

/**
 * Missing CANON coverage found in one turn.
 *
 * @param category        query intent label
 * @param missingTopics   topics no qualifying CANON entry mentions
 * @param coveringEntries qualifying CANON entries in the context
 */
public record GapReport(String category, KnowledgeGap.Priority priority,
                        List<String> missingTopics, int coveringEntries) {

    public GapReport {
        missingTopics = List.copyOf(missingTopics);
    }

    public KnowledgeGap toEntity(String profileId, String queryText) {
        return KnowledgeGap.builder()
                .profileId(profileId)
                .category(category)
                .priority(priority)
                .missingTopics(String.join(",", missingTopics))
                .queryText(queryText)
                .build();
    }
}
