package com.openforge.recall.memory;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.openforge.recall.domain.MemoryEntry;
import com.openforge.recall.domain.MemoryLane;
import com.openforge.recall.domain.MemoryType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable read-only view of a {@link MemoryEntry} handed to retrieval branches.
 *
 * Branches never touch the managed JPA entity, so concurrent sources cannot
 * observe each other's mutations.  Numeric fields are clamped to 0 – 100 on the
 * way in; a malformed row is logged and repaired, never rejected.
 *
 * @param id             entry primary key
 * @param content        memory text
 * @param keywords       lowercased keyword set
 * @param embedding      stored vector or null
 * @param conversationId conversation the memory originated in, or null
 */
public record MemorySnapshot(
        long        id,
        String      profileId,
        String      content,
        MemoryType  type,
        MemoryLane  lane,
        int         importance,
        int         confidence,
        Set<String> keywords,
        @JsonIgnore float[] embedding,
        String      canonicalKey,
        String      source,
        String      conversationId,
        Long        parentFactId,
        int         retrievalCount
) {

    private static final Logger log = LoggerFactory.getLogger(MemorySnapshot.class);

    public static MemorySnapshot of(MemoryEntry e) {
        long id = e.getId() == null ? 0L : e.getId();
        int importance = clamp(e.getImportance(), "importance", id);
        int confidence = clamp(e.getConfidence(), "confidence", id);
        String content = e.getContent() == null ? "" : e.getContent();
        String key = e.getCanonicalKey() != null ? e.getCanonicalKey() : CanonicalKeys.of(content);
        return new MemorySnapshot(
                id,
                e.getProfileId(),
                content,
                e.getType() == null ? MemoryType.FACT : e.getType(),
                e.getLane() == null ? MemoryLane.CANON : e.getLane(),
                importance,
                confidence,
                lowercase(e.getKeywords()),
                e.getEmbedding(),
                key,
                e.getSource(),
                e.getConversationId(),
                e.getParentFactId(),
                Math.max(0, e.getRetrievalCount())
        );
    }

    public boolean isCanon() {
        return lane == MemoryLane.CANON;
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    static int clamp(int value, String field, long id) {
        if (value < 0 || value > 100) {
            int fixed = Math.max(0, Math.min(100, value));
            log.warn("[Memory] Entry {} has out-of-range {}={}, clamped to {}", id, field, value, fixed);
            return fixed;
        }
        return value;
    }

    private static Set<String> lowercase(Collection<String> keywords) {
        Set<String> out = new LinkedHashSet<>();
        if (keywords == null) return Set.of();
        for (String k : keywords) {
            if (k != null && !k.isBlank()) out.add(k.trim().toLowerCase(Locale.ROOT));
        }
        return Set.copyOf(out);
    }
}
