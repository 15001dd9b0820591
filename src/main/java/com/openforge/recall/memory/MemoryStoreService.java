package com.openforge.recall.memory;

import com.openforge.recall.domain.MemoryEntry;
import com.openforge.recall.domain.MemoryLane;
import com.openforge.recall.domain.MemoryType;
import com.openforge.recall.repository.MemoryEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent memory store used by ingestion collaborators.
 *
 *   store(): upsert on (profileId, canonicalKey); embed; mirror to Milvus
 *   find(): load one entry
 *
 * Upsert merge on an existing key:
 *   confidence  +10, capped at 100
 *   importance  max(existing, incoming)
 *   keywords    union
 *   provenance  incoming value when non-null, otherwise kept
 *   retrieval_count untouched
 *
 * store() is deliberately not one transaction: a concurrent insert of the same
 * key fails on the unique constraint, and the retry reloads the winner's row
 * and merges into it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MemoryStoreService {

    private static final int CONFIDENCE_REINFORCEMENT = 10;

    private final MemoryEntryRepository repository;
    private final SemanticMemoryIndex   semanticIndex;
    private final EmbeddingClient       embeddingClient;

    public record StoreResult(MemoryEntry entry, boolean created) {}

    // ── Store ────────────────────────────────────────────────────────────────

    public StoreResult store(NewMemory cmd) {
        if (cmd.content() == null || cmd.content().isBlank()) {
            throw new IllegalArgumentException("Memory content must not be blank");
        }
        String canonicalKey = CanonicalKeys.of(cmd.content());
        MemoryLane lane = resolveLane(cmd);
        float[] embedding = cmd.embedding() != null ? cmd.embedding() : tryEmbed(cmd.content());

        StoreResult result;
        Optional<MemoryEntry> existing = repository.findByProfileIdAndCanonicalKey(cmd.profileId(), canonicalKey);
        if (existing.isPresent()) {
            result = new StoreResult(merge(existing.get(), cmd, lane, embedding), false);
        } else {
            try {
                MemoryEntry saved = repository.saveAndFlush(newEntry(cmd, canonicalKey, lane, embedding));
                log.debug("[Memory] Created {} {} entry {} key={}", lane, cmd.type(), saved.getId(), canonicalKey);
                result = new StoreResult(saved, true);
            } catch (DataIntegrityViolationException race) {
                log.debug("[Memory] Concurrent insert on key {}; merging into the existing row", canonicalKey);
                MemoryEntry winner = repository.findByProfileIdAndCanonicalKey(cmd.profileId(), canonicalKey)
                        .orElseThrow(() -> race);
                result = new StoreResult(merge(winner, cmd, lane, embedding), false);
            }
        }

        if (result.entry().getType() == MemoryType.STORY) {
            alignChildLanes(result.entry());
        }
        semanticIndex.index(result.entry());
        return result;
    }

    public MemoryEntry find(long id) {
        return repository.findById(id).orElseThrow(() -> new MemoryNotFoundException(id));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private MemoryEntry merge(MemoryEntry target, NewMemory cmd, MemoryLane lane, float[] embedding) {
        target.setConfidence(Math.min(100, clamp(target.getConfidence()) + CONFIDENCE_REINFORCEMENT));
        target.setImportance(Math.max(clamp(target.getImportance()), clamp(cmd.importance())));
        Set<String> merged = new LinkedHashSet<>(target.getKeywords());
        merged.addAll(normalizeKeywords(cmd.keywords()));
        target.setKeywords(merged);
        if (cmd.type() != null)           target.setType(cmd.type());
        if (cmd.source() != null)         target.setSource(cmd.source());
        if (cmd.sourceId() != null)       target.setSourceId(cmd.sourceId());
        if (cmd.conversationId() != null) target.setConversationId(cmd.conversationId());
        if (cmd.parentFactId() != null) {
            target.setParentFactId(cmd.parentFactId());
            target.setLane(lane);
        }
        if (embedding != null)            target.setEmbedding(embedding);

        MemoryEntry saved = repository.save(target);
        log.debug("[Memory] Merged into entry {} (confidence={} importance={})",
                saved.getId(), saved.getConfidence(), saved.getImportance());
        return saved;
    }

    private MemoryEntry newEntry(NewMemory cmd, String canonicalKey, MemoryLane lane, float[] embedding) {
        return MemoryEntry.builder()
                .profileId(cmd.profileId())
                .content(cmd.content().trim())
                .type(cmd.type() != null ? cmd.type() : MemoryType.FACT)
                .lane(lane)
                .importance(clamp(cmd.importance()))
                .confidence(clamp(cmd.confidence()))
                .keywords(normalizeKeywords(cmd.keywords()))
                .embedding(embedding)
                .canonicalKey(canonicalKey)
                .source(cmd.source())
                .sourceId(cmd.sourceId())
                .conversationId(cmd.conversationId())
                .parentFactId(cmd.parentFactId())
                .build();
    }

    /** ATOMIC facts never carry an independent lane: the parent STORY decides. */
    private MemoryLane resolveLane(NewMemory cmd) {
        MemoryLane requested = cmd.lane() != null ? cmd.lane() : MemoryLane.CANON;
        if (cmd.parentFactId() == null) return requested;
        return repository.findById(cmd.parentFactId())
                .map(MemoryEntry::getLane)
                .orElseGet(() -> {
                    log.warn("[Memory] Parent fact {} not found; keeping requested lane {}",
                            cmd.parentFactId(), requested);
                    return requested;
                });
    }

    private void alignChildLanes(MemoryEntry story) {
        List<MemoryEntry> children = repository.findByParentFactId(story.getId());
        int changed = 0;
        for (MemoryEntry child : children) {
            if (child.getLane() != story.getLane()) {
                child.setLane(story.getLane());
                repository.save(child);
                semanticIndex.index(child);
                changed++;
            }
        }
        if (changed > 0) {
            log.info("[Memory] Re-laned {} atomic fact(s) of story {} to {}", changed, story.getId(), story.getLane());
        }
    }

    private float[] tryEmbed(String content) {
        try {
            return embeddingClient.embedAsArray(content);
        } catch (Exception e) {
            log.warn("[Memory] Embedding on write failed, storing without vector: {}", e.getMessage());
            return null;
        }
    }

    private static Set<String> normalizeKeywords(Set<String> keywords) {
        Set<String> out = new LinkedHashSet<>();
        if (keywords == null) return out;
        for (String k : keywords) {
            if (k != null && !k.isBlank()) out.add(k.trim().toLowerCase(Locale.ROOT));
        }
        return out;
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(100, value));
    }
}
