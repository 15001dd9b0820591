package com.openforge.recall.memory;

import com.openforge.recall.domain.KnowledgeGap;
import com.openforge.recall.domain.MemoryEntry;
import com.openforge.recall.domain.MemoryLane;
import com.openforge.recall.domain.MemoryType;
import com.openforge.recall.repository.KnowledgeGapRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * REST API for ingestion collaborators and curation tooling.
 *
 * ┌────────────────────────────────────────────────────────────────────┐
 * │  Endpoint                              Description                 │
 * ├────────────────────────────────────────────────────────────────────┤
 * │  POST /api/memories                    store or merge one memory   │
 * │  GET  /api/memories/{id}               load one memory             │
 * │  GET  /api/memories/gaps?profileId=x   recorded knowledge gaps     │
 * └────────────────────────────────────────────────────────────────────┘
 */
@Validated
@RestController
@RequestMapping("/api/memories")
@RequiredArgsConstructor
public class MemoryController {

    private final MemoryStoreService     storeService;
    private final KnowledgeGapRepository gapRepository;

    // ── Store ────────────────────────────────────────────────────────────────

    /**
     * Upsert on (profileId, canonicalKey).  201 when a new row was created,
     * 200 when the content merged into an existing one.
     */
    @PostMapping
    public ResponseEntity<MemoryView> store(@Valid @RequestBody StoreMemoryRequest req) {
        NewMemory cmd = NewMemory.builder()
                .profileId(req.profileId())
                .content(req.content())
                .type(req.type())
                .lane(req.lane())
                .importance(req.importance() != null ? req.importance() : 50)
                .confidence(req.confidence() != null ? req.confidence() : 50)
                .keywords(req.keywords())
                .source(req.source())
                .sourceId(req.sourceId())
                .conversationId(req.conversationId())
                .parentFactId(req.parentFactId())
                .build();

        MemoryStoreService.StoreResult result = storeService.store(cmd);
        HttpStatus status = result.created() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(MemoryView.of(result.entry()));
    }

    // ── Read ─────────────────────────────────────────────────────────────────

    @GetMapping("/{id}")
    public ResponseEntity<MemoryView> get(@PathVariable long id) {
        return ResponseEntity.ok(MemoryView.of(storeService.find(id)));
    }

    /** Most recent gaps first. */
    @GetMapping("/gaps")
    public ResponseEntity<List<GapView>> gaps(@RequestParam @NotBlank String profileId,
                                              @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
        List<GapView> views = gapRepository.findByProfileIdOrderByIdDesc(profileId).stream()
                .limit(limit)
                .map(GapView::of)
                .toList();
        return ResponseEntity.ok(views);
    }

    // ── Inner DTOs ────────────────────────────────────────────────────────────

    public record StoreMemoryRequest(
            @NotBlank @Size(max = 64)   String     profileId,
            @NotBlank @Size(max = 8000) String     content,
            @NotNull                    MemoryType type,
            MemoryLane  lane,
            Integer     importance,
            Integer     confidence,
            Set<String> keywords,
            String      source,
            String      sourceId,
            String      conversationId,
            Long        parentFactId
    ) {}

    public record MemoryView(
            Long          id,
            String        profileId,
            String        content,
            MemoryType    type,
            MemoryLane    lane,
            int           importance,
            int           confidence,
            Set<String>   keywords,
            String        canonicalKey,
            int           retrievalCount,
            String        source,
            String        conversationId,
            Long          parentFactId,
            boolean       embedded,
            LocalDateTime updateTime
    ) {
        static MemoryView of(MemoryEntry e) {
            return new MemoryView(e.getId(), e.getProfileId(), e.getContent(), e.getType(), e.getLane(),
                    e.getImportance(), e.getConfidence(), new TreeSet<>(e.getKeywords()), e.getCanonicalKey(),
                    e.getRetrievalCount(), e.getSource(), e.getConversationId(), e.getParentFactId(),
                    e.getEmbedding() != null, e.getUpdateTime());
        }
    }

    public record GapView(
            Long                  id,
            String                category,
            KnowledgeGap.Priority priority,
            List<String>          missingTopics,
            String                queryText,
            LocalDateTime         createTime
    ) {
        static GapView of(KnowledgeGap g) {
            List<String> topics = g.getMissingTopics() == null || g.getMissingTopics().isBlank()
                    ? List.of()
                    : List.of(g.getMissingTopics().split(","));
            return new GapView(g.getId(), g.getCategory(), g.getPriority(), topics, g.getQueryText(),
                    g.getCreateTime());
        }
    }
}
