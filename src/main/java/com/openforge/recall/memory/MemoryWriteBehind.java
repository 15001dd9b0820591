package com.openforge.recall.memory;

import com.openforge.recall.domain.KnowledgeGap;
import com.openforge.recall.repository.KnowledgeGapRepository;
import com.openforge.recall.repository.MemoryEntryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget writes issued by the retrieval path.
 *
 *   recordRetrievals() bumps retrievalCount for the entries a turn returned
 *   recordGap()        appends a knowledge gap for curation
 *
 * Both run on the memoryWriteExecutor so nothing here sits on the response
 * path.  Failures are logged at WARN and dropped; counters are eventually
 * consistent.
 */
@Slf4j
@Component
public class MemoryWriteBehind {

    private final MemoryEntryRepository  entryRepository;
    private final KnowledgeGapRepository gapRepository;
    private final ExecutorService        writeExecutor;

    public MemoryWriteBehind(MemoryEntryRepository entryRepository,
                             KnowledgeGapRepository gapRepository,
                             @Qualifier("memoryWriteExecutor") ExecutorService writeExecutor) {
        this.entryRepository = entryRepository;
        this.gapRepository   = gapRepository;
        this.writeExecutor   = writeExecutor;
    }

    public void recordRetrievals(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) return;
        List<Long> snapshot = List.copyOf(ids);
        submit("retrieval count update for " + snapshot.size() + " entries", () -> increment(snapshot));
    }

    public void recordGap(KnowledgeGap gap) {
        if (gap == null) return;
        submit("knowledge gap for profile " + gap.getProfileId(), () -> saveGap(gap));
    }

    void increment(List<Long> ids) {
        try {
            int updated = entryRepository.incrementRetrievalCount(ids);
            log.debug("[Memory] Retrieval count bumped for {}/{} entries", updated, ids.size());
        } catch (Exception e) {
            log.warn("[Memory] Failed to bump retrieval count for {}: {}", ids, e.getMessage());
        }
    }

    void saveGap(KnowledgeGap gap) {
        try {
            gapRepository.save(gap);
            log.info("[Memory] Knowledge gap recorded: profile={} priority={} topics=[{}]",
                    gap.getProfileId(), gap.getPriority(), gap.getMissingTopics());
        } catch (Exception e) {
            log.warn("[Memory] Failed to record knowledge gap for profile {}: {}",
                    gap.getProfileId(), e.getMessage());
        }
    }

    private void submit(String what, Runnable write) {
        try {
            writeExecutor.execute(write);
        } catch (RejectedExecutionException e) {
            log.warn("[Memory] Dropped {}: {}", what, e.getMessage());
        }
    }
}
