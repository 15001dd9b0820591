package com.openforge.recall.retrieval;

import com.openforge.recall.domain.KnowledgeGap;
import com.openforge.recall.memory.MemorySnapshot;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flags turns where the returned context has thin CANON coverage of what the
 * user asked about.  Reports only; never changes the context.
 *
 * Topics are the query keywords of at least {@code minTopicLength} chars.
 * A topic is covered when a returned CANON entry with enough confidence
 * mentions it.  A gap needs at least one uncovered topic, plus either too few
 * covering entries or more than half the topics uncovered.
 */
@Component
public class KnowledgeGapDetector {

    private final RetrievalProperties.Gap cfg;

    @Autowired
    public KnowledgeGapDetector(RetrievalProperties props) {
        this(props.gap());
    }

    public KnowledgeGapDetector(RetrievalProperties.Gap cfg) {
        this.cfg = cfg;
    }

    public Optional<GapReport> detect(RetrievalQuery query, List<ContextEntry> entries) {
        if (!cfg.enabled()) return Optional.empty();

        List<String> topics = query.keywords().stream()
                .filter(k -> k.length() >= cfg.minTopicLength())
                .toList();
        if (topics.isEmpty()) return Optional.empty();

        List<MemorySnapshot> covering = entries.stream()
                .map(ContextEntry::memory)
                .filter(m -> m.isCanon() && m.confidence() >= cfg.minConfidence())
                .toList();

        List<String> missing = new ArrayList<>();
        for (String topic : topics) {
            boolean covered = covering.stream().anyMatch(m -> KeywordMatcher.mentions(m, topic));
            if (!covered) missing.add(topic);
        }
        if (missing.isEmpty()) return Optional.empty();

        double missingRatio = (double) missing.size() / topics.size();
        if (covering.size() >= cfg.minCoveredEntries() && missingRatio <= 0.5) return Optional.empty();

        KnowledgeGap.Priority priority;
        if (covering.isEmpty())       priority = KnowledgeGap.Priority.HIGH;
        else if (missingRatio > 0.5)  priority = KnowledgeGap.Priority.MEDIUM;
        else                          priority = KnowledgeGap.Priority.LOW;

        return Optional.of(new GapReport(query.intent().label(), priority, missing, covering.size()));
    }
}
