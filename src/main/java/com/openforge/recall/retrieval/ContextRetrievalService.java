package com.openforge.recall.retrieval;

import com.openforge.recall.memory.MemoryWriteBehind;
import com.openforge.recall.persona.PersonaState;
import com.openforge.recall.websocket.RetrievalTracePublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Entry point of the retrieval pipeline.
 *
 * Per turn:
 *
 *   message ─► KeywordExtractor ─► (empty? return empty context, method "none")
 *           ─► ConversationHistory       last messages → extra keywords, contextual embedding text
 *           ─► QueryIntentDetector + ContextualKeywordEnhancer
 *           ─► HybridSearchEngine        parallel sources, per-source timeout
 *           ─► CandidatePool             dedup by id
 *           ─► RelevanceScorer           provisional rank
 *           ─► DiversityScorer           redundancy penalty, re-rank
 *           ─► TheaterZonePolicy         lane filter
 *           ─► ContextAssembler          canonical dedup, top-K, char budget
 *           ─► KnowledgeGapDetector      report only
 *
 * Never throws: anything unexpected yields an empty context with method
 * "error" so the turn can still be answered without grounding.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContextRetrievalService {

    private final KeywordExtractor          keywordExtractor;
    private final QueryIntentDetector       intentDetector;
    private final ContextualKeywordEnhancer keywordEnhancer;
    private final ConversationHistory       history;
    private final QueryEmbedder             queryEmbedder;
    private final HybridSearchEngine        searchEngine;
    private final RelevanceScorer           relevanceScorer;
    private final DiversityScorer           diversityScorer;
    private final TheaterZonePolicy         zonePolicy;
    private final ContextAssembler          assembler;
    private final KnowledgeGapDetector      gapDetector;
    private final MemoryWriteBehind         writeBehind;
    private final RetrievalTracePublisher   tracePublisher;
    private final RetrievalProperties       props;

    public RetrievedContext retrieveContext(String message,
                                            String profileId,
                                            @Nullable String conversationId,
                                            @Nullable PersonaState personaState) {
        long started = System.nanoTime();
        PersonaState persona = personaState != null ? personaState : PersonaState.calm();
        ZoneState zone = zonePolicy.classify(persona);

        RetrievedContext context;
        try {
            context = run(message, profileId, conversationId, persona, zone, started);
        } catch (Exception e) {
            log.error("[Retrieval] Unexpected failure for profile {}: {}", profileId, e.getMessage(), e);
            context = RetrievedContext.empty(
                    RetrievalTrace.skipped(message, SearchResult.ERROR, zone, elapsedMs(started)));
        }

        tracePublisher.publish(conversationId, context.trace());
        return context;
    }

    private RetrievedContext run(String message, String profileId, String conversationId,
                                 PersonaState persona, ZoneState zone, long started) {
        List<String> base = keywordExtractor.extract(message);
        if (base.isEmpty()) {
            log.debug("[Retrieval] No usable keywords in message; skipping retrieval");
            return RetrievedContext.empty(
                    RetrievalTrace.skipped(message, SearchResult.NONE, zone, elapsedMs(started)));
        }

        List<String> recent       = recentMessages(conversationId);
        List<String> historyTerms = recent.isEmpty() ? List.of() : keywordExtractor.extract(String.join(" ", recent));

        QueryIntent  intent   = intentDetector.detect(message);
        List<String> keywords = keywordEnhancer.enhance(base, historyTerms, message, persona);
        String       embedded = ContextualKeywordEnhancer.contextualQuery(message, recent);
        RetrievalQuery query = new RetrievalQuery(message, profileId, conversationId, keywords, intent,
                persona, zone, queryEmbedder.lazily(embedded), props.perSourceLimit());

        SearchResult          search      = searchEngine.search(query);
        CandidatePool         pool        = CandidatePool.merge(search.hits());
        List<RankedCandidate> provisional = relevanceScorer.rank(pool.candidates(), query);
        List<RankedCandidate> diversified = diversityScorer.diversify(provisional);
        TheaterZonePolicy.Admission admission = zonePolicy.admit(diversified, persona);

        RetrievedContext context = assembler.assemble(query, admission, search, pool.size(), started);

        Optional<GapReport> gap = gapDetector.detect(query, context.entries());
        if (gap.isPresent()) {
            writeBehind.recordGap(gap.get().toEntity(profileId, message));
            context = context.withKnowledgeGap(gap.get());
        }

        log.info("[Retrieval] profile={} zone={} method={} intent={} candidates={} returned={} rumors={} in {} ms",
                profileId, zone, search.retrievalMethod(), intent.label(), pool.size(),
                context.entries().size(), context.trace().rumorsAdmitted(), context.trace().executionTimeMs());
        return context;
    }

    /** Oldest first; empty without a conversation or when the log cannot be read. */
    private List<String> recentMessages(@Nullable String conversationId) {
        if (conversationId == null || conversationId.isBlank() || props.historyMessages() <= 0) return List.of();
        try {
            List<String> recent = history.recentMessages(conversationId, props.historyMessages());
            return recent != null ? recent : List.of();
        } catch (Exception e) {
            log.warn("[Retrieval] Recent messages of conversation {} unavailable, using the message alone: {}",
                    conversationId, e.getMessage());
            return List.of();
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
