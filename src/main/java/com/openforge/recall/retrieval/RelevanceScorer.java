package com.openforge.recall.retrieval;

import com.openforge.recall.memory.MemorySnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Composite relevance score.
 *
 *   base       = similarity·1.2 + importance·0.1 + confidence·0.001
 *   contextual = 0.5  if the memory came from this conversation
 *              + 0.4  if its type fits the query intent
 *              + 0.25·importance/100
 *              + 0.10·confidence/100
 *              + 0.10 per matching keyword, at most 0.3
 *   final      = base·diversityFactor + contextual·0.3
 *
 * Importance and confidence enter the base score raw (0 – 100) and so dominate
 * similarity; the contextual bonuses separate memories of similar weight.
 * Weights come from {@link RetrievalProperties.Weights}.  Pure.
 */
@Slf4j
@Component
public class RelevanceScorer {

    private final RetrievalProperties.Weights w;

    @Autowired
    public RelevanceScorer(RetrievalProperties props) {
        this(props.weights());
    }

    public RelevanceScorer(RetrievalProperties.Weights weights) {
        this.w = weights;
    }

    public ScoreBreakdown score(Candidate candidate, RetrievalQuery query) {
        MemorySnapshot m = candidate.memory();
        double similarity = Math.max(0.0, Math.min(1.0, candidate.semanticSimilarity()));
        double base = similarity * w.similarity()
                + m.importance() * w.importance()
                + m.confidence() * w.confidence();

        double conversation = query.conversationId() != null
                && Objects.equals(query.conversationId(), m.conversationId()) ? w.sameConversation() : 0.0;
        double intent     = query.intent().favors(m.type()) ? w.intentMatch() : 0.0;
        double importance = w.importanceBonus() * m.importance() / 100.0;
        double confidence = w.confidenceBonus() * m.confidence() / 100.0;
        int matched       = KeywordMatcher.countMatches(m, query.keywords());
        double keyword    = Math.min(w.maxKeywordBonus(), matched * w.keywordMatch());

        double contextual = conversation + intent + importance + confidence + keyword;
        return new ScoreBreakdown(similarity, base, conversation, intent, importance, confidence,
                keyword, matched, contextual, w.contextual(), 1.0,
                base + contextual * w.contextual());
    }

    /** Scores every candidate with diversity factor 1 and sorts by rank. */
    public List<RankedCandidate> rank(Collection<Candidate> candidates, RetrievalQuery query) {
        List<RankedCandidate> ranked = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            ScoreBreakdown s = score(c, query);
            if (log.isDebugEnabled()) {
                log.debug("[Retrieval] #{} {} base={} contextual={} provisional={}",
                        c.id(), c.memory().type(), fmt(s.base()), fmt(s.contextual()), fmt(s.finalScore()));
            }
            ranked.add(new RankedCandidate(c, s));
        }
        ranked.sort(RankedCandidate.BY_RANK);
        return ranked;
    }

    private static String fmt(double v) {
        return String.format("%.3f", v);
    }
}
