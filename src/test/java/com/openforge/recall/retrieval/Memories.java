package com.openforge.recall.retrieval;

import com.openforge.recall.domain.MemoryLane;
import com.openforge.recall.domain.MemoryType;
import com.openforge.recall.memory.CanonicalKeys;
import com.openforge.recall.memory.MemorySnapshot;
import com.openforge.recall.persona.PersonaState;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/** Fixture builders shared by the retrieval tests. */
final class Memories {

    static final String PROFILE = "profile-1";

    private Memories() {}

    static MemorySnapshot canon(long id, MemoryType type, int confidence, String content, String... keywords) {
        return snapshot(id, type, MemoryLane.CANON, 50, confidence, content, null, keywords);
    }

    static MemorySnapshot rumor(long id, MemoryType type, int confidence, String content, String... keywords) {
        return snapshot(id, type, MemoryLane.RUMOR, 50, confidence, content, null, keywords);
    }

    static MemorySnapshot snapshot(long id, MemoryType type, MemoryLane lane, int importance, int confidence,
                                   String content, String conversationId, String... keywords) {
        return new MemorySnapshot(id, PROFILE, content, type, lane, importance, confidence,
                Set.of(keywords), null, CanonicalKeys.of(content), null, conversationId, null, 0);
    }

    static Candidate candidate(MemorySnapshot memory, double similarity, String... sources) {
        return new Candidate(memory, similarity, 0.0, new TreeSet<>(List.of(sources.length == 0 ? new String[]{"test"} : sources)));
    }

    /** Ranked with diversity factor 1 and the given final score. */
    static RankedCandidate ranked(MemorySnapshot memory, double finalScore) {
        ScoreBreakdown score = new ScoreBreakdown(0, finalScore, 0, 0, 0, 0, 0, 0, 0, 0.3, 1.0, finalScore);
        return new RankedCandidate(candidate(memory, 0), score);
    }

    static RetrievalQuery query(String message, List<String> keywords, QueryIntent intent,
                                String conversationId, PersonaState persona, ZoneState zone) {
        return new RetrievalQuery(message, PROFILE, conversationId, keywords, intent, persona, zone,
                QueryEmbedding.of(new float[]{1f, 0f}), 20);
    }

    static RetrievalQuery query(List<String> keywords) {
        return query(String.join(" ", keywords), keywords, QueryIntent.GENERAL, "conv-1",
                PersonaState.calm(), ZoneState.NORMAL);
    }
}
