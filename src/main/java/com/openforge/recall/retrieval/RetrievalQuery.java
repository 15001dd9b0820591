package com.openforge.recall.retrieval;

import com.openforge.recall.persona.PersonaState;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Everything a retrieval source needs for one turn.  Immutable apart from the
 * memoized embedding.
 *
 * @param message        raw user message
 * @param profileId      owning profile
 * @param conversationId current conversation, used for the same-conversation bonus
 * @param keywords       enhanced keywords, base terms first
 * @param intent         detected query intent
 * @param persona        persona snapshot for this turn
 * @param zone           NORMAL or THEATER, derived from the persona
 * @param embedding      lazily computed query vector
 * @param perSourceLimit max hits each source may return
 */
public record RetrievalQuery(
        String         message,
        String         profileId,
        @Nullable String conversationId,
        List<String>   keywords,
        QueryIntent    intent,
        PersonaState   persona,
        ZoneState      zone,
        QueryEmbedding embedding,
        int            perSourceLimit
) {
    public RetrievalQuery {
        keywords = List.copyOf(keywords);
    }

    public boolean theater() {
        return zone == ZoneState.THEATER;
    }
}
