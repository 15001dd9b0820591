package com.openforge.recall.retrieval;

import java.util.List;

/**
 * Read side of the chat log, as seen by retrieval.
 */
public interface ConversationHistory {

    /**
     * Contents of the last {@code limit} messages of the conversation, oldest
     * first.  Empty when the conversation is unknown.
     */
    List<String> recentMessages(String conversationId, int limit);
}
