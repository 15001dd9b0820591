package com.openforge.recall.conversation;

import com.openforge.recall.domain.ConversationMessage;
import com.openforge.recall.repository.ConversationMessageRepository;
import com.openforge.recall.retrieval.ConversationHistory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps the chat log that retrieval reads for conversational context.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationHistoryService implements ConversationHistory {

    private final ConversationMessageRepository repository;

    @Transactional
    public ConversationMessage append(String conversationId, ConversationMessage.Role role, String content) {
        ConversationMessage saved = repository.save(ConversationMessage.builder()
                .conversationId(conversationId)
                .role(role)
                .content(content)
                .build());
        log.debug("[History] Appended {} message {} to conversation {}", role, saved.getId(), conversationId);
        return saved;
    }

    /** Newest first, as stored. */
    @Transactional(readOnly = true)
    public List<ConversationMessage> latest(String conversationId, int limit) {
        return repository.findByConversationIdOrderByIdDesc(conversationId, PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> recentMessages(String conversationId, int limit) {
        if (limit <= 0) return List.of();
        List<String> contents = new ArrayList<>();
        for (ConversationMessage m : latest(conversationId, limit)) {
            contents.add(m.getContent());
        }
        Collections.reverse(contents);
        return contents;
    }
}
