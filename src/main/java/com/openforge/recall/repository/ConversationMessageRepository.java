package com.openforge.recall.repository;

import com.openforge.recall.domain.ConversationMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ConversationMessageRepository extends JpaRepository<ConversationMessage, Long> {

    /** Newest first; the page size bounds how far back to look. */
    List<ConversationMessage> findByConversationIdOrderByIdDesc(String conversationId, Pageable page);
}
