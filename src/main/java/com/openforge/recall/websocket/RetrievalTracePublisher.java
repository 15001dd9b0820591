package com.openforge.recall.websocket;

import com.openforge.recall.retrieval.RetrievalTrace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Routes retrieval traces to the debug panel.
 *
 * Topic layout:
 *   /topic/retrieval/{conversationId}  one frame per turn
 *
 * Turns without a conversation id are not published.  Delivery failures are
 * logged and never reach the retrieval caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetrievalTracePublisher {

    static final String TOPIC_PREFIX = "/topic/retrieval/";

    private final SimpMessagingTemplate messagingTemplate;

    public void publish(String conversationId, RetrievalTrace trace) {
        if (conversationId == null || conversationId.isBlank() || trace == null) return;
        String destination = TOPIC_PREFIX + conversationId;
        try {
            messagingTemplate.convertAndSend(destination, trace);
        } catch (Exception e) {
            log.warn("[Publisher] Failed to deliver retrieval trace to {}: {}", destination, e.getMessage());
        }
    }
}
