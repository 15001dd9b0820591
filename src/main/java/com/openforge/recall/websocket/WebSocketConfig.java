package com.openforge.recall.websocket;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * Read-only STOMP feed for the memory debug panel.
 *
 *   1. connect   ws://host/ws/retrieval  (SockJS fallback on the same path)
 *   2. SUBSCRIBE /topic/retrieval/{conversationId}
 *   3. one RetrievalTrace frame arrives per retrieval turn
 *
 * The panel never sends application messages, so no /app prefix is mapped.
 * Allowed origins come from persona.debug-panel.allowed-origins.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private final String[] allowedOrigins;

    public WebSocketConfig(@Value("${persona.debug-panel.allowed-origins:*}") String[] allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic/retrieval");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws/retrieval")
                .setAllowedOriginPatterns(allowedOrigins)
                .withSockJS();
    }
}
