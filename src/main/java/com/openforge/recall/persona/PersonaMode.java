package com.openforge.recall.persona;

/**
 * Where the persona is currently speaking.
 * PODCAST and STREAMING are performance modes and always open the theater zone.
 */
public enum PersonaMode {
    CHAT,
    PODCAST,
    STREAMING,
    DISCORD;

    public boolean isPerformance() {
        return this == PODCAST || this == STREAMING;
    }
}
