package com.openforge.recall.persona;

import org.springframework.lang.Nullable;

/**
 * Read-only persona snapshot for one conversational turn.
 *
 * Passed explicitly through the retrieval call chain; nothing in this service
 * keeps a global "current chaos" value.
 *
 * @param chaosLevel volatility scalar, clamped to 0 – 100
 * @param mode       where the persona is speaking; null is treated as CHAT
 * @param preset     optional personality preset name (e.g. "Gaming Rage", "Storytime")
 */
public record PersonaState(int chaosLevel, PersonaMode mode, @Nullable String preset) {

    public PersonaState {
        chaosLevel = Math.max(0, Math.min(100, chaosLevel));
        if (mode == null) mode = PersonaMode.CHAT;
    }

    public static PersonaState of(int chaosLevel, PersonaMode mode) {
        return new PersonaState(chaosLevel, mode, null);
    }

    public static PersonaState calm() {
        return new PersonaState(0, PersonaMode.CHAT, null);
    }
}
