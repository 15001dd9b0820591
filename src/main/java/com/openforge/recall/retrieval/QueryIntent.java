package com.openforge.recall.retrieval;

import com.openforge.recall.domain.MemoryType;

import java.util.Locale;
import java.util.Set;

/**
 * Coarse intent of an incoming message.  Drives the intent bonus in scoring
 * and labels knowledge gaps.
 */
public enum QueryIntent {
    TELL_ABOUT(Set.of(MemoryType.LORE, MemoryType.STORY)),
    OPINION(Set.of(MemoryType.PREFERENCE, MemoryType.FACT)),
    REMIND(Set.of()),
    HOW_TO(Set.of()),
    GENERAL(Set.of());

    private final Set<MemoryType> favored;

    QueryIntent(Set<MemoryType> favored) {
        this.favored = favored;
    }

    public boolean favors(MemoryType type) {
        return favored.contains(type);
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
