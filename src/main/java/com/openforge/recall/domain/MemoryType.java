package com.openforge.recall.domain;

/**
 * Classifies the nature of a memory entry.
 *
 * FACT: a plain statement about the persona or the world.
 * PREFERENCE: likes, dislikes, opinions.
 * LORE: backstory and world-building.
 * CONTEXT: situational knowledge (games, shows, recurring guests).
 * STORY: a full anecdote; may be decomposed into ATOMIC children.
 * ATOMIC: a single claim extracted from a STORY (see parentFactId).
 */
public enum MemoryType {
    FACT,
    PREFERENCE,
    LORE,
    CONTEXT,
    STORY,
    ATOMIC
}
