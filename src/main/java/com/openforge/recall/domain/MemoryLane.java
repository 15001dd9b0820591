package com.openforge.recall.domain;

/**
 * Exposure lane of a memory.
 *
 * CANON: verified, consistent content; always eligible for grounding.
 * RUMOR: fictional, exaggerated or unverified; only surfaced in the theater zone.
 */
public enum MemoryLane {
    CANON,
    RUMOR
}
