package com.openforge.recall.retrieval;

/**
 * Exposure state for one turn.
 *
 * NORMAL: grounded conversation, CANON only.
 * THEATER: performance or high chaos, RUMOR may be surfaced.
 */
public enum ZoneState {
    NORMAL,
    THEATER
}
