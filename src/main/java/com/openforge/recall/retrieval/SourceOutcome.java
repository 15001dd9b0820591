package com.openforge.recall.retrieval;

import org.springframework.lang.Nullable;

/**
 * How one source fared in a turn.  Recorded in the trace whether or not it
 * contributed hits.
 */
public record SourceOutcome(
        String source,
        SourceKind kind,
        Status status,
        int hitCount,
        long elapsedMs,
        @Nullable String error
) {

    public enum Status {
        OK,
        FAILED,
        /** Ran past the per-source timeout, measured from when the branch started. */
        TIMED_OUT,
        CANCELLED,
        /** Never got a retrieval thread within queue-wait-ms. */
        NOT_STARTED
    }

    public boolean ok() {
        return status == Status.OK;
    }

    public static SourceOutcome ok(String source, SourceKind kind, int hits, long elapsedMs) {
        return new SourceOutcome(source, kind, Status.OK, hits, elapsedMs, null);
    }

    public static SourceOutcome failed(String source, SourceKind kind, long elapsedMs, String error) {
        return new SourceOutcome(source, kind, Status.FAILED, 0, elapsedMs, error);
    }
}
