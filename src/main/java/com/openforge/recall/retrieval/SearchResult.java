package com.openforge.recall.retrieval;

import java.util.List;

/**
 * Output of {@link HybridSearchEngine#search}.
 *
 * @param hits            every hit from every source that completed in time
 * @param outcomes        one entry per source that was asked, in registration order
 * @param retrievalMethod hybrid, keyword_fallback, semantic_only, degraded or none
 */
public record SearchResult(List<SourceHit> hits, List<SourceOutcome> outcomes, String retrievalMethod) {

    public static final String HYBRID           = "hybrid";
    public static final String KEYWORD_FALLBACK = "keyword_fallback";
    public static final String SEMANTIC_ONLY    = "semantic_only";
    public static final String DEGRADED         = "degraded";
    public static final String NONE             = "none";
    public static final String ERROR            = "error";

    public SearchResult {
        hits     = List.copyOf(hits);
        outcomes = List.copyOf(outcomes);
    }

    public static SearchResult empty() {
        return new SearchResult(List.of(), List.of(), NONE);
    }

    /** Labels a turn by which kinds of source answered in time. */
    static String methodFor(List<SourceOutcome> outcomes) {
        if (outcomes.isEmpty()) return NONE;
        boolean semanticOk = false, lexicalOk = false;
        for (SourceOutcome o : outcomes) {
            if (!o.ok()) continue;
            if (o.kind() == SourceKind.SEMANTIC) semanticOk = true;
            else lexicalOk = true;
        }
        if (semanticOk && lexicalOk) return HYBRID;
        if (lexicalOk)               return KEYWORD_FALLBACK;
        if (semanticOk)              return SEMANTIC_ONLY;
        return DEGRADED;
    }
}
