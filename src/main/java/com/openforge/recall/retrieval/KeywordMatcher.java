package com.openforge.recall.retrieval;

import com.openforge.recall.memory.MemorySnapshot;

import java.util.Collection;
import java.util.Locale;

/** Keyword-to-memory matching shared by lexical sources, scoring and gap detection. */
public final class KeywordMatcher {

    private KeywordMatcher() {}

    /** True if the keyword is one of the memory's keywords or appears in its content. */
    public static boolean mentions(MemorySnapshot memory, String keyword) {
        if (keyword == null || keyword.isBlank()) return false;
        String k = keyword.toLowerCase(Locale.ROOT);
        return memory.keywords().contains(k) || memory.content().toLowerCase(Locale.ROOT).contains(k);
    }

    public static int countMatches(MemorySnapshot memory, Collection<String> keywords) {
        int n = 0;
        String content = memory.content().toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) continue;
            String k = keyword.toLowerCase(Locale.ROOT);
            if (memory.keywords().contains(k) || content.contains(k)) n++;
        }
        return n;
    }

    /** Fraction of the keywords this memory matches, 0 – 1. */
    public static double coverage(MemorySnapshot memory, Collection<String> keywords) {
        if (keywords.isEmpty()) return 0.0;
        return (double) countMatches(memory, keywords) / keywords.size();
    }
}
