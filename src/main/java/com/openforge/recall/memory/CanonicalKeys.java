package com.openforge.recall.memory;

import java.util.Locale;

/**
 * Derives the dedup identity of a memory from its content.
 *
 * Normalization: lowercase, trim, drop punctuation, collapse whitespace, keep
 * the first 100 characters.  The key is {@code fact_<abs(hash)>} of that text,
 * so two facts that differ only in casing or punctuation collide on purpose.
 */
public final class CanonicalKeys {

    private static final int NORMALIZED_LENGTH = 100;

    private CanonicalKeys() {}

    public static String of(String content) {
        String normalized = normalize(content);
        return "fact_" + Math.abs((long) normalized.hashCode());
    }

    static String normalize(String content) {
        if (content == null) return "";
        String n = content.toLowerCase(Locale.ROOT)
                .trim()
                .replaceAll("[^\\w\\s]", "")
                .replaceAll("\\s+", " ");
        return n.length() > NORMALIZED_LENGTH ? n.substring(0, NORMALIZED_LENGTH) : n;
    }
}
