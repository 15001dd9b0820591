package com.openforge.recall.retrieval;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns a raw message into an ordered set of salient search terms.
 *
 * Lowercase, keep [a-z0-9] and whitespace, split, keep all-digit tokens or
 * tokens of at least three characters, drop stopwords, dedupe in order, cap.
 * Pure; no I/O.
 */
@Component
public class KeywordExtractor {

    private static final int MIN_TERM_LENGTH = 3;

    private static final Set<String> STOPWORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
            "is", "are", "was", "were", "be", "been", "have", "has", "had", "do", "does", "did",
            "will", "would", "could", "should", "may", "might", "can", "this", "that", "these",
            "those", "i", "you", "he", "she", "it", "we", "they", "me", "him", "her", "us", "them");

    private final int maxTerms;

    @Autowired
    public KeywordExtractor(RetrievalProperties props) {
        this(props.maxBaseKeywords());
    }

    public KeywordExtractor(int maxTerms) {
        this.maxTerms = Math.max(1, maxTerms);
    }

    public List<String> extract(String message) {
        if (message == null || message.isBlank()) return List.of();

        String cleaned = message.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\s]", "");
        Set<String> terms = new LinkedHashSet<>();
        for (String word : cleaned.split("\\s+")) {
            if (word.isEmpty() || STOPWORDS.contains(word)) continue;
            boolean numeric = word.chars().allMatch(Character::isDigit);
            if (numeric || word.length() >= MIN_TERM_LENGTH) {
                terms.add(word);
                if (terms.size() == maxTerms) break;
            }
        }
        return List.copyOf(new ArrayList<>(terms));
    }
}
