package com.openforge.recall.retrieval;

/**
 * Every term that went into a candidate's final score, kept for the trace.
 *
 *   base       = similarity·w + importance·w + confidence·w
 *   contextual = conversation + intent + importanceBonus + confidenceBonus + keywordBonus
 *   final      = base · diversityFactor + contextual · contextualWeight
 */
public record ScoreBreakdown(
        double semanticSimilarity,
        double base,
        double conversationBonus,
        double intentBonus,
        double importanceBonus,
        double confidenceBonus,
        double keywordBonus,
        int    matchedKeywords,
        double contextual,
        double contextualWeight,
        double diversityFactor,
        double finalScore
) {

    public ScoreBreakdown withDiversityFactor(double factor) {
        double clamped = Math.max(0.0, Math.min(1.0, factor));
        return new ScoreBreakdown(semanticSimilarity, base, conversationBonus, intentBonus,
                importanceBonus, confidenceBonus, keywordBonus, matchedKeywords, contextual,
                contextualWeight, clamped, base * clamped + contextual * contextualWeight);
    }
}
