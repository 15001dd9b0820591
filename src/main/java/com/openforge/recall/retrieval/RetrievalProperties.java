package com.openforge.recall.retrieval;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tunables for the retrieval pipeline.
 *
 * application.yml:
 *
 * persona:
 *   retrieval:
 *     max-entries: 15
 *     max-characters: 6000
 *     source-timeout-ms: 300
 *     per-source-limit: 20
 *     rumor-cap: 3
 *     chaos-threshold: 70
 *     min-canon-confidence: 60
 *     queue-wait-ms: 1000        # a branch not started by then is reported NOT_STARTED
 *     executor-threads: 32       # seven branches per turn, shared by concurrent turns
 *     history-messages: 3
 *     max-history-keywords: 3
 *     weights:
 *       similarity: 1.2
 *       contextual: 0.3
 *
 * The scoring weights are empirical.  They are exposed here so they can be
 * tuned against recorded turns without a redeploy.
 */
@ConfigurationProperties(prefix = "persona.retrieval")
public record RetrievalProperties(
        @DefaultValue("15")   int     maxEntries,
        @DefaultValue("6000") int     maxCharacters,
        @DefaultValue("300")  long    sourceTimeoutMs,
        @DefaultValue("20")   int     perSourceLimit,
        @DefaultValue("3")    int     rumorCap,
        @DefaultValue("70")   int     chaosThreshold,
        @DefaultValue("60")   int     minCanonConfidence,
        @DefaultValue("0.35") double  minSemanticSimilarity,
        @DefaultValue("8")    int     maxBaseKeywords,
        @DefaultValue("12")   int     maxEnhancedKeywords,
        @DefaultValue("true") boolean enforceDistinctTypes,
        @DefaultValue("32")   int     executorThreads,
        @DefaultValue("1000") long    queueWaitMs,
        @DefaultValue("3")    int     historyMessages,
        @DefaultValue("3")    int     maxHistoryKeywords,
        @DefaultValue         Weights weights,
        @DefaultValue         Gap     gap
) {

    /**
     * @param similarity            multiplier on semantic similarity in the base score
     * @param importance            multiplier on raw importance (0 – 100) in the base score
     * @param confidence            multiplier on raw confidence (0 – 100) in the base score
     * @param contextual            multiplier on the summed contextual bonuses
     * @param sameConversation      bonus when the memory came from the current conversation
     * @param intentMatch           bonus when the memory type fits the detected intent
     * @param importanceBonus       bonus scaled by importance / 100
     * @param confidenceBonus       bonus scaled by confidence / 100
     * @param keywordMatch          bonus per matching query keyword
     * @param maxKeywordBonus       cap on the summed keyword bonus
     * @param sameTypePenalty       diversity penalty per accepted entry of the same type
     * @param keywordOverlapPenalty diversity penalty per accepted entry sharing a keyword
     */
    public record Weights(
            @DefaultValue("1.2")   double similarity,
            @DefaultValue("0.1")   double importance,
            @DefaultValue("0.001") double confidence,
            @DefaultValue("0.3")   double contextual,
            @DefaultValue("0.5")   double sameConversation,
            @DefaultValue("0.4")   double intentMatch,
            @DefaultValue("0.25")  double importanceBonus,
            @DefaultValue("0.10")  double confidenceBonus,
            @DefaultValue("0.10")  double keywordMatch,
            @DefaultValue("0.3")   double maxKeywordBonus,
            @DefaultValue("0.1")   double sameTypePenalty,
            @DefaultValue("0.2")   double keywordOverlapPenalty
    ) {
        public static Weights defaults() {
            return new Weights(1.2, 0.1, 0.001, 0.3, 0.5, 0.4, 0.25, 0.10, 0.10, 0.3, 0.1, 0.2);
        }
    }

    /**
     * @param enabled             run gap detection at all
     * @param minConfidence       CANON entries below this do not count as coverage
     * @param minTopicLength      keywords shorter than this are not treated as topics
     * @param minCoveredEntries   fewer covering entries than this makes a gap likely
     */
    public record Gap(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("60")   int     minConfidence,
            @DefaultValue("5")    int     minTopicLength,
            @DefaultValue("5")    int     minCoveredEntries
    ) {
        public static Gap defaults() {
            return new Gap(true, 60, 5, 5);
        }
    }

    public static RetrievalProperties defaults() {
        return new RetrievalProperties(15, 6000, 300, 20, 3, 70, 60, 0.35, 8, 12, true, 32, 1000, 3, 3,
                Weights.defaults(), Gap.defaults());
    }

    public RetrievalProperties withMaxEntries(int value) {
        return new RetrievalProperties(value, maxCharacters, sourceTimeoutMs, perSourceLimit, rumorCap,
                chaosThreshold, minCanonConfidence, minSemanticSimilarity, maxBaseKeywords,
                maxEnhancedKeywords, enforceDistinctTypes, executorThreads, queueWaitMs, historyMessages,
                maxHistoryKeywords, weights, gap);
    }

    public RetrievalProperties withMaxCharacters(int value) {
        return new RetrievalProperties(maxEntries, value, sourceTimeoutMs, perSourceLimit, rumorCap,
                chaosThreshold, minCanonConfidence, minSemanticSimilarity, maxBaseKeywords,
                maxEnhancedKeywords, enforceDistinctTypes, executorThreads, queueWaitMs, historyMessages,
                maxHistoryKeywords, weights, gap);
    }

    public RetrievalProperties withSourceTimeoutMs(long value) {
        return new RetrievalProperties(maxEntries, maxCharacters, value, perSourceLimit, rumorCap,
                chaosThreshold, minCanonConfidence, minSemanticSimilarity, maxBaseKeywords,
                maxEnhancedKeywords, enforceDistinctTypes, executorThreads, queueWaitMs, historyMessages,
                maxHistoryKeywords, weights, gap);
    }

    public RetrievalProperties withDistinctTypes(boolean value) {
        return new RetrievalProperties(maxEntries, maxCharacters, sourceTimeoutMs, perSourceLimit, rumorCap,
                chaosThreshold, minCanonConfidence, minSemanticSimilarity, maxBaseKeywords,
                maxEnhancedKeywords, value, executorThreads, queueWaitMs, historyMessages,
                maxHistoryKeywords, weights, gap);
    }

    public RetrievalProperties withQueueWaitMs(long value) {
        return new RetrievalProperties(maxEntries, maxCharacters, sourceTimeoutMs, perSourceLimit, rumorCap,
                chaosThreshold, minCanonConfidence, minSemanticSimilarity, maxBaseKeywords,
                maxEnhancedKeywords, enforceDistinctTypes, executorThreads, value, historyMessages,
                maxHistoryKeywords, weights, gap);
    }
}
