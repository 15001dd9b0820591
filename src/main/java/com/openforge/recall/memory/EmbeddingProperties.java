package com.openforge.recall.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * OpenAI-compatible embedding endpoint used for memory vectors and query vectors.
 *
 * agent:
 *   embedding:
 *     base-url: https://api.openai.com/v1
 *     api-key: ${EMBEDDING_API_KEY:sk-placeholder}
 *     model: text-embedding-3-small
 *     dimensions: 768            # must match agent.milvus.vector-dimensions
 *     timeout-seconds: 5
 *     max-input-chars: 8000
 *
 * Query embedding inside a retrieval turn is bounded by the per-source
 * timeout, so timeout-seconds mostly matters on the write path.
 */
@ConfigurationProperties(prefix = "agent.embedding")
public record EmbeddingProperties(
        String baseUrl,
        String apiKey,
        @DefaultValue("text-embedding-3-small") String model,
        @DefaultValue("768")  int dimensions,
        @DefaultValue("5")    int timeoutSeconds,
        @DefaultValue("8000") int maxInputChars
) {

    public EmbeddingProperties {
        if (baseUrl != null && baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
    }
}
