package com.openforge.recall.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Connection parameters for the Milvus vector index.
 *
 * application.yml:
 *
 * agent:
 *   milvus:
 *     enabled: true
 *     host: localhost
 *     port: 19530
 *     collection-name: persona_memories
 *     vector-dimensions: 768
 */
@ConfigurationProperties(prefix = "agent.milvus")
public record MilvusProperties(
        @DefaultValue("true")             boolean enabled,
        @DefaultValue("localhost")        String  host,
        @DefaultValue("19530")            int     port,
        @DefaultValue("persona_memories") String  collectionName,
        @DefaultValue("768")              int     vectorDimensions
) {}
