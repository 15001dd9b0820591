package com.openforge.recall.memory;

import io.milvus.v2.client.ConnectConfig;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Milvus client + collection bootstrap.
 *
 * Collection schema  (persona_memories):
 * ┌──────────────────┬─────────────────┬─────────────────────────────────────┐
 * │ Field            │ Type            │ Notes                               │
 * ├──────────────────┼─────────────────┼─────────────────────────────────────┤
 * │ entry_id         │ INT64 PK        │ = memory_entries.id (no auto id)    │
 * │ profile_id       │ VARCHAR(64)     │ owning persona profile              │
 * │ lane             │ VARCHAR(16)     │ CANON / RUMOR                       │
 * │ embedding        │ FLOAT_VECTOR    │ dim = vectorDimensions              │
 * └──────────────────┴─────────────────┴─────────────────────────────────────┘
 *
 * Only ids and filter columns live in Milvus; content is hydrated from MySQL
 * so the relational row stays the single source of truth.
 *
 * Index: HNSW, metric COSINE.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(MilvusProperties.class)
@ConditionalOnProperty(name = "agent.milvus.enabled", havingValue = "true", matchIfMissing = true)
public class MilvusConfig {

    @Bean(destroyMethod = "close")
    @Nullable
    public MilvusClientV2 milvusClient(MilvusProperties props) {
        log.info("[Milvus] Connecting to {}:{}...", props.host(), props.port());
        try {
            MilvusClientV2 client = new MilvusClientV2(
                    ConnectConfig.builder()
                            .uri("http://%s:%d".formatted(props.host(), props.port()))
                            .connectTimeoutMs(10_000)
                            .build()
            );
            log.info("[Milvus] Connected.");
            ensureCollectionExists(client, props);
            return client;
        } catch (Exception e) {
            log.warn("[Milvus] Connection failed; semantic search falls back to local cosine scan. " +
                     "Cause: {}. Set agent.milvus.enabled=false to skip the attempt.", e.getMessage());
            return null;
        }
    }

    private void ensureCollectionExists(MilvusClientV2 client, MilvusProperties props) {
        String name = props.collectionName();

        boolean exists = client.hasCollection(
                HasCollectionReq.builder().collectionName(name).build());
        if (exists) {
            log.info("[Milvus] Collection '{}' already exists.", name);
            return;
        }

        log.info("[Milvus] Creating collection '{}' (dim={})...", name, props.vectorDimensions());

        CreateCollectionReq.CollectionSchema schema =
                CreateCollectionReq.CollectionSchema.builder().build();

        schema.addField(AddFieldReq.builder()
                .fieldName("entry_id")
                .dataType(DataType.Int64)
                .isPrimaryKey(true)
                .autoID(false)
                .build());

        schema.addField(AddFieldReq.builder()
                .fieldName("profile_id")
                .dataType(DataType.VarChar)
                .maxLength(64)
                .build());

        schema.addField(AddFieldReq.builder()
                .fieldName("lane")
                .dataType(DataType.VarChar)
                .maxLength(16)
                .build());

        schema.addField(AddFieldReq.builder()
                .fieldName("embedding")
                .dataType(DataType.FloatVector)
                .dimension(props.vectorDimensions())
                .build());

        IndexParam vectorIndex = IndexParam.builder()
                .fieldName("embedding")
                .indexType(IndexParam.IndexType.HNSW)
                .metricType(IndexParam.MetricType.COSINE)
                .extraParams(Map.of("M", 16, "efConstruction", 256))
                .build();

        IndexParam profileIndex = IndexParam.builder()
                .fieldName("profile_id")
                .indexType(IndexParam.IndexType.TRIE)
                .build();

        // every search filters on both profile_id and lane
        IndexParam laneIndex = IndexParam.builder()
                .fieldName("lane")
                .indexType(IndexParam.IndexType.TRIE)
                .build();

        client.createCollection(CreateCollectionReq.builder()
                .collectionName(name)
                .collectionSchema(schema)
                .indexParams(List.of(vectorIndex, profileIndex, laneIndex))
                .build());

        log.info("[Milvus] Collection '{}' created.", name);
    }
}
