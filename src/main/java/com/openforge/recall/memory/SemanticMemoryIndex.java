package com.openforge.recall.memory;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.openforge.recall.domain.MemoryEntry;
import com.openforge.recall.domain.MemoryLane;
import com.openforge.recall.repository.MemoryEntryRepository;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.request.UpsertReq;
import io.milvus.v2.service.vector.request.data.FloatVec;
import io.milvus.v2.service.vector.response.SearchResp;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Semantic similarity index over memory embeddings.
 *
 * Two backends:
 *
 *   Milvus: ANN search (HNSW / COSINE) when a client is connected.
 *                    Milvus holds ids only; rows are hydrated from MySQL.
 *   local scan: brute-force cosine over rows that carry an embedding,
 *                    used when agent.milvus.enabled=false or Milvus is down.
 *
 * Both return hits sorted by similarity descending, ties by entry id.
 */
@Slf4j
@Service
public class SemanticMemoryIndex {

    /** May be null when agent.milvus.enabled=false or Milvus is unreachable. */
    private final MilvusClientV2        milvusClient;
    private final MilvusProperties      milvusProps;
    private final MemoryEntryRepository repository;

    @Autowired
    public SemanticMemoryIndex(@Nullable MilvusClientV2 milvusClient,
                               MilvusProperties milvusProps,
                               MemoryEntryRepository repository) {
        this.milvusClient = milvusClient;
        this.milvusProps  = milvusProps;
        this.repository   = repository;
        if (milvusClient == null) {
            log.warn("[Memory] MilvusClientV2 is not available; using local cosine scan for semantic search.");
        }
    }

    // ── Search ───────────────────────────────────────────────────────────────

    /**
     * @param vector        query embedding
     * @param k             max hits
     * @param profileId     owning profile
     * @param lane          lane to search
     * @param minSimilarity hits below this cosine similarity are dropped
     */
    public List<ScoredMemory> similaritySearch(float[] vector, int k, String profileId,
                                               MemoryLane lane, double minSimilarity) {
        if (vector == null || vector.length == 0 || k <= 0) return List.of();
        List<ScoredMemory> hits = milvusClient != null
                ? searchMilvus(vector, k, profileId, lane)
                : searchLocal(vector, k, profileId, lane);
        List<ScoredMemory> kept = new ArrayList<>(hits.size());
        for (ScoredMemory hit : hits) {
            if (hit.score() >= minSimilarity) kept.add(hit);
        }
        return kept;
    }

    // ── Write ────────────────────────────────────────────────────────────────

    /** Mirror an entry's embedding into Milvus.  No-op without a client or vector. */
    public void index(MemoryEntry entry) {
        if (milvusClient == null || entry.getEmbedding() == null || entry.getId() == null) return;
        try {
            JsonObject row = new JsonObject();
            row.addProperty("entry_id",   entry.getId());
            row.addProperty("profile_id", entry.getProfileId());
            row.addProperty("lane",       entry.getLane().name());
            JsonArray embedding = new JsonArray();
            for (float f : entry.getEmbedding()) embedding.add(f);
            row.add("embedding", embedding);

            milvusClient.upsert(UpsertReq.builder()
                    .collectionName(milvusProps.collectionName())
                    .data(List.of(row))
                    .build());
            log.debug("[Memory] Indexed entry {} in '{}'", entry.getId(), milvusProps.collectionName());
        } catch (Exception e) {
            log.warn("[Memory] Failed to index entry {} in Milvus: {}", entry.getId(), e.getMessage());
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<ScoredMemory> searchMilvus(float[] vector, int k, String profileId, MemoryLane lane) {
        List<Float> query = new ArrayList<>(vector.length);
        for (float f : vector) query.add(f);

        SearchResp resp = milvusClient.search(SearchReq.builder()
                .collectionName(milvusProps.collectionName())
                .data(List.of(new FloatVec(query)))
                .annsField("embedding")
                .topK(k)
                .filter("profile_id == \"%s\" and lane == \"%s\"".formatted(escape(profileId), lane.name()))
                .outputFields(List.of("entry_id"))
                .build());

        Map<Long, Double> scores = new LinkedHashMap<>();
        if (resp == null || resp.getSearchResults() == null) return List.of();
        for (List<SearchResp.SearchResult> row : resp.getSearchResults()) {
            for (SearchResp.SearchResult hit : row) {
                Object rawId = hit.getId();
                if (!(rawId instanceof Number n)) continue;
                Float s = hit.getScore();
                scores.putIfAbsent(n.longValue(), s == null ? 0.0 : s.doubleValue());
            }
        }
        if (scores.isEmpty()) return List.of();

        Map<Long, MemoryEntry> rows = new HashMap<>();
        for (MemoryEntry e : repository.findAllById(scores.keySet())) rows.put(e.getId(), e);

        List<ScoredMemory> out = new ArrayList<>(scores.size());
        scores.forEach((id, score) -> {
            MemoryEntry e = rows.get(id);
            // Milvus can lag behind deletes; skip ids that no longer resolve.
            if (e != null && e.getLane() == lane) out.add(new ScoredMemory(MemorySnapshot.of(e), score));
        });
        out.sort(BY_SCORE);
        return out;
    }

    private List<ScoredMemory> searchLocal(float[] vector, int k, String profileId, MemoryLane lane) {
        List<ScoredMemory> out = new ArrayList<>();
        for (MemoryEntry e : repository.findEmbedded(profileId, lane)) {
            float[] other = e.getEmbedding();
            if (other == null || other.length != vector.length) continue;
            out.add(new ScoredMemory(MemorySnapshot.of(e), cosine(vector, other)));
        }
        out.sort(BY_SCORE);
        return out.size() > k ? new ArrayList<>(out.subList(0, k)) : out;
    }

    static double cosine(float[] a, float[] b) {
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            na  += (double) a[i] * a[i];
            nb  += (double) b[i] * b[i];
        }
        if (na == 0 || nb == 0) return 0.0;
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }

    private static String escape(String value) {
        return value == null ? "" : value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static final Comparator<ScoredMemory> BY_SCORE =
            Comparator.comparingDouble(ScoredMemory::score).reversed()
                    .thenComparingLong(h -> h.memory().id());
}
