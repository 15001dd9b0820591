package com.openforge.recall.memory;

import com.openforge.recall.domain.MemoryLane;
import com.openforge.recall.domain.MemoryType;
import lombok.Builder;
import org.springframework.lang.Nullable;

import java.util.Set;

/**
 * Write command for {@link MemoryStoreService#store}.
 *
 * @param lane         ignored when parentFactId is set: children take the parent's lane
 * @param embedding    precomputed vector; null lets the store embed the content itself
 */
@Builder
public record NewMemory(
        String      profileId,
        String      content,
        MemoryType  type,
        @Nullable MemoryLane lane,
        int         importance,
        int         confidence,
        @Nullable Set<String> keywords,
        @Nullable String source,
        @Nullable String sourceId,
        @Nullable String conversationId,
        @Nullable Long   parentFactId,
        @Nullable float[] embedding
) {}
