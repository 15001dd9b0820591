package com.openforge.recall.memory;

import com.openforge.recall.domain.KnowledgeGap;
import com.openforge.recall.repository.KnowledgeGapRepository;
import com.openforge.recall.repository.MemoryEntryRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MemoryWriteBehindTest {

    @Mock private MemoryEntryRepository  entryRepository;
    @Mock private KnowledgeGapRepository gapRepository;

    private ExecutorService   executor;
    private MemoryWriteBehind writeBehind;

    @BeforeEach
    void setUp() {
        executor    = Executors.newSingleThreadExecutor();
        writeBehind = new MemoryWriteBehind(entryRepository, gapRepository, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private void drain() throws InterruptedException {
        executor.shutdown();
        assertTrue(executor.awaitTermination(2, TimeUnit.SECONDS));
    }

    @Test
    void shouldIncrementOnTheWriteExecutor() throws Exception {
        when(entryRepository.incrementRetrievalCount(List.of(1L, 2L))).thenReturn(2);

        writeBehind.recordRetrievals(List.of(1L, 2L));
        drain();

        verify(entryRepository).incrementRetrievalCount(List.of(1L, 2L));
    }

    @Test
    void shouldLogRepositoryFailureWithoutThrowing() throws Exception {
        when(entryRepository.incrementRetrievalCount(any())).thenThrow(new RuntimeException("deadlock"));

        writeBehind.recordRetrievals(List.of(3L));
        drain();

        verify(entryRepository).incrementRetrievalCount(List.of(3L));
    }

    @Test
    void shouldDropRejectedWrites() {
        executor.shutdown();
        assertDoesNotThrow(() -> writeBehind.recordRetrievals(List.of(4L)));
        verifyNoInteractions(entryRepository);
    }

    @Test
    void shouldIgnoreEmptyIds() throws Exception {
        writeBehind.recordRetrievals(List.of());
        drain();
        verifyNoInteractions(entryRepository);
    }

    @Test
    void shouldSaveGaps() throws Exception {
        KnowledgeGap gap = KnowledgeGap.builder()
                .profileId("p1").category("general").priority(KnowledgeGap.Priority.LOW)
                .missingTopics("bowling").queryText("bowling?").build();

        writeBehind.recordGap(gap);
        drain();

        verify(gapRepository).save(gap);
    }
}
