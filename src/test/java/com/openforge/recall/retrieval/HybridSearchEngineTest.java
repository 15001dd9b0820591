package com.openforge.recall.retrieval;

import com.openforge.recall.memory.ScoredMemory;
import com.openforge.recall.persona.PersonaMode;
import com.openforge.recall.persona.PersonaState;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static com.openforge.recall.retrieval.Memories.*;
import static com.openforge.recall.retrieval.StubSource.*;
import static org.junit.jupiter.api.Assertions.*;

class HybridSearchEngineTest {

    private ExecutorService        executor;
    private CircuitBreakerRegistry breakers;
    private RetrievalProperties    props;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(8);
        breakers = CircuitBreakerRegistry.ofDefaults();
        props    = RetrievalProperties.defaults().withSourceTimeoutMs(200);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private HybridSearchEngine engine(RetrievalSource... sources) {
        return new HybridSearchEngine(List.of(sources), executor, breakers, props);
    }

    @Test
    void shouldMergeAllSourcesWhenEverythingAnswers() {
        SearchResult result = engine(
                semantic("semantic-canon", () -> hits(1, 2)),
                lexical("lexical-canon", () -> hits(2, 3))).search(query(List.of("pizza")));

        assertEquals(SearchResult.HYBRID, result.retrievalMethod());
        assertEquals(4, result.hits().size());
        assertTrue(result.outcomes().stream().allMatch(SourceOutcome::ok));
    }

    @Test
    void shouldFallBackToKeywordsWhenSemanticSourceIsSlow() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        SearchResult result = engine(
                semantic("semantic-canon", () -> {
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException e) {
                        interrupted.countDown();
                        throw e;
                    }
                    return hits(99);
                }),
                lexical("lexical-canon", () -> hits(1, 2, 3))).search(query(List.of("pizza")));

        assertEquals(SearchResult.KEYWORD_FALLBACK, result.retrievalMethod());
        assertEquals(List.of(1L, 2L, 3L), result.hits().stream().map(h -> h.memory().id()).toList());
        assertEquals(SourceOutcome.Status.TIMED_OUT, result.outcomes().get(0).status());
        assertEquals(SourceOutcome.Status.OK, result.outcomes().get(1).status());
        assertTrue(interrupted.await(2, TimeUnit.SECONDS), "timed-out branch must be cancelled");
    }

    @Test
    void shouldContributeNothingFromFailingSource() {
        SearchResult result = engine(
                semantic("semantic-canon", () -> { throw new IllegalStateException("embedding down"); }),
                lexical("lexical-canon", () -> hits(4))).search(query(List.of("pizza")));

        assertEquals(SearchResult.KEYWORD_FALLBACK, result.retrievalMethod());
        SourceOutcome failed = result.outcomes().get(0);
        assertEquals(SourceOutcome.Status.FAILED, failed.status());
        assertTrue(failed.error().contains("embedding down"));
        assertEquals(1, result.hits().size());
    }

    @Test
    void shouldLabelSemanticOnlyAndDegradedTurns() {
        SearchResult semanticOnly = engine(
                semantic("semantic-canon", () -> hits(1)),
                lexical("lexical-canon", () -> { throw new RuntimeException("db"); })).search(query(List.of("x1")));
        assertEquals(SearchResult.SEMANTIC_ONLY, semanticOnly.retrievalMethod());

        SearchResult degraded = engine(
                semantic("semantic-canon", () -> { throw new RuntimeException("a"); }),
                lexical("lexical-canon", () -> { throw new RuntimeException("b"); })).search(query(List.of("x1")));
        assertEquals(SearchResult.DEGRADED, degraded.retrievalMethod());
        assertTrue(degraded.hits().isEmpty());
    }

    @Test
    void shouldRunRumorSourcesOnlyInTheater() {
        HybridSearchEngine engine = engine(
                lexical("lexical-canon", () -> hits(1)),
                new StubSource("lexical-rumor", SourceKind.LEXICAL, true, () -> hits(2)));

        SearchResult normal = engine.search(query(List.of("pizza")));
        assertEquals(List.of("lexical-canon"), normal.outcomes().stream().map(SourceOutcome::source).toList());

        RetrievalQuery theater = query("pizza", List.of("pizza"), QueryIntent.GENERAL, null,
                PersonaState.of(90, PersonaMode.STREAMING), ZoneState.THEATER);
        assertEquals(2, engine.search(theater).outcomes().size());
    }

    @Test
    void shouldFailFastWhenCircuitIsOpen() {
        breakers.circuitBreaker("semantic-canon").transitionToOpenState();
        SearchResult result = engine(
                semantic("semantic-canon", () -> hits(1)),
                lexical("lexical-canon", () -> hits(2))).search(query(List.of("pizza")));

        assertEquals(SourceOutcome.Status.FAILED, result.outcomes().get(0).status());
        assertEquals("circuit open", result.outcomes().get(0).error());
        assertEquals(SearchResult.KEYWORD_FALLBACK, result.retrievalMethod());
    }

    @Test
    void shouldCancelEveryBranchWhenCallerIsInterrupted() throws Exception {
        props = RetrievalProperties.defaults().withSourceTimeoutMs(10_000);
        CountDownLatch started = new CountDownLatch(2);
        CountDownLatch cancelled = new CountDownLatch(2);
        Callable<List<ScoredMemory>> blocking = () -> {
            started.countDown();
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                cancelled.countDown();
                throw e;
            }
            return List.of();
        };
        HybridSearchEngine engine = engine(semantic("semantic-canon", blocking), lexical("lexical-canon", blocking));

        AtomicReference<SearchResult> result = new AtomicReference<>();
        AtomicReference<Boolean> flagKept = new AtomicReference<>();
        Thread caller = new Thread(() -> {
            result.set(engine.search(query(List.of("pizza"))));
            flagKept.set(Thread.currentThread().isInterrupted());
        });
        caller.start();
        assertTrue(started.await(2, TimeUnit.SECONDS));
        caller.interrupt();
        caller.join(2_000);

        assertFalse(caller.isAlive());
        assertTrue(cancelled.await(2, TimeUnit.SECONDS), "branches must be interrupted");
        assertTrue(flagKept.get());
        assertTrue(result.get().outcomes().stream()
                .allMatch(o -> o.status() == SourceOutcome.Status.CANCELLED));
        assertEquals(SearchResult.DEGRADED, result.get().retrievalMethod());
    }

    @Test
    void shouldReportNoneWithoutApplicableSources() {
        SearchResult result = engine(new StubSource("lexical-rumor", SourceKind.LEXICAL, true, () -> List.of()))
                .search(query(List.of("pizza")));
        assertEquals(SearchResult.NONE, result.retrievalMethod());
        assertTrue(result.outcomes().isEmpty());
    }

    private static StubSource sleepy(String name, long sleepMs, long id) {
        return lexical(name, () -> {
            Thread.sleep(sleepMs);
            return hits(id);
        });
    }

    @Test
    void shouldNotCountQueueTimeAgainstTheSourceTimeout() throws Exception {
        props = RetrievalProperties.defaults();
        List<RetrievalSource> seven = new ArrayList<>();
        for (int i = 0; i < 7; i++) seven.add(sleepy("source-" + i, 200, i + 1));
        HybridSearchEngine engine = new HybridSearchEngine(seven, executor, breakers, props);

        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            Future<SearchResult> first  = callers.submit(() -> engine.search(query(List.of("pizza"))));
            Future<SearchResult> second = callers.submit(() -> engine.search(query(List.of("pizza"))));

            for (SearchResult result : List.of(first.get(5, TimeUnit.SECONDS), second.get(5, TimeUnit.SECONDS))) {
                assertEquals(7, result.outcomes().size());
                assertTrue(result.outcomes().stream().allMatch(SourceOutcome::ok),
                        () -> "statuses: " + result.outcomes().stream().map(SourceOutcome::status).toList());
                assertEquals(7, result.hits().size());
            }
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void shouldReportBranchesThatNeverGotAThreadAsNotStarted() throws Exception {
        executor.shutdownNow();
        executor = Executors.newSingleThreadExecutor();
        props = RetrievalProperties.defaults().withSourceTimeoutMs(2_000).withQueueWaitMs(100);
        CountDownLatch release = new CountDownLatch(1);
        executor.submit(() -> release.await(5, TimeUnit.SECONDS));

        try {
            SearchResult result = engine(sleepy("lexical-canon", 0, 1)).search(query(List.of("pizza")));

            SourceOutcome skipped = result.outcomes().get(0);
            assertEquals(SourceOutcome.Status.NOT_STARTED, skipped.status());
            assertEquals(0, skipped.elapsedMs());
            assertTrue(result.hits().isEmpty());
            assertEquals(SearchResult.DEGRADED, result.retrievalMethod());
        } finally {
            release.countDown();
        }
    }

    @Test
    void shouldRejectMoreThanSevenSources() {
        StubSource s = lexical("s", () -> List.of());
        assertThrows(IllegalArgumentException.class,
                () -> new HybridSearchEngine(List.of(s, s, s, s, s, s, s, s), executor, breakers, props));
    }
}
