package com.openforge.recall.retrieval;

import com.openforge.recall.memory.ScoredMemory;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans one query out to every applicable {@link RetrievalSource} at once.
 *
 * Flow:
 *
 *   applicable sources (max 7)
 *        │  one Branch each, wrapped in the source's circuit breaker
 *        ▼
 *   retrievalExecutor.submit(branch)          shared by all concurrent turns
 *        │
 *        ▼
 *   per branch:  wait for a thread   (queue-wait-ms from the start of the turn)
 *                then wait for hits  (source-timeout-ms from when the branch started)
 *        │
 *        ▼
 *   per-source outcome  →  hits of the OK branches  →  retrieval method label
 *
 * The timeout clock of a branch starts when a pool thread picks it up, so
 * time spent queued behind other turns never counts as the source being
 * slow.  A branch still queued after queue-wait-ms is cancelled and reported
 * NOT_STARTED.  Deadlines are absolute, so waiting on branches one after the
 * other on the caller thread does not stretch them.
 *
 * Every branch returns its own list; nothing is shared between branches
 * until the merge on the calling thread.  Interrupting the caller cancels
 * every in-flight branch.
 */
@Slf4j
@Service
public class HybridSearchEngine {

    static final int MAX_SOURCES = 7;

    private final List<RetrievalSource> sources;
    private final ExecutorService        executor;
    private final CircuitBreakerRegistry breakers;
    private final RetrievalProperties    props;

    public HybridSearchEngine(List<RetrievalSource> sources,
                              @Qualifier("retrievalExecutor") ExecutorService executor,
                              CircuitBreakerRegistry breakers,
                              RetrievalProperties props) {
        if (sources.size() > MAX_SOURCES) {
            throw new IllegalArgumentException(
                    "At most " + MAX_SOURCES + " retrieval sources are supported, got " + sources.size());
        }
        this.sources  = List.copyOf(sources);
        this.executor = executor;
        this.breakers = breakers;
        this.props    = props;
    }

    /** One source call.  Records when a pool thread actually picked it up. */
    private static final class Branch implements Callable<List<ScoredMemory>> {

        private final RetrievalSource source;
        private final CircuitBreaker  breaker;
        private final RetrievalQuery  query;
        private final CountDownLatch  started = new CountDownLatch(1);
        private volatile long         startedNanos;

        Branch(RetrievalSource source, CircuitBreaker breaker, RetrievalQuery query) {
            this.source  = source;
            this.breaker = breaker;
            this.query   = query;
        }

        @Override
        public List<ScoredMemory> call() throws Exception {
            startedNanos = System.nanoTime();
            started.countDown();
            List<ScoredMemory> hits = breaker.executeCallable(() -> source.retrieve(query));
            return hits == null ? List.of() : hits;
        }

        boolean hasStarted() {
            return started.getCount() == 0;
        }

        long elapsedMs() {
            return hasStarted() ? HybridSearchEngine.elapsedMs(startedNanos) : 0;
        }
    }

    public SearchResult search(RetrievalQuery query) {
        List<RetrievalSource> active = sources.stream().filter(s -> s.appliesTo(query)).toList();
        if (active.isEmpty()) return SearchResult.empty();

        long turnStarted = System.nanoTime();
        List<Branch>                     branches = new ArrayList<>(active.size());
        List<Future<List<ScoredMemory>>> futures  = new ArrayList<>(active.size());
        for (RetrievalSource source : active) {
            Branch branch = new Branch(source, breakers.circuitBreaker(source.name()), query);
            branches.add(branch);
            try {
                futures.add(executor.submit(branch));
            } catch (RejectedExecutionException e) {
                futures.add(null);
            }
        }

        long queueDeadline = turnStarted + TimeUnit.MILLISECONDS.toNanos(props.queueWaitMs());
        List<SourceHit>     hits     = new ArrayList<>();
        List<SourceOutcome> outcomes = new ArrayList<>(active.size());
        try {
            for (int i = 0; i < branches.size(); i++) {
                outcomes.add(settle(branches.get(i), futures.get(i), queueDeadline, hits));
            }
        } catch (InterruptedException e) {
            for (Future<?> f : futures) {
                if (f != null) f.cancel(true);
            }
            Thread.currentThread().interrupt();
            log.warn("[Retrieval] Search for profile {} interrupted; all {} sources cancelled",
                    query.profileId(), active.size());
            List<SourceOutcome> cancelled = active.stream()
                    .map(s -> new SourceOutcome(s.name(), s.kind(), SourceOutcome.Status.CANCELLED,
                            0, elapsedMs(turnStarted), "interrupted"))
                    .toList();
            return new SearchResult(List.of(), cancelled, SearchResult.methodFor(cancelled));
        }

        String method = SearchResult.methodFor(outcomes);
        log.debug("[Retrieval] {} sources settled in {} ms → {} hits, method={}",
                active.size(), elapsedMs(turnStarted), hits.size(), method);
        return new SearchResult(hits, outcomes, method);
    }

    private SourceOutcome settle(Branch branch, Future<List<ScoredMemory>> future,
                                 long queueDeadline, List<SourceHit> sink) throws InterruptedException {
        RetrievalSource source = branch.source;
        if (future == null) {
            log.warn("[Retrieval] Source '{}' rejected by the retrieval executor", source.name());
            return notStarted(source, "rejected by executor");
        }

        long queueLeft = queueDeadline - System.nanoTime();
        if (!branch.started.await(Math.max(0, queueLeft), TimeUnit.NANOSECONDS)) {
            if (future.cancel(true)) {
                if (!branch.hasStarted()) {
                    log.warn("[Retrieval] Source '{}' waited {} ms for a retrieval thread; skipped",
                            source.name(), props.queueWaitMs());
                    return notStarted(source, "no retrieval thread within " + props.queueWaitMs() + " ms");
                }
                return timedOut(source, branch);
            }
            // finished between the await and the cancel: fall through and collect it
        }

        long deadline = branch.startedNanos + TimeUnit.MILLISECONDS.toNanos(props.sourceTimeoutMs());
        try {
            List<ScoredMemory> found = future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            int limit = Math.max(0, props.perSourceLimit());
            int taken = 0;
            for (ScoredMemory hit : found) {
                if (taken == limit) break;
                if (hit == null || hit.memory() == null) continue;
                sink.add(new SourceHit(hit.memory(), hit.score(), source.name(), source.kind()));
                taken++;
            }
            return SourceOutcome.ok(source.name(), source.kind(), taken, branch.elapsedMs());
        } catch (TimeoutException e) {
            future.cancel(true);
            return timedOut(source, branch);
        } catch (CancellationException e) {
            return new SourceOutcome(source.name(), source.kind(), SourceOutcome.Status.CANCELLED,
                    0, branch.elapsedMs(), "cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String reason = cause instanceof CallNotPermittedException
                    ? "circuit open"
                    : cause.getClass().getSimpleName() + ": " + cause.getMessage();
            log.warn("[Retrieval] Source '{}' failed: {}", source.name(), reason);
            return SourceOutcome.failed(source.name(), source.kind(), branch.elapsedMs(), reason);
        }
    }

    private SourceOutcome timedOut(RetrievalSource source, Branch branch) {
        log.warn("[Retrieval] Source '{}' timed out after {} ms", source.name(), props.sourceTimeoutMs());
        return new SourceOutcome(source.name(), source.kind(), SourceOutcome.Status.TIMED_OUT,
                0, branch.elapsedMs(), "timed out");
    }

    private static SourceOutcome notStarted(RetrievalSource source, String reason) {
        return new SourceOutcome(source.name(), source.kind(), SourceOutcome.Status.NOT_STARTED, 0, 0, reason);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
