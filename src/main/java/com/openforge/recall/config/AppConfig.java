package com.openforge.recall.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openforge.recall.retrieval.RetrievalProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - retrievalExecutor    → bounded pool that runs the retrieval source branches
 *  - memoryWriteExecutor  → fire-and-forget counter and gap writes, off the response path
 *  - Java HttpClient      → the only HTTP engine (embedding calls); no WebClient, no RestTemplate
 *  - Jackson ObjectMapper → snake_case ↔ camelCase, Java time, tolerant deserialization
 *
 * Both executors are named so injection points can use @Qualifier, and both
 * run daemon threads with readable names for thread dumps.
 */
@Configuration
public class AppConfig {

    private static final int WRITE_QUEUE_CAPACITY = 1_000;

    /**
     * Fixed pool sized by persona.retrieval.executor-threads, shared by all
     * concurrent turns.  One turn uses up to seven threads; a branch that
     * waits longer than queue-wait-ms for one is skipped.  Branches that
     * overrun their timeout are interrupted so threads return promptly.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService retrievalExecutor(RetrievalProperties props) {
        return Executors.newFixedThreadPool(Math.max(1, props.executorThreads()), named("retrieval-"));
    }

    /**
     * Single writer with a bounded queue.  When the queue is full new writes
     * are rejected and the caller logs and drops them.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService memoryWriteExecutor() {
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(WRITE_QUEUE_CAPACITY),
                named("memory-write-"),
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Single, shared HttpClient instance.
     * 5 s connect timeout; per-request timeouts are set at the call site.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper for the embedding API and the REST surface:
     *  - snake_case property names (encoding_format, retrieval_method …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
