package com.openforge.recall.memory;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Turns memory content and query text into vectors.
 *
 * Plain HttpClient + Jackson against POST {base-url}/embeddings.  Every vector
 * is checked against the configured dimensions: a model swap that changes the
 * vector length would otherwise poison the index silently.
 *
 * Failures are split for the retry policy:
 *   retryable  network errors, 429, 5xx
 *   permanent  4xx, malformed body, wrong dimensions
 *
 * During retrieval the call runs on a pooled branch thread; cancelling the
 * branch interrupts the request.
 */
@Slf4j
@Component
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingClient {

    private final HttpClient          httpClient;
    private final ObjectMapper        objectMapper;
    private final EmbeddingProperties props;

    public EmbeddingClient(HttpClient httpClient,
                           ObjectMapper objectMapper,
                           EmbeddingProperties props) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.props        = props;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Request(String input, String model, Integer dimensions, String encodingFormat) {}

    record Response(List<Item> data, String model) {
        record Item(int index, List<Float> embedding) {}
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * @param text memory content or query text; whitespace is collapsed and the
     *             input truncated to {@code max-input-chars}
     * @return vector of exactly {@link EmbeddingProperties#dimensions()} floats
     * @throws EmbeddingException when the vector cannot be obtained
     */
    public float[] embedAsArray(String text) {
        String input = prepare(text);
        Integer dims = props.dimensions() > 0 ? props.dimensions() : null;
        String body = serialize(new Request(input, props.model(), dims, "float"));

        log.debug("[Embed] POST /embeddings model={} chars={}", props.model(), input.length());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(props.baseUrl() + "/embeddings"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + props.apiKey())
                .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Embedding call interrupted", false, e);
        } catch (IOException e) {
            throw new EmbeddingException("Embedding endpoint unreachable: " + e.getMessage(), true, e);
        }
        return toVector(response);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    String prepare(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot embed blank text");
        }
        String collapsed = text.strip().replaceAll("\\s+", " ");
        int max = Math.max(1, props.maxInputChars());
        return collapsed.length() > max ? collapsed.substring(0, max) : collapsed;
    }

    private float[] toVector(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            throw new EmbeddingException("Embedding endpoint returned HTTP " + status, true);
        }
        if (status < 200 || status >= 300) {
            throw new EmbeddingException("Embedding endpoint returned HTTP %d: %s"
                    .formatted(status, response.body()), false);
        }

        Response parsed;
        try {
            parsed = objectMapper.readValue(response.body(), Response.class);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Unreadable embedding response", false, e);
        }
        if (parsed.data() == null || parsed.data().isEmpty() || parsed.data().get(0).embedding() == null) {
            throw new EmbeddingException("Embedding response contained no vector", false);
        }

        List<Float> values = parsed.data().get(0).embedding();
        if (props.dimensions() > 0 && values.size() != props.dimensions()) {
            throw new EmbeddingException("Expected %d dimensions from %s, got %d"
                    .formatted(props.dimensions(), props.model(), values.size()), false);
        }
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) vector[i] = values.get(i);
        return vector;
    }

    private String serialize(Request request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to serialize embedding request", false, e);
        }
    }

    // ── Exception ────────────────────────────────────────────────────────────

    public static class EmbeddingException extends RuntimeException {

        private final boolean retryable;

        public EmbeddingException(String message, boolean retryable) {
            super(message);
            this.retryable = retryable;
        }

        public EmbeddingException(String message, boolean retryable, Throwable cause) {
            super(message, cause);
            this.retryable = retryable;
        }

        public boolean isRetryable() {
            return retryable;
        }
    }
}
