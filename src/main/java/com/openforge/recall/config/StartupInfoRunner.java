package com.openforge.recall.config;

import com.openforge.recall.memory.EmbeddingProperties;
import com.openforge.recall.memory.MilvusProperties;
import com.openforge.recall.retrieval.RetrievalProperties;
import com.openforge.recall.retrieval.RetrievalSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Prints a structured startup summary once the context is ready.
 *
 *   - Database: opens a real JDBC connection and reads the server version
 *   - Milvus: address and collection; connectivity is reported by MilvusConfig
 *   - Embedding: model, dimensions, endpoint, masked API key
 *   - Retrieval: registered sources and the main budgets
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource            dataSource;
    private final EmbeddingProperties   embeddingProperties;
    private final MilvusProperties      milvusProperties;
    private final RetrievalProperties   retrievalProperties;
    private final List<RetrievalSource> sources;
    private final Environment           env;

    @Override
    public void run(ApplicationArguments args) {
        String port        = env.getProperty("server.port", "8080");
        String javaVersion = System.getProperty("java.version");
        String sourceNames = sources.stream().map(RetrievalSource::name).collect(Collectors.joining(", "));

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║            Persona Recall  |  Startup Summary            ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Database                                                ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Vector DB (Milvus)                                      ║
                ║    Enabled        : {}
                ║    Address        : {}:{}
                ║    Collection     : {}  dim={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Embedding                                               ║
                ║    Model          : {}  dim={}
                ║    Endpoint       : {}  key={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Retrieval                                               ║
                ║    Sources        : {}
                ║    Timeout        : {} ms per source, {} threads
                ║    Budget         : {} entries, {} chars
                ║    Rumor policy   : chaos>{} unlimited, else cap {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                port,
                javaVersion,

                checkDatabase(),

                milvusProperties.enabled(),
                milvusProperties.host(), milvusProperties.port(),
                milvusProperties.collectionName(), milvusProperties.vectorDimensions(),

                embeddingProperties.model(),
                embeddingProperties.dimensions(),
                embeddingProperties.baseUrl(),
                maskKey(embeddingProperties.apiKey()),

                sourceNames,
                retrievalProperties.sourceTimeoutMs(), retrievalProperties.executorThreads(),
                retrievalProperties.maxEntries(), retrievalProperties.maxCharacters(),
                retrievalProperties.chaosThreshold(), retrievalProperties.rumorCap()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String checkDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String product = conn.getMetaData().getDatabaseProductName();
            String version = conn.getMetaData().getDatabaseProductVersion();
            // strip credentials from the JDBC URL
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  " + product + " " + version + "  url=" + safeUrl;
        } catch (Exception e) {
            return "✘ FAILED: " + e.getMessage();
        }
    }

    /** First 6 chars + "..." + last 4, or "(not set)" for blanks and placeholders. */
    static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("sk-placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
