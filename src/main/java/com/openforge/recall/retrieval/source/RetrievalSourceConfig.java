package com.openforge.recall.retrieval.source;

import com.openforge.recall.domain.MemoryLane;
import com.openforge.recall.memory.SemanticMemoryIndex;
import com.openforge.recall.repository.MemoryEntryRepository;
import com.openforge.recall.retrieval.RetrievalProperties;
import com.openforge.recall.retrieval.RetrievalSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

/**
 * The seven retrieval sources, in the order they appear in traces.
 *
 *   semantic-canon   vector search, CANON
 *   lexical-canon    keyword search, CANON
 *   semantic-rumor   vector search, RUMOR (THEATER only)
 *   lexical-rumor    keyword search, RUMOR (THEATER only)
 *   podcast          transcript-derived memories
 *   document         document excerpts
 *   training         prior training examples
 */
@Configuration
public class RetrievalSourceConfig {

    /** Rows a sub-store scan reads before scoring. */
    static final int SUB_STORE_SCAN_LIMIT = 200;

    @Bean
    @Order(1)
    public RetrievalSource semanticCanonSource(SemanticMemoryIndex index, RetrievalProperties props) {
        return new SemanticLaneSource("semantic-canon", MemoryLane.CANON, index, props.minSemanticSimilarity());
    }

    @Bean
    @Order(2)
    public RetrievalSource lexicalCanonSource(MemoryEntryRepository repository) {
        return new LexicalLaneSource("lexical-canon", MemoryLane.CANON, repository);
    }

    @Bean
    @Order(3)
    public RetrievalSource semanticRumorSource(SemanticMemoryIndex index, RetrievalProperties props) {
        return new SemanticLaneSource("semantic-rumor", MemoryLane.RUMOR, index, props.minSemanticSimilarity());
    }

    @Bean
    @Order(4)
    public RetrievalSource lexicalRumorSource(MemoryEntryRepository repository) {
        return new LexicalLaneSource("lexical-rumor", MemoryLane.RUMOR, repository);
    }

    @Bean
    @Order(5)
    public RetrievalSource podcastSource(MemoryEntryRepository repository) {
        return new SubStoreSource("podcast", "podcast", repository, SUB_STORE_SCAN_LIMIT);
    }

    @Bean
    @Order(6)
    public RetrievalSource documentSource(MemoryEntryRepository repository) {
        return new SubStoreSource("document", "document", repository, SUB_STORE_SCAN_LIMIT);
    }

    @Bean
    @Order(7)
    public RetrievalSource trainingSource(MemoryEntryRepository repository) {
        return new SubStoreSource("training", "training", repository, SUB_STORE_SCAN_LIMIT);
    }
}
