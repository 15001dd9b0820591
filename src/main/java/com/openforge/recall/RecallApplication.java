package com.openforge.recall;

import com.openforge.recall.memory.MilvusProperties;
import com.openforge.recall.retrieval.RetrievalProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

// MilvusProperties is registered here so it binds even when the conditional
// Milvus beans are switched off.
@SpringBootApplication
@EnableConfigurationProperties({MilvusProperties.class, RetrievalProperties.class})
public class RecallApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecallApplication.class, args);
    }
}
