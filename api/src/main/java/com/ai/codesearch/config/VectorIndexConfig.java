package com.ai.codesearch.config;

import com.ai.codesearch.exception.ConfigurationException;
import com.ai.codesearch.service.vector.InMemoryVectorIndex;
import com.ai.codesearch.service.vector.PgVectorIndex;
import com.ai.codesearch.service.vector.PineconeVectorIndex;
import com.ai.codesearch.service.vector.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Selects the vector index adapter from {@code codesearch.vector-store.type}.
 */
@Configuration
public class VectorIndexConfig {

    private static final Logger log = LoggerFactory.getLogger(VectorIndexConfig.class);
    private static final String TYPE_PROPERTY = "codesearch.vector-store.type";

    @Bean
    @ConditionalOnProperty(name = TYPE_PROPERTY, havingValue = "memory", matchIfMissing = true)
    VectorIndex inMemoryVectorIndex() {
        log.info("[VectorIndexConfig] Using in-memory vector index");
        return new InMemoryVectorIndex();
    }

    @Bean
    @ConditionalOnProperty(name = TYPE_PROPERTY, havingValue = "pgvector")
    VectorIndex pgVectorIndex(JdbcTemplate jdbcTemplate, CodeSearchProperties properties) {
        log.info("[VectorIndexConfig] Using pgvector index, table={}",
                properties.getVectorStore().getPgvector().getTable());
        PgVectorIndex index = new PgVectorIndex(
                jdbcTemplate,
                properties.getVectorStore().getPgvector().getTable(),
                properties.getEmbedding().getDimension());
        index.initializeSchema();
        return index;
    }

    @Bean
    @ConditionalOnProperty(name = TYPE_PROPERTY, havingValue = "pinecone")
    VectorIndex pineconeVectorIndex(CodeSearchProperties properties) {
        CodeSearchProperties.Pinecone pinecone = properties.getVectorStore().getPinecone();
        if (pinecone.getApiKey() == null || pinecone.getApiKey().isBlank()) {
            throw new ConfigurationException("codesearch.vector-store.pinecone.api-key is required when type=pinecone");
        }
        if (pinecone.getHost() == null || pinecone.getHost().isBlank()) {
            throw new ConfigurationException("codesearch.vector-store.pinecone.host is required when type=pinecone");
        }
        log.info("[VectorIndexConfig] Using Pinecone index at {}", pinecone.getHost());

        WebClient webClient = WebClient.builder()
                .baseUrl(pinecone.getHost())
                .defaultHeader(PineconeVectorIndex.API_KEY_HEADER, pinecone.getApiKey())
                .build();
        return new PineconeVectorIndex(webClient, pinecone.getNamespace(), pinecone.getTimeout());
    }
}
