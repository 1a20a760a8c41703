package com.admissionsrag.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.admissionsrag.exception.ConfigurationException;
import com.admissionsrag.service.store.ChunkStore;
import com.admissionsrag.service.store.InMemoryChunkStore;
import com.admissionsrag.service.store.JdbcChunkStore;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
public class StoreConfig {

    @Bean
    @ConditionalOnProperty(prefix = "admissions-rag.store", name = "type", havingValue = "pgvector")
    public ChunkStore jdbcChunkStore(JdbcTemplate jdbcTemplate,
                                     PlatformTransactionManager transactionManager,
                                     ObjectMapper objectMapper,
                                     AdmissionsRagProperties properties,
                                     @Value("${spring.datasource.url:}") String datasourceUrl) {
        if (datasourceUrl == null || datasourceUrl.isBlank()) {
            throw new ConfigurationException("spring.datasource.url is required when admissions-rag.store.type=pgvector");
        }
        log.info("Chunk store: pgvector table '{}' at {}", properties.getStore().getTable(), datasourceUrl);
        return new JdbcChunkStore(
                jdbcTemplate,
                new TransactionTemplate(transactionManager),
                objectMapper,
                properties.getStore().getTable(),
                properties.getStore().getDimension());
    }

    @Bean
    @ConditionalOnProperty(prefix = "admissions-rag.store", name = "type", havingValue = "memory", matchIfMissing = true)
    public ChunkStore inMemoryChunkStore(AdmissionsRagProperties properties) {
        log.info("Chunk store: in-memory (dimension {})", properties.getStore().getDimension());
        return new InMemoryChunkStore(properties.getStore().getDimension());
    }
}
