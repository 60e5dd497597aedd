package com.example.legalrag.config;

import com.example.legalrag.client.HashEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;

/**
 * Replaces the remote embedding model with {@link HashEmbeddingModel} so seeding runs without an API key.
 */
@Slf4j
@Configuration
@Profile("offline")
public class OfflineEmbeddingConfig {

    @Bean
    @Primary
    public EmbeddingModel hashEmbeddingModel(EmbeddingProperties props) {
        log.info("Offline profile: using hash embeddings ({} dimensions)", props.getDim());
        return new HashEmbeddingModel(props.getDim());
    }
}
