package com.admissionsrag.config;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;

import lombok.extern.slf4j.Slf4j;
import reactor.netty.http.client.HttpClient;

/**
 * HTTP client for the Python model service that hosts the embedding model
 * ({@code /embed}) and the cross-encoder ({@code /rerank}).
 */
@Slf4j
@Configuration
public class ModelServiceConfig {

    private static final int MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

    @Bean
    public WebClient modelServiceWebClient(AdmissionsRagProperties properties) {
        AdmissionsRagProperties.ModelService modelService = properties.getModelService();

        log.info("==============================================");
        log.info("MODEL SERVICE CONFIGURATION");
        log.info("==============================================");
        log.info("  Base URL  : {}", modelService.getBaseUrl());
        log.info("  Dimension : {}", properties.getStore().getDimension());
        log.info("  Timeout   : {}s", modelService.getTimeoutSeconds());
        log.info("==============================================");

        return WebClient.builder()
                .baseUrl(modelService.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(
                        HttpClient.create()
                                .responseTimeout(Duration.ofSeconds(modelService.getTimeoutSeconds()))))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .build();
    }
}
