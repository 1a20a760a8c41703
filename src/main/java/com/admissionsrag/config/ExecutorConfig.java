package com.admissionsrag.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.admissionsrag.thread.MdcAwareExecutor;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
public class ExecutorConfig {

    /**
     * Runs per-paraphrase searches and per-turn tool calls.
     */
    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor retrievalExecutor(AdmissionsRagProperties properties) {
        int threads = properties.getRetrieval().getExecutorThreads();
        log.info("Retrieval executor: {} threads", threads);
        return new MdcAwareExecutor(threads, "retrieval");
    }
}
