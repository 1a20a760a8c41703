package com.admissionsrag.config;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import com.admissionsrag.exception.ConfigurationException;
import com.admissionsrag.model.PageType;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "admissions-rag")
public class AdmissionsRagProperties {

    private Chunking chunking = new Chunking();
    private Retrieval retrieval = new Retrieval();
    private Expansion expansion = new Expansion();
    private Agent agent = new Agent();
    private Ingestion ingestion = new Ingestion();
    private Store store = new Store();
    private ModelService modelService = new ModelService();
    private Context context = new Context();
    private Monitoring monitoring = new Monitoring();
    private List<School> schools = new ArrayList<>();

    // ============================================================
    // Chunking
    // ============================================================
    @Data
    public static class Chunking {
        private Integer noiseFloor = 30;
        private Integer overlapFloor = 50;
        private Integer faqMinFragment = 80;
        private Map<PageType, Profile> profiles = defaultProfiles();
    }

    @Data
    public static class Profile {
        private Integer targetSize;
        private Double overlapFraction = 0.1;

        public Profile() {
        }

        public Profile(Integer targetSize, Double overlapFraction) {
            this.targetSize = targetSize;
            this.overlapFraction = overlapFraction;
        }
    }

    // ============================================================
    // Retrieval
    // ============================================================
    @Data
    public static class Retrieval {
        private Integer topK = 5;
        private Integer oversampleFactor = 3;
        private Boolean rerankEnabled = true;
        private Integer timeoutSeconds = 30;
        private Integer executorThreads = 8;
    }

    @Data
    public static class Expansion {
        private Boolean enabled = true;
        private Integer paraphraseCount = 3;
    }

    @Data
    public static class Agent {
        private Integer maxSteps = 5;
        private Integer toolTopK = 4;
        private Integer timeoutSeconds = 120;
    }

    @Data
    public static class Ingestion {
        private Integer minPageChars = 50;
        private String sourceDir = "data";
        private Boolean onStartup = false;
        private Integer timeoutSeconds = 1800;
    }

    @Data
    public static class Store {
        /** memory | pgvector */
        private String type = "memory";
        private Integer dimension = 1024;
        private String table = "document_chunks";
    }

    @Data
    public static class ModelService {
        private String baseUrl = "http://localhost:8000";
        private Integer timeoutSeconds = 60;
        private Integer embedBatchSize = 32;
    }

    @Data
    public static class Context {
        private Integer maxCharsPerChunk = 1500;
        private Integer maxTotalChars = 12000;
    }

    @Data
    public static class Monitoring {
        private Boolean enabled = true;
        private Integer maxQueryHistory = 100;
    }

    @Data
    public static class School {
        private String id;
        private String name;
        private List<String> domains = new ArrayList<>();
    }

    // ============================================================
    // Convenience Getters
    // ============================================================

    public Profile profileFor(PageType pageType) {
        Profile profile = chunking.getProfiles().get(pageType);
        if (profile == null || profile.getTargetSize() == null) {
            profile = chunking.getProfiles().get(PageType.GENERAL);
        }
        return profile != null ? profile : new Profile(700, 0.1);
    }

    public boolean isRerankEnabled() {
        return Boolean.TRUE.equals(retrieval.getRerankEnabled());
    }

    public boolean isPgvectorStore() {
        return "pgvector".equalsIgnoreCase(store.getType());
    }

    static Map<PageType, Profile> defaultProfiles() {
        Map<PageType, Profile> profiles = new EnumMap<>(PageType.class);
        profiles.put(PageType.FAQ, new Profile(1200, 0.1));
        profiles.put(PageType.CHECKLIST, new Profile(600, 0.1));
        profiles.put(PageType.ADMISSIONS, new Profile(800, 0.1));
        profiles.put(PageType.APPLY, new Profile(800, 0.1));
        profiles.put(PageType.ACCEPTING, new Profile(700, 0.1));
        profiles.put(PageType.REDDIT, new Profile(1500, 0.1));
        profiles.put(PageType.GENERAL, new Profile(700, 0.1));
        return profiles;
    }

    // ============================================================
    // Initialization & Validation
    // ============================================================

    @PostConstruct
    public void init() {
        validate();

        log.info("=".repeat(70));
        log.info("ADMISSIONS RAG CONFIGURATION");
        log.info("=".repeat(70));
        log.info("  Store             : {} (dimension {})", store.getType(), store.getDimension());
        log.info("  Model service     : {}", modelService.getBaseUrl());
        log.info("  TopK / oversample : {} / x{}", retrieval.getTopK(), retrieval.getOversampleFactor());
        log.info("  Rerank enabled    : {}", retrieval.getRerankEnabled());
        log.info("  Paraphrases       : {}", expansion.getParaphraseCount());
        log.info("  Agent max steps   : {}", agent.getMaxSteps());
        log.info("  Known schools     : {}", schools.size());
        log.info("=".repeat(70));
    }

    /**
     * Rejects settings the pipeline cannot run with. Called once at startup.
     */
    public void validate() {
        requirePositive("chunking.noise-floor", chunking.getNoiseFloor());
        requirePositive("chunking.overlap-floor", chunking.getOverlapFloor());
        for (Map.Entry<PageType, Profile> entry : chunking.getProfiles().entrySet()) {
            Profile profile = entry.getValue();
            requirePositive("chunking.profiles." + entry.getKey().code() + ".target-size",
                    profile.getTargetSize());
            if (profile.getOverlapFraction() == null
                    || profile.getOverlapFraction() < 0 || profile.getOverlapFraction() >= 1) {
                throw new ConfigurationException("chunking.profiles." + entry.getKey().code()
                        + ".overlap-fraction must be in [0, 1)");
            }
        }
        requirePositive("retrieval.top-k", retrieval.getTopK());
        requirePositive("retrieval.oversample-factor", retrieval.getOversampleFactor());
        requirePositive("retrieval.executor-threads", retrieval.getExecutorThreads());
        requirePositive("agent.max-steps", agent.getMaxSteps());
        requirePositive("agent.tool-top-k", agent.getToolTopK());
        requirePositive("ingestion.timeout-seconds", ingestion.getTimeoutSeconds());
        requirePositive("store.dimension", store.getDimension());
        requirePositive("model-service.embed-batch-size", modelService.getEmbedBatchSize());
        if (!"memory".equalsIgnoreCase(store.getType()) && !isPgvectorStore()) {
            throw new ConfigurationException("store.type must be 'memory' or 'pgvector', got: " + store.getType());
        }
        if (modelService.getBaseUrl() == null || modelService.getBaseUrl().isBlank()) {
            throw new ConfigurationException("model-service.base-url is required");
        }
        for (School school : schools) {
            if (school.getId() == null || school.getId().isBlank()) {
                throw new ConfigurationException("every entry in schools needs an id");
            }
        }
    }

    private static void requirePositive(String name, Integer value) {
        if (value == null || value <= 0) {
            throw new ConfigurationException(name + " must be a positive integer, got: " + value);
        }
    }
}
