package com.naag.docsync.config;

import com.naag.docsync.domain.ContentDomain;
import com.naag.docsync.transform.OcrPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "naag.docsync")
public class DocSyncProperties {

    private String timezone = "Asia/Jakarta";
    private SourceConfig source = new SourceConfig();
    private QdrantConfig qdrant = new QdrantConfig();
    private StoreConfig store = new StoreConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private GeminiConfig gemini = new GeminiConfig();
    private ConverterConfig converter = new ConverterConfig();
    private SchedulerConfig scheduler = new SchedulerConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private List<PipelineConfig> pipelines = new ArrayList<>();

    @Data
    public static class SourceConfig {
        private String graphBaseUrl = "https://graph.microsoft.com/v1.0";
        private String authorityUrl = "https://login.microsoftonline.com";
        private String tenantId;
        private String clientId;
        private String clientSecret;
        private String driveId;
        private int pageSize = 200;
        private Duration requestTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class QdrantConfig {
        private String baseUrl = "http://localhost:6333";
        private String apiKey;
        private int vectorSize = 768;
        private String distance = "Cosine";
    }

    @Data
    public static class StoreConfig {
        private StoreProvider provider = StoreProvider.QDRANT;
    }

    @Data
    public static class EmbeddingConfig {
        private String provider = "gemini-openai";
        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta/openai";
        private String path = "/embeddings";
        private String model = "text-embedding-004";
        private String apiKey;
        private int sparseModulus = 1_000_000;
    }

    @Data
    public static class GeminiConfig {
        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";
        private String apiKey;
        private String ocrModel = "gemini-2.5-flash";
        private String parseModel = "gemini-2.5-flash";
        private Duration timeout = Duration.ofMinutes(2);
    }

    @Data
    public static class ConverterConfig {
        private String sofficeBinary = "soffice";
        private Duration timeout = Duration.ofSeconds(120);
    }

    @Data
    public static class SchedulerConfig {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(30);
        private Duration stagger = Duration.ofMinutes(2);
    }

    @Data
    public static class RetrievalConfig {
        /** Applies to the fused score; with k=60 a record ranked first in both lists scores about 0.033. */
        private double confidenceThreshold = 0.03;
        private int maxWideningAttempts = 1;
        private List<String> expansionTerms = new ArrayList<>(List.of("prosedur", "SOP", "dokumen"));
        private int defaultLimit = 5;
        private int logRetentionDays = 90;
    }

    @Data
    public static class PipelineConfig {
        private String name;
        private ContentDomain domain;
        private String folderPath;
        private String collection;
        private List<String> extensions = new ArrayList<>();
        private int batchSize = 50;
        /** Window for scheduled runs; zero lists everything, unset restricts to today's files. */
        private Duration lookback = Duration.ofHours(24);
        private OcrPolicy ocrPolicy = OcrPolicy.WHEN_SCANNED;
        private int workers = 1;
        private Duration fileTimeout = Duration.ofMinutes(10);
    }

    public enum StoreProvider {
        QDRANT,
        MEMORY
    }
}
