package com.scoutiq.rag.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for catalog retrieval.
 * Maps to scoutiq.rag.* properties in application.properties.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scoutiq.rag")
public class RagConfig {

    private boolean enabled = true;

    private Embedding embedding = new Embedding();
    private VectorSearch vectorSearch = new VectorSearch();
    private Retrieval retrieval = new Retrieval();
    private Cache cache = new Cache();

    @Data
    public static class Embedding {
        /** Vertex AI embedding model (e.g., text-embedding-004) */
        private String model = "text-embedding-004";
    }

    @Data
    public static class VectorSearch {
        /** Vertex AI Vector Search index endpoint (full resource name) */
        private String indexEndpoint;
        /** Deployed index ID within the endpoint */
        private String deployedIndexId;
        /** Public endpoint host, e.g. 123456.us-central1-xxx.vdb.vertexai.goog */
        private String apiEndpoint;
        /** HTTP connect timeout in milliseconds */
        private int connectTimeoutMs = 2000;
        /** HTTP read timeout in milliseconds */
        private int readTimeoutMs = 8000;
    }

    @Data
    public static class Retrieval {
        /** Minimum similarity (0-1) for a neighbor to count as a catalog hit */
        private double similarityThreshold = 0.5;
    }

    @Data
    public static class Cache {
        /** TTL for query embeddings in Redis */
        private String queryEmbeddingTtl = "1h";
    }
}
