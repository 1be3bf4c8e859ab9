package com.scoutiq.rag.service;

import com.google.genai.Client;
import com.google.genai.types.ContentEmbedding;
import com.google.genai.types.EmbedContentResponse;
import com.scoutiq.rag.config.RagConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Generates query embeddings with Vertex AI's text embedding model.
 * Query vectors are cached in Redis when a connection is available.
 */
@Slf4j
@Service
public class EmbeddingService {

    private static final String QUERY_CACHE_PREFIX = "query_embedding:";

    private final Client client;
    private final RagConfig ragConfig;
    @Nullable
    private final RedisTemplate<String, Object> redisTemplate;
    private final String embeddingModel;

    public EmbeddingService(
            RagConfig ragConfig,
            @Autowired(required = false) @Nullable RedisTemplate<String, Object> redisTemplate,
            @Value("${vertex.ai.project-id:}") String projectId,
            @Value("${vertex.ai.location:us-central1}") String location) {
        this.ragConfig = ragConfig;
        this.redisTemplate = redisTemplate;
        this.embeddingModel = ragConfig.getEmbedding().getModel();

        if (redisTemplate == null) {
            log.warn("Redis not available - query embedding caching disabled");
        }

        Client tempClient = null;
        if (projectId != null && !projectId.isBlank()) {
            try {
                tempClient = Client.builder()
                        .project(projectId)
                        .location(location)
                        .vertexAI(true)
                        .build();
                log.info("Initialized embedding client for Vertex AI: project={}, location={}, model={}",
                        projectId, location, embeddingModel);
            } catch (Exception e) {
                log.error("Failed to initialize embedding client: {}", e.getMessage());
            }
        } else {
            log.warn("Vertex AI not configured for embeddings - projectId is empty");
        }
        this.client = tempClient;
    }

    /**
     * Generate embedding for a search query.
     *
     * @param query Search query
     * @return Embedding vector, empty when the model is unavailable or the call failed
     */
    public List<Float> embedQuery(String query) {
        if (client == null) {
            log.warn("Embedding client not initialized");
            return List.of();
        }

        String cacheKey = QUERY_CACHE_PREFIX + embeddingModel + ":" + query.trim().toLowerCase().hashCode();
        List<Float> cached = readCache(cacheKey);
        if (cached != null) {
            log.debug("Cache hit for query embedding");
            return cached;
        }

        try {
            EmbedContentResponse response = client.models.embedContent(embeddingModel, query, null);

            Optional<List<ContentEmbedding>> embeddingsOpt = response.embeddings();
            if (embeddingsOpt.isPresent() && !embeddingsOpt.get().isEmpty()) {
                List<Float> embedding = embeddingsOpt.get().get(0).values().orElse(List.of());
                if (!embedding.isEmpty()) {
                    writeCache(cacheKey, embedding);
                }
                return embedding;
            }

            return List.of();

        } catch (Exception e) {
            log.error("Error generating query embedding: {}", e.getMessage());
            return List.of();
        }
    }

    public boolean isAvailable() {
        return client != null && ragConfig.isEnabled();
    }

    @Nullable
    private List<Float> readCache(String cacheKey) {
        if (redisTemplate == null) {
            return null;
        }
        try {
            Object value = redisTemplate.opsForValue().get(cacheKey);
            if (value instanceof List<?> list && !list.isEmpty()) {
                // JSON round-trips floats as doubles
                List<Float> vector = new ArrayList<>(list.size());
                for (Object item : list) {
                    if (!(item instanceof Number number)) {
                        return null;
                    }
                    vector.add(number.floatValue());
                }
                return vector;
            }
        } catch (Exception e) {
            log.debug("Query embedding cache read failed: {}", e.getMessage());
        }
        return null;
    }

    private void writeCache(String cacheKey, List<Float> embedding) {
        if (redisTemplate == null) {
            return;
        }
        try {
            redisTemplate.opsForValue().set(cacheKey, embedding, parseDuration(ragConfig.getCache().getQueryEmbeddingTtl()));
        } catch (Exception e) {
            log.debug("Query embedding cache write failed: {}", e.getMessage());
        }
    }

    // Parse duration string like "24h" or "30m" to Duration
    private Duration parseDuration(String durationStr) {
        if (durationStr == null || durationStr.isBlank()) {
            return Duration.ofHours(1);
        }

        try {
            if (durationStr.endsWith("h")) {
                return Duration.ofHours(Long.parseLong(durationStr.replace("h", "")));
            } else if (durationStr.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(durationStr.replace("m", "")));
            } else if (durationStr.endsWith("d")) {
                return Duration.ofDays(Long.parseLong(durationStr.replace("d", "")));
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid duration format: {}, using default 1h", durationStr);
        }

        return Duration.ofHours(1);
    }
}
