package com.scoutiq.rag.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.auth.oauth2.GoogleCredentials;
import com.scoutiq.common.exception.SourceUnavailableException;
import com.scoutiq.rag.config.RagConfig;
import com.scoutiq.rag.dto.CatalogHit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Catalog search over Vertex AI Vector Search using the REST findNeighbors API.
 * Product metadata (title, price, url, brand, category) is stored with each datapoint,
 * so full datapoints are requested and no second lookup is needed.
 */
@Slf4j
@Service
public class VectorSearchService implements CatalogSearchClient {

    static final String SOURCE_NAME = "catalog";

    private final RagConfig ragConfig;
    private final EmbeddingService embeddingService;
    private final ObjectMapper objectMapper;
    private final RestTemplate restTemplate;
    private GoogleCredentials credentials;
    private String restEndpointUrl;
    private boolean initialized = false;

    public VectorSearchService(RagConfig ragConfig, EmbeddingService embeddingService) {
        this.ragConfig = ragConfig;
        this.embeddingService = embeddingService;
        this.objectMapper = new ObjectMapper();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(ragConfig.getVectorSearch().getConnectTimeoutMs());
        requestFactory.setReadTimeout(ragConfig.getVectorSearch().getReadTimeoutMs());
        this.restTemplate = new RestTemplate(requestFactory);

        initializeClient();
    }

    private void initializeClient() {
        String apiEndpoint = ragConfig.getVectorSearch().getApiEndpoint();
        String indexEndpoint = ragConfig.getVectorSearch().getIndexEndpoint();

        if (apiEndpoint == null || apiEndpoint.isBlank()) {
            log.warn("Vector Search API endpoint not configured");
            return;
        }

        if (indexEndpoint == null || indexEndpoint.isBlank()) {
            log.warn("Vector Search index endpoint not configured");
            return;
        }

        try {
            credentials = GoogleCredentials.getApplicationDefault()
                    .createScoped("https://www.googleapis.com/auth/cloud-platform");

            // Drop the gRPC port if the endpoint was copied with one
            String hostname = apiEndpoint.contains(":")
                    ? apiEndpoint.substring(0, apiEndpoint.indexOf(":"))
                    : apiEndpoint;

            restEndpointUrl = String.format("https://%s/v1/%s:findNeighbors", hostname, indexEndpoint);

            initialized = true;
            log.info("Initialized Vector Search REST client: {}", restEndpointUrl);

        } catch (IOException e) {
            log.error("Failed to initialize Vector Search client: {}", e.getMessage());
        }
    }

    @Override
    public List<CatalogHit> search(String queryText, int topK) {
        if (!isAvailable()) {
            throw new SourceUnavailableException(SOURCE_NAME, "Vector Search not available");
        }

        List<Float> queryEmbedding = embeddingService.embedQuery(queryText);
        if (queryEmbedding.isEmpty()) {
            throw new SourceUnavailableException(SOURCE_NAME, "Failed to generate query embedding");
        }

        try {
            String requestJson = objectMapper.writeValueAsString(buildRequest(queryEmbedding, topK));

            credentials.refreshIfExpired();
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            headers.setBearerAuth(credentials.getAccessToken().getTokenValue());

            long startTime = System.currentTimeMillis();
            ResponseEntity<String> response = restTemplate.exchange(
                    restEndpointUrl,
                    HttpMethod.POST,
                    new HttpEntity<>(requestJson, headers),
                    String.class
            );
            long searchTime = System.currentTimeMillis() - startTime;

            List<CatalogHit> hits = parseResponse(response.getBody());
            log.info("Vector search (REST): {} hits for query='{}' in {}ms", hits.size(), queryText, searchTime);
            return hits;

        } catch (IOException | RuntimeException e) {
            throw new SourceUnavailableException(SOURCE_NAME, "Vector Search request failed: " + e.getMessage(), e);
        }
    }

    private ObjectNode buildRequest(List<Float> embedding, int topK) {
        ObjectNode requestBody = objectMapper.createObjectNode();
        requestBody.put("deployed_index_id", ragConfig.getVectorSearch().getDeployedIndexId());
        requestBody.put("return_full_datapoint", true);

        ObjectNode datapoint = objectMapper.createObjectNode();
        datapoint.put("datapoint_id", "query-" + UUID.randomUUID());
        ArrayNode featureVector = objectMapper.createArrayNode();
        for (Float value : embedding) {
            featureVector.add(value.doubleValue());
        }
        datapoint.set("feature_vector", featureVector);

        ObjectNode query = objectMapper.createObjectNode();
        query.put("neighbor_count", topK);
        query.set("datapoint", datapoint);

        ArrayNode queries = objectMapper.createArrayNode();
        queries.add(query);
        requestBody.set("queries", queries);
        return requestBody;
    }

    /**
     * Parse a findNeighbors response into catalog hits.
     * Neighbors below the similarity threshold are dropped; unknown fields resolve to null.
     */
    List<CatalogHit> parseResponse(String responseBody) throws IOException {
        List<CatalogHit> results = new ArrayList<>();
        if (responseBody == null || responseBody.isBlank()) {
            return results;
        }

        JsonNode root = objectMapper.readTree(responseBody);
        JsonNode nearestNeighbors = root.get("nearestNeighbors");
        if (nearestNeighbors == null || !nearestNeighbors.isArray()) {
            log.warn("No nearestNeighbors in Vector Search response");
            return results;
        }

        double threshold = ragConfig.getRetrieval().getSimilarityThreshold();
        for (JsonNode nn : nearestNeighbors) {
            JsonNode neighbors = nn.get("neighbors");
            if (neighbors == null || !neighbors.isArray()) continue;

            for (JsonNode neighbor : neighbors) {
                JsonNode datapointNode = neighbor.get("datapoint");
                if (datapointNode == null || !datapointNode.hasNonNull("datapointId")) continue;

                String datapointId = datapointNode.get("datapointId").asText();
                Double similarity = neighbor.hasNonNull("distance")
                        ? 1.0 - neighbor.get("distance").asDouble()
                        : null;
                if (similarity != null && similarity < threshold) continue;

                JsonNode metadata = datapointNode.path("embeddingMetadata");
                results.add(CatalogHit.builder()
                        .id(textOrNull(metadata, "product_id") != null ? textOrNull(metadata, "product_id") : datapointId)
                        .title(textOrNull(metadata, "title"))
                        .url(textOrNull(metadata, "url"))
                        .price(priceOf(metadata, datapointNode.path("numericRestricts")))
                        .brand(firstNonNull(textOrNull(metadata, "brand"), restrictToken(datapointNode, "brand")))
                        .category(firstNonNull(textOrNull(metadata, "category"), restrictToken(datapointNode, "category")))
                        .score(similarity)
                        .build());
            }
        }
        return results;
    }

    private Double priceOf(JsonNode metadata, JsonNode numericRestricts) {
        JsonNode price = metadata.path("price");
        if (price.isNumber()) {
            return price.asDouble();
        }
        if (price.isTextual()) {
            try {
                return Double.parseDouble(price.asText().replace("$", "").replace(",", "").trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (numericRestricts.isArray()) {
            for (JsonNode restrict : numericRestricts) {
                if (!"price".equals(restrict.path("namespace").asText())) continue;
                for (String field : List.of("valueDouble", "valueFloat", "valueInt")) {
                    if (restrict.hasNonNull(field)) {
                        return restrict.get(field).asDouble();
                    }
                }
            }
        }
        return null;
    }

    private String restrictToken(JsonNode datapointNode, String namespace) {
        JsonNode restricts = datapointNode.path("restricts");
        if (!restricts.isArray()) return null;
        for (JsonNode restrict : restricts) {
            if (namespace.equals(restrict.path("namespace").asText())) {
                JsonNode allow = restrict.path("allowList");
                if (allow.isArray() && !allow.isEmpty()) {
                    return allow.get(0).asText();
                }
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }

    @Override
    public boolean isAvailable() {
        return ragConfig.isEnabled()
                && initialized
                && ragConfig.getVectorSearch().getDeployedIndexId() != null
                && embeddingService.isAvailable();
    }
}
