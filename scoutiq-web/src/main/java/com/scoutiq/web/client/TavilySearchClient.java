package com.scoutiq.web.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scoutiq.common.exception.SourceUnavailableException;
import com.scoutiq.web.config.WebSearchConfig;
import com.scoutiq.web.dto.WebHit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
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

/**
 * Web search through the Tavily Search REST API, restricted to the retailer allowlist.
 */
@Slf4j
@Service
public class TavilySearchClient implements WebSearchClient {

    static final String SOURCE_NAME = "web";

    private final WebSearchConfig webSearchConfig;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Autowired
    public TavilySearchClient(WebSearchConfig webSearchConfig) {
        this(webSearchConfig, buildRestTemplate(webSearchConfig.getTavily()));
    }

    TavilySearchClient(WebSearchConfig webSearchConfig, RestTemplate restTemplate) {
        this.webSearchConfig = webSearchConfig;
        this.restTemplate = restTemplate;
        this.objectMapper = new ObjectMapper();

        if (!isAvailable()) {
            log.warn("Tavily web search not configured - scoutiq.web.tavily.api-key is empty or web search disabled");
        }
    }

    @Override
    public List<WebHit> search(String queryText, List<String> allowedDomains, int topK) {
        if (!isAvailable()) {
            throw new SourceUnavailableException(SOURCE_NAME, "Web search not available");
        }
        if (queryText == null || queryText.isBlank()) {
            return List.of();
        }

        WebSearchConfig.Tavily tavily = webSearchConfig.getTavily();
        try {
            ObjectNode body = objectMapper.createObjectNode();
            body.put("query", queryText);
            body.put("max_results", topK);
            body.put("search_depth", tavily.getSearchDepth());
            body.put("include_answer", false);
            body.put("include_raw_content", false);
            ArrayNode domains = body.putArray("include_domains");
            allowedDomains.forEach(domains::add);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            headers.setBearerAuth(tavily.getApiKey());

            long startTime = System.currentTimeMillis();
            ResponseEntity<String> response = restTemplate.exchange(
                    tavily.getBaseUrl() + "/search",
                    HttpMethod.POST,
                    new HttpEntity<>(objectMapper.writeValueAsString(body), headers),
                    String.class
            );

            List<WebHit> hits = parseResponse(response.getBody());
            log.info("web.search returned {} results for '{}' in {}ms",
                    hits.size(), queryText, System.currentTimeMillis() - startTime);
            return hits;

        } catch (IOException | RuntimeException e) {
            throw new SourceUnavailableException(SOURCE_NAME, "Web search failed: " + e.getMessage(), e);
        }
    }

    private List<WebHit> parseResponse(String responseBody) throws IOException {
        List<WebHit> hits = new ArrayList<>();
        if (responseBody == null || responseBody.isBlank()) {
            return hits;
        }

        JsonNode results = objectMapper.readTree(responseBody).path("results");
        if (!results.isArray()) {
            return hits;
        }

        for (JsonNode item : results) {
            String url = text(item, "url");
            if (url == null) continue;

            hits.add(WebHit.builder()
                    .title(text(item, "title"))
                    .url(url)
                    .snippet(text(item, "content") != null ? text(item, "content") : text(item, "snippet"))
                    .score(item.path("score").isNumber() ? item.get("score").asDouble() : null)
                    .price(item.path("price").isNumber() ? item.get("price").asDouble() : null)
                    .build());
        }
        return hits;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    @Override
    public boolean isAvailable() {
        String apiKey = webSearchConfig.getTavily().getApiKey();
        return webSearchConfig.isEnabled() && apiKey != null && !apiKey.isBlank();
    }

    private static RestTemplate buildRestTemplate(WebSearchConfig.Tavily tavily) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(tavily.getConnectTimeoutMs());
        requestFactory.setReadTimeout(tavily.getReadTimeoutMs());
        return new RestTemplate(requestFactory);
    }
}
