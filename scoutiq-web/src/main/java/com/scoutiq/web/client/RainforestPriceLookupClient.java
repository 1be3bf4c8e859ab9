package com.scoutiq.web.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutiq.common.exception.SourceUnavailableException;
import com.scoutiq.web.config.WebSearchConfig;
import com.scoutiq.web.dto.PriceLookupResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.Optional;

/**
 * Authoritative Amazon product data (title and current price) by ASIN, via the Rainforest API.
 */
@Slf4j
@Service
public class RainforestPriceLookupClient implements PriceLookupClient {

    static final String SOURCE_NAME = "price-lookup";

    private final WebSearchConfig webSearchConfig;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Autowired
    public RainforestPriceLookupClient(WebSearchConfig webSearchConfig) {
        this(webSearchConfig, buildRestTemplate(webSearchConfig.getRainforest()));
    }

    RainforestPriceLookupClient(WebSearchConfig webSearchConfig, RestTemplate restTemplate) {
        this.webSearchConfig = webSearchConfig;
        this.restTemplate = restTemplate;
        this.objectMapper = new ObjectMapper();

        if (!isAvailable()) {
            log.warn("Rainforest price lookup not configured - authoritative prices disabled");
        }
    }

    @Override
    public Optional<PriceLookupResult> lookup(String itemCode) {
        if (!isAvailable() || itemCode == null || itemCode.isBlank()) {
            return Optional.empty();
        }

        WebSearchConfig.Rainforest rainforest = webSearchConfig.getRainforest();
        URI uri = UriComponentsBuilder.fromUriString(rainforest.getBaseUrl())
                .queryParam("api_key", rainforest.getApiKey())
                .queryParam("type", "product")
                .queryParam("amazon_domain", rainforest.getAmazonDomain())
                .queryParam("asin", itemCode)
                .build()
                .encode()
                .toUri();

        try {
            ResponseEntity<String> response = restTemplate.getForEntity(uri, String.class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                return Optional.empty();
            }
            return parseProduct(response.getBody());
        } catch (IOException | RuntimeException e) {
            throw new SourceUnavailableException(SOURCE_NAME, "Price lookup failed for " + itemCode + ": " + e.getMessage(), e);
        }
    }

    private Optional<PriceLookupResult> parseProduct(String json) throws IOException {
        JsonNode product = objectMapper.readTree(json).path("product");
        if (product.isMissingNode() || product.isNull() || product.isEmpty()) {
            return Optional.empty();
        }

        Double price = null;
        for (JsonNode candidate : new JsonNode[]{
                product.path("buybox_winner").path("price").path("value"),
                product.path("price").path("value")}) {
            if (candidate.isNumber()) {
                price = candidate.asDouble();
                break;
            }
        }

        String title = product.path("title").isTextual() ? product.get("title").asText().trim() : null;
        return Optional.of(PriceLookupResult.builder()
                .title(title == null || title.isEmpty() ? null : title)
                .price(price)
                .build());
    }

    @Override
    public boolean isAvailable() {
        WebSearchConfig.Rainforest rainforest = webSearchConfig.getRainforest();
        return rainforest.isEnabled() && rainforest.getApiKey() != null && !rainforest.getApiKey().isBlank();
    }

    private static RestTemplate buildRestTemplate(WebSearchConfig.Rainforest rainforest) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(rainforest.getConnectTimeoutMs());
        requestFactory.setReadTimeout(rainforest.getReadTimeoutMs());
        return new RestTemplate(requestFactory);
    }
}
