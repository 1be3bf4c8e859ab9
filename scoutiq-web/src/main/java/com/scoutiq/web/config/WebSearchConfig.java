package com.scoutiq.web.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for live web search and price lookup.
 * Maps to scoutiq.web.* properties in application.properties.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scoutiq.web")
public class WebSearchConfig {

    private boolean enabled = true;

    /** Retailer hosts web results may come from; subdomains are accepted, look-alikes are not */
    private List<String> allowedDomains = new ArrayList<>(List.of("amazon.com", "walmart.com", "target.com"));

    private Tavily tavily = new Tavily();
    private Rainforest rainforest = new Rainforest();

    @Data
    public static class Tavily {
        private String apiKey;
        private String baseUrl = "https://api.tavily.com";
        /** basic or advanced */
        private String searchDepth = "basic";
        private int connectTimeoutMs = 2000;
        private int readTimeoutMs = 8000;
    }

    @Data
    public static class Rainforest {
        /** Authoritative Amazon price lookup; skipped when disabled */
        private boolean enabled = true;
        private String apiKey;
        private String baseUrl = "https://api.rainforestapi.com/request";
        private String amazonDomain = "amazon.com";
        private int connectTimeoutMs = 2000;
        private int readTimeoutMs = 5000;
    }
}
