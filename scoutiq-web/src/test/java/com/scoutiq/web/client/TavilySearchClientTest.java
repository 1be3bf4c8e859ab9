package com.scoutiq.web.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutiq.common.exception.SourceUnavailableException;
import com.scoutiq.web.config.WebSearchConfig;
import com.scoutiq.web.dto.WebHit;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.http.client.MockClientHttpRequest;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class TavilySearchClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private WebSearchConfig config;
    private MockRestServiceServer server;
    private TavilySearchClient client;

    @BeforeEach
    void setUp() {
        config = new WebSearchConfig();
        config.getTavily().setApiKey("tvly-test");
        config.getTavily().setBaseUrl("http://tavily.test");
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new TavilySearchClient(config, restTemplate);
    }

    @Test
    void sendsAllowlistAndParsesResults() {
        server.expect(requestTo("http://tavily.test/search"))
            .andExpect(method(POST))
            .andExpect(header("Authorization", "Bearer tvly-test"))
            .andExpect(request -> {
                String body = ((MockClientHttpRequest) request).getBodyAsString(StandardCharsets.UTF_8);
                JsonNode root = objectMapper.readTree(body);
                assertThat(root.path("query").asText()).isEqualTo("steel cleaner");
                assertThat(root.path("max_results").asInt()).isEqualTo(5);
                assertThat(root.path("include_domains").toString()).contains("amazon.com", "target.com");
            })
            .andRespond(withSuccess("""
                {"results": [
                  {"title": "Steel Cleaner", "url": "https://www.target.com/p/x/-/A-1", "content": "Now $13.50", "score": 0.81},
                  {"title": "No url"},
                  {"title": "Priced", "url": "https://www.amazon.com/dp/B07XJ8C8F5", "price": 9.5}
                ]}
                """, MediaType.APPLICATION_JSON));

        List<WebHit> hits = client.search("steel cleaner", List.of("amazon.com", "target.com"), 5);

        assertThat(hits).hasSize(2);
        assertThat(hits.get(0).getSnippet()).isEqualTo("Now $13.50");
        assertThat(hits.get(0).getScore()).isEqualTo(0.81);
        assertThat(hits.get(0).getPrice()).isNull();
        assertThat(hits.get(1).getScore()).isNull();
        assertThat(hits.get(1).getPrice()).isEqualTo(9.5);
        server.verify();
    }

    @Test
    void serverErrorBecomesSourceUnavailable() {
        server.expect(requestTo("http://tavily.test/search")).andRespond(withServerError());

        assertThatThrownBy(() -> client.search("cleaner", List.of("amazon.com"), 5))
            .isInstanceOf(SourceUnavailableException.class)
            .extracting(e -> ((SourceUnavailableException) e).getSourceName())
            .isEqualTo("web");
    }

    @Test
    void missingApiKeyMeansUnavailable() {
        config.getTavily().setApiKey("");

        assertThat(client.isAvailable()).isFalse();
        assertThatThrownBy(() -> client.search("cleaner", List.of("amazon.com"), 5))
            .isInstanceOf(SourceUnavailableException.class);
    }
}
