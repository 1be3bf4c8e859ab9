package com.scoutiq.ai.controller;

import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scoutiq.ai.exception.PipelineCancelledException;
import com.scoutiq.ai.model.Citation;
import com.scoutiq.ai.model.Intent;
import com.scoutiq.ai.model.PipelineResult;
import com.scoutiq.ai.model.ReconciledResult;
import com.scoutiq.ai.model.StepSummary;
import com.scoutiq.ai.service.GeminiService;
import com.scoutiq.ai.service.ShoppingAgentPipeline;
import com.scoutiq.common.enums.IntentType;
import com.scoutiq.common.enums.ResultSource;
import com.scoutiq.common.enums.SearchStrategy;
import com.scoutiq.rag.service.CatalogSearchClient;
import com.scoutiq.web.client.PriceLookupClient;
import com.scoutiq.web.client.WebSearchClient;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest({ShoppingSearchController.class, AIChatController.class})
class ShoppingSearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ShoppingAgentPipeline pipeline;

    @MockitoBean
    private GeminiService geminiService;

    @MockitoBean
    private CatalogSearchClient catalogSearchClient;

    @MockitoBean
    private WebSearchClient webSearchClient;

    @MockitoBean
    private PriceLookupClient priceLookupClient;

    @Test
    void searchReturnsStableResultContract() throws Exception {
        when(pipeline.search(eq("steel cleaner under $15"), isNull())).thenReturn(result(null));

        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"steel cleaner under $15\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.query").value("steel cleaner under $15"))
            .andExpect(jsonPath("$.error").value(nullValue()))
            .andExpect(jsonPath("$.results[0].title").value("Eco Steel Cleaner"))
            .andExpect(jsonPath("$.results[0].price").value(12.99))
            .andExpect(jsonPath("$.results[0].source").value("catalog"))
            .andExpect(jsonPath("$.results[0].rank").value(0))
            .andExpect(jsonPath("$.results[1].url").value("https://www.target.com/p/a"))
            .andExpect(jsonPath("$.results[1].price").value(nullValue()))
            .andExpect(jsonPath("$.results[1].source").value("web"));
    }

    @Test
    void errorResponseCarriesNoResults() throws Exception {
        when(pipeline.search(anyString(), any())).thenReturn(result("all_sources_unavailable"));

        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"steel cleaner\",\"topN\":5}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.error").value("all_sources_unavailable"))
            .andExpect(jsonPath("$.results").isEmpty());
        verify(pipeline).search("steel cleaner", 5);
        verify(pipeline, never()).run(anyString(), any());
    }

    @Test
    void chatReturnsAnswerCitationsAndSteps() throws Exception {
        when(pipeline.run(anyString(), any())).thenReturn(result(null));

        mockMvc.perform(post("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"steel cleaner under $15\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.intent").value("product_query"))
            .andExpect(jsonPath("$.strategy").value("hybrid"))
            .andExpect(jsonPath("$.answer").value("My top pick is Eco Steel Cleaner at $12.99 [1]."))
            .andExpect(jsonPath("$.citations[0].index").value(1))
            .andExpect(jsonPath("$.steps[0].node").value("router"))
            .andExpect(jsonPath("$.safetyFlags").isEmpty());
    }

    @Test
    void missingQueryIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"topN\":5}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("INVALID_REQUEST"));
    }

    @Test
    void cancelledSearchIsServiceUnavailable() throws Exception {
        when(pipeline.search(anyString(), any())).thenThrow(new PipelineCancelledException("steel cleaner"));

        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"steel cleaner\"}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.errorCode").value("SEARCH_CANCELLED"));
    }

    @Test
    void healthReportsBackends() throws Exception {
        when(catalogSearchClient.isAvailable()).thenReturn(true);

        mockMvc.perform(get("/api/chat/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.features.catalogSearch").value(true))
            .andExpect(jsonPath("$.features.webSearch").value(false));
    }

    private static PipelineResult result(String error) {
        List<ReconciledResult> results = error != null ? List.of() : List.of(
            ReconciledResult.builder()
                .identityKey("B0CLEAN001").title("Eco Steel Cleaner").url("https://www.amazon.com/dp/B0CLEAN001")
                .price(12.99).score(0.82).source(ResultSource.CATALOG).rank(0).build(),
            ReconciledResult.builder()
                .identityKey("https://www.target.com/p/a").title("Steel Polish").url("https://www.target.com/p/a")
                .score(0.7).source(ResultSource.WEB).rank(1).build());
        return PipelineResult.builder()
            .query(error != null ? "steel cleaner" : "steel cleaner under $15")
            .intent(Intent.of(IntentType.PRODUCT_QUERY, Set.of()))
            .strategy(SearchStrategy.HYBRID)
            .answer("My top pick is Eco Steel Cleaner at $12.99 [1].")
            .citations(results.isEmpty() ? List.of() : List.of(Citation.from(results.get(0))))
            .results(results)
            .steps(List.of(new StepSummary("router", "product_query (model)")))
            .log(List.of())
            .error(error)
            .build();
    }
}
