package com.scoutiq.ai.controller;

import com.scoutiq.ai.dto.ChatResponse;
import com.scoutiq.ai.dto.SearchRequest;
import com.scoutiq.ai.model.PipelineResult;
import com.scoutiq.ai.service.GeminiService;
import com.scoutiq.ai.service.ShoppingAgentPipeline;
import com.scoutiq.rag.service.CatalogSearchClient;
import com.scoutiq.web.client.PriceLookupClient;
import com.scoutiq.web.client.WebSearchClient;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * AI Shopping Assistant Controller.
 *
 * Flow:
 * 1. Frontend sends a query via POST /api/chat
 * 2. Router decides whether it is a shopping request
 * 3. Planner extracts budget/category and picks catalog, web or both
 * 4. Retriever merges catalog and web hits into one ranked list
 * 5. Answerer writes a cited answer; the stage trail is returned as steps
 */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
public class AIChatController {

    private final ShoppingAgentPipeline pipeline;
    private final GeminiService geminiService;
    private final CatalogSearchClient catalogSearchClient;
    private final WebSearchClient webSearchClient;
    private final PriceLookupClient priceLookupClient;

    /**
     * Ask the shopping assistant, e.g.
     * - "eco stainless steel cleaner under $15"
     * - "wireless earbuds on amazon"
     * - "lego set for a 7 year old"
     */
    @PostMapping
    public ResponseEntity<ChatResponse> chat(@Valid @RequestBody SearchRequest request) {
        log.info("Chat request: query={}", truncate(request.getQuery(), 100));

        PipelineResult result = pipeline.run(request.getQuery(), request.getTopN());
        ChatResponse response = ChatResponse.from(result);

        log.info("Chat response: intent={}, resultsCount={}, error={}, processingTimeMs={}",
                response.getIntent(), response.getResults().size(), response.getError(),
                response.getProcessingTimeMs());
        return ResponseEntity.ok(response);
    }

    /**
     * Health check endpoint for the assistant and its search backends.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "ScoutIQ Shopping Assistant");
        health.put("features", Map.of(
                "languageModel", geminiService.isAvailable(),
                "catalogSearch", catalogSearchClient.isAvailable(),
                "webSearch", webSearchClient.isAvailable(),
                "priceLookup", priceLookupClient.isAvailable()
        ));
        return ResponseEntity.ok(health);
    }

    private String truncate(String str, int maxLength) {
        if (str == null) return null;
        return str.length() > maxLength ? str.substring(0, maxLength) + "..." : str;
    }
}
