package com.scoutiq.ai.controller;

import com.scoutiq.ai.dto.SearchRequest;
import com.scoutiq.ai.dto.SearchResponse;
import com.scoutiq.ai.model.PipelineResult;
import com.scoutiq.ai.service.ShoppingAgentPipeline;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Result-only search: the ranked, reconciled product list without the answer text.
 */
@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
@Slf4j
public class ShoppingSearchController {

    private final ShoppingAgentPipeline pipeline;

    @PostMapping
    public ResponseEntity<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
        log.info("Search request: query={}, topN={}", truncate(request.getQuery(), 100), request.getTopN());

        PipelineResult result = pipeline.search(request.getQuery(), request.getTopN());
        SearchResponse response = SearchResponse.from(result);

        log.info("Search response: resultsCount={}, error={}, processingTimeMs={}",
                response.getResults().size(), response.getError(), result.getProcessingTimeMs());
        return ResponseEntity.ok(response);
    }

    private String truncate(String str, int maxLength) {
        if (str == null) return null;
        return str.length() > maxLength ? str.substring(0, maxLength) + "..." : str;
    }
}
