package com.scoutiq.ai.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scoutiq.ai.model.PipelineResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for /api/search. When error is set, results is empty.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
public class SearchResponse {

    private String query;

    private List<ResultItem> results;

    private String error;

    public static SearchResponse from(PipelineResult result) {
        List<ResultItem> items = result.getError() != null
                ? List.of()
                : result.getResults().stream().map(ResultItem::from).toList();
        return SearchResponse.builder()
                .query(result.getQuery())
                .results(items)
                .error(result.getError())
                .build();
    }
}
