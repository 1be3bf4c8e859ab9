package com.scoutiq.ai.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for the search and chat endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

    /**
     * Natural-language shopping query. A blank query is answered with a clarifying question.
     */
    @NotNull
    private String query;

    /**
     * Maximum number of results, defaults to scoutiq.retrieval.top-n.
     */
    @Min(1)
    @Max(50)
    private Integer topN;
}
