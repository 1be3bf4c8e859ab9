package com.scoutiq.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single web search result as returned by the search provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebHit {
    private String title;
    private String url;
    private String snippet;
    /** Provider relevance score, null if the provider does not score */
    private Double score;
    /** Typed price when the provider returns one, otherwise null */
    private Double price;
}
