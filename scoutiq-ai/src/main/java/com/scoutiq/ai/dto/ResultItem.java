package com.scoutiq.ai.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scoutiq.ai.model.ReconciledResult;
import com.scoutiq.common.enums.ResultSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One ranked result in the public response. Absent fields are serialized as null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
public class ResultItem {
    private String title;
    private String url;
    private String snippet;
    private Double price;
    private Double score;
    private ResultSource source;
    private int rank;

    public static ResultItem from(ReconciledResult result) {
        return ResultItem.builder()
                .title(result.getTitle())
                .url(result.getUrl())
                .snippet(result.getSnippet())
                .price(result.getPrice())
                .score(result.getScore())
                .source(result.getSource())
                .rank(result.getRank())
                .build();
    }
}
