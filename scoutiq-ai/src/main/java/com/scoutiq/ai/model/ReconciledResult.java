package com.scoutiq.ai.model;

import com.scoutiq.common.enums.ResultSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A merged, ranked result. rank is dense and 0-based.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciledResult {

    private String identityKey;
    private String title;
    private String url;
    private String snippet;
    private Double price;
    private Double score;
    private ResultSource source;
    private int rank;

    public static ReconciledResult from(RawResult result, int rank) {
        return ReconciledResult.builder()
                .identityKey(result.getIdentityKey())
                .title(result.getTitle())
                .url(result.getUrl())
                .snippet(result.getSnippet())
                .price(result.getPrice())
                .score(result.getScore())
                .source(result.getSource())
                .rank(rank)
                .build();
    }

    /** 1-based citation number for this result. */
    public int citationIndex() {
        return rank + 1;
    }
}
