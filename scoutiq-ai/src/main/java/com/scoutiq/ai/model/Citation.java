package com.scoutiq.ai.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Citation {

    /** 1-based, matches the [n] markers in the answer text */
    private int index;
    private String title;
    private String url;
    private Double price;

    public static Citation from(ReconciledResult result) {
        return Citation.builder()
                .index(result.citationIndex())
                .title(result.getTitle())
                .url(result.getUrl())
                .price(result.getPrice())
                .build();
    }
}
