package com.scoutiq.ai.model;

import com.scoutiq.common.enums.ResultSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Canonical search hit shared by both sources.
 * identityKey is the catalog product ID for catalog hits and the normalized URL for web hits.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RawResult {

    private String identityKey;
    private String title;
    private String url;
    private String snippet;
    private Double price;
    private Double score;
    private ResultSource source;

    /** Marketplace item code parsed from a web URL (Amazon ASIN) */
    private String itemCode;

    /** Web only: URL matched a product-page pattern */
    private boolean productPage;
}
