package com.scoutiq.web.normalize;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * URL path patterns that identify an individual item page (as opposed to a search or listing
 * page) on each supported retailer.
 */
final class ProductPagePatterns {

    static final String AMAZON = "amazon.com";
    static final String WALMART = "walmart.com";
    static final String TARGET = "target.com";

    /** Group 1 captures the ASIN. */
    static final List<Pattern> AMAZON_ITEM = List.of(
            Pattern.compile("/dp/([A-Z0-9]{10})(?![A-Z0-9])", Pattern.CASE_INSENSITIVE),
            Pattern.compile("/gp/product/([A-Z0-9]{10})(?![A-Z0-9])", Pattern.CASE_INSENSITIVE),
            Pattern.compile("/gp/aw/d/([A-Z0-9]{10})(?![A-Z0-9])", Pattern.CASE_INSENSITIVE),
            Pattern.compile("/gp/offer-listing/([A-Z0-9]{10})(?![A-Z0-9])", Pattern.CASE_INSENSITIVE)
    );

    static final Map<String, List<Pattern>> BY_DOMAIN = Map.of(
            AMAZON, AMAZON_ITEM,
            WALMART, List.of(
                    Pattern.compile("/ip/", Pattern.CASE_INSENSITIVE)
            ),
            TARGET, List.of(
                    Pattern.compile("/p/", Pattern.CASE_INSENSITIVE),
                    Pattern.compile("/-/A-\\d+", Pattern.CASE_INSENSITIVE)
            )
    );

    private ProductPagePatterns() {
    }
}
