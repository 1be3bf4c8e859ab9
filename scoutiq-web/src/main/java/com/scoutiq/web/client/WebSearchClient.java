package com.scoutiq.web.client;

import com.scoutiq.web.dto.WebHit;

import java.util.List;

/**
 * Live web search restricted to a set of retailer domains.
 */
public interface WebSearchClient {

    /**
     * @throws com.scoutiq.common.exception.SourceUnavailableException when the provider cannot be reached
     */
    List<WebHit> search(String queryText, List<String> allowedDomains, int topK);

    boolean isAvailable();
}
