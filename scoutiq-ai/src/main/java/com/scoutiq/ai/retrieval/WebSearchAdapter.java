package com.scoutiq.ai.retrieval;

import com.scoutiq.ai.model.RawResult;
import com.scoutiq.common.enums.ResultSource;
import com.scoutiq.web.client.PriceLookupClient;
import com.scoutiq.web.client.WebSearchClient;
import com.scoutiq.web.dto.PriceLookupResult;
import com.scoutiq.web.dto.WebHit;
import com.scoutiq.web.normalize.PriceDomainNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps web search hits onto {@link RawResult} and exposes the authoritative price lookup.
 * Hits whose URL cannot be normalized have no identity and are dropped here.
 */
@Component
@RequiredArgsConstructor
public class WebSearchAdapter {

    public static final String SOURCE = "web";

    private final WebSearchClient webSearchClient;
    private final PriceLookupClient priceLookupClient;

    public List<RawResult> query(String text, List<String> allowedDomains, int topK) {
        List<WebHit> hits = webSearchClient.search(text, allowedDomains, topK);
        List<RawResult> results = new ArrayList<>(hits.size());
        for (WebHit hit : hits) {
            Optional<String> identity = PriceDomainNormalizer.normalizeUrl(hit.getUrl());
            if (identity.isEmpty()) {
                continue;
            }
            results.add(RawResult.builder()
                    .identityKey(identity.get())
                    .title(hit.getTitle())
                    .url(hit.getUrl())
                    .snippet(hit.getSnippet())
                    .price(hit.getPrice())
                    .score(hit.getScore())
                    .source(ResultSource.WEB)
                    .build());
        }
        return results;
    }

    public boolean isLookupAvailable() {
        return priceLookupClient.isAvailable();
    }

    public Optional<PriceLookupResult> lookupPrice(String itemCode) {
        return priceLookupClient.lookup(itemCode);
    }
}
