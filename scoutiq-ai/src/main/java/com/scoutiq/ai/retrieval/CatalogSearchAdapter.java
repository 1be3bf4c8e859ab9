package com.scoutiq.ai.retrieval;

import com.scoutiq.ai.model.RawResult;
import com.scoutiq.common.enums.ResultSource;
import com.scoutiq.rag.dto.CatalogHit;
import com.scoutiq.rag.service.CatalogSearchClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps catalog similarity hits onto {@link RawResult}. Errors from the client propagate so the
 * retriever can record the source as unavailable.
 */
@Component
@RequiredArgsConstructor
public class CatalogSearchAdapter {

    public static final String SOURCE = "catalog";

    private final CatalogSearchClient catalogSearchClient;

    public List<RawResult> query(String text, int topK) {
        List<CatalogHit> hits = catalogSearchClient.search(text, topK);
        List<RawResult> results = new ArrayList<>(hits.size());
        for (CatalogHit hit : hits) {
            if (hit.getId() == null || hit.getId().isBlank()) {
                continue;
            }
            results.add(RawResult.builder()
                    .identityKey(hit.getId().trim())
                    .title(hit.getTitle())
                    .url(hit.getUrl())
                    .snippet(describe(hit))
                    .price(hit.getPrice())
                    .score(hit.getScore())
                    .source(ResultSource.CATALOG)
                    .build());
        }
        return results;
    }

    private static String describe(CatalogHit hit) {
        if (hit.getBrand() != null && hit.getCategory() != null) {
            return hit.getBrand() + " - " + hit.getCategory();
        }
        return hit.getBrand() != null ? hit.getBrand() : hit.getCategory();
    }
}
