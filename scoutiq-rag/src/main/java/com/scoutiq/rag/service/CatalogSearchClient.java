package com.scoutiq.rag.service;

import com.scoutiq.rag.dto.CatalogHit;

import java.util.List;

/**
 * Similarity search over the pre-built product index.
 */
public interface CatalogSearchClient {

    /**
     * @param queryText natural-language query
     * @param topK maximum number of hits
     * @return hits ordered by the backend, most similar first
     * @throws com.scoutiq.common.exception.SourceUnavailableException when the index cannot be queried
     */
    List<CatalogHit> search(String queryText, int topK);

    boolean isAvailable();
}
