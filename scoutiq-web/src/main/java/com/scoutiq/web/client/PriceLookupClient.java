package com.scoutiq.web.client;

import com.scoutiq.web.dto.PriceLookupResult;

import java.util.Optional;

/**
 * Per-item price lookup against a marketplace's own product data.
 */
public interface PriceLookupClient {

    /**
     * @param itemCode marketplace item code, e.g. an Amazon ASIN
     * @return product data, empty when the marketplace does not know the item
     * @throws com.scoutiq.common.exception.SourceUnavailableException when the lookup service fails
     */
    Optional<PriceLookupResult> lookup(String itemCode);

    boolean isAvailable();
}
