package com.scoutiq.ai.retrieval;

import com.scoutiq.ai.model.RawResult;
import com.scoutiq.web.normalize.PriceDomainNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cleans raw web hits before reconciliation.
 *
 * <ul>
 *   <li>drops hosts outside the retailer allowlist</li>
 *   <li>per retailer, keeps only product pages when that retailer returned any, otherwise keeps its
 *       listing pages as a fallback pool</li>
 *   <li>resolves price from the typed field, then the title, then the snippet</li>
 *   <li>records the marketplace item code for a later authoritative lookup</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebResultNormalizer {

    private final PriceDomainNormalizer normalizer;

    public List<RawResult> normalize(List<RawResult> webResults) {
        Map<String, List<RawResult>> byDomain = new LinkedHashMap<>();
        int rejected = 0;
        for (RawResult result : webResults) {
            Optional<String> domain = normalizer.matchedDomain(result.getUrl());
            if (domain.isEmpty()) {
                rejected++;
                continue;
            }
            RawResult annotated = result.toBuilder()
                    .productPage(normalizer.isProductPage(result.getUrl()))
                    .itemCode(normalizer.extractItemCode(result.getUrl()).orElse(null))
                    .price(resolveTextPrice(result))
                    .build();
            byDomain.computeIfAbsent(domain.get(), d -> new ArrayList<>()).add(annotated);
        }

        List<RawResult> kept = new ArrayList<>();
        byDomain.forEach((domain, results) -> {
            List<RawResult> productPages = results.stream().filter(RawResult::isProductPage).toList();
            if (productPages.isEmpty()) {
                log.debug("No product pages from {}, keeping {} listing results", domain, results.size());
                kept.addAll(results);
            } else {
                kept.addAll(productPages);
            }
        });

        if (rejected > 0) {
            log.info("Rejected {} web results outside the allowed domains", rejected);
        }
        return kept;
    }

    /**
     * Typed price when in bounds, else the first price found in the title, else in the snippet.
     */
    static Double resolveTextPrice(RawResult result) {
        if (PriceDomainNormalizer.isValidPrice(result.getPrice())) {
            return result.getPrice();
        }
        return PriceDomainNormalizer.extractPrice(result.getTitle())
                .or(() -> PriceDomainNormalizer.extractPrice(result.getSnippet()))
                .orElse(null);
    }
}
