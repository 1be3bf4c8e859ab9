package com.scoutiq.ai.retrieval;

import com.scoutiq.ai.model.RawResult;
import com.scoutiq.ai.model.ReconciledResult;
import com.scoutiq.common.enums.PricePrecedence;
import com.scoutiq.common.enums.ResultSource;
import com.scoutiq.web.normalize.PriceDomainNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Merges catalog and web results into one de-duplicated, ranked list.
 *
 * <p>A web result joins a catalog record when their identity keys are equal, when the web URL
 * normalizes to the catalog record's URL, or when the web item code equals the catalog product ID.
 * The merged record keeps the catalog title and URL, takes the higher score and fills missing
 * fields from the web side. Price follows the configured {@link PricePrecedence}.
 *
 * <p>Ordering is a total order, so the output does not depend on which source finished first.
 */
public class ResultReconciler {

    static final Comparator<RawResult> RANKING = Comparator
            .comparingDouble(ResultReconciler::scoreOrLowest).reversed()
            .thenComparing(RawResult::getSource, Comparator.nullsLast(Comparator.comparingInt(ResultSource::ordinal)))
            .thenComparing(RawResult::getPrice, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(r -> r.getTitle() == null ? "" : r.getTitle())
            .thenComparing(RawResult::getIdentityKey);

    private final PricePrecedence pricePrecedence;

    public ResultReconciler(PricePrecedence pricePrecedence) {
        this.pricePrecedence = pricePrecedence == null ? PricePrecedence.CATALOG : pricePrecedence;
    }

    public List<ReconciledResult> reconcile(List<RawResult> catalog, List<RawResult> web, Double maxPrice, int topN) {
        Map<String, RawResult> merged = new LinkedHashMap<>();
        Map<String, String> catalogAliases = new HashMap<>();

        for (RawResult result : catalog) {
            merged.merge(result.getIdentityKey(), result, ResultReconciler::mergeSameSource);
            PriceDomainNormalizer.normalizeUrl(result.getUrl())
                    .ifPresent(url -> catalogAliases.putIfAbsent(url, result.getIdentityKey()));
            catalogAliases.putIfAbsent(itemAlias(result.getIdentityKey()), result.getIdentityKey());
        }

        for (RawResult result : web) {
            String catalogKey = catalogKeyFor(result, merged, catalogAliases);
            if (catalogKey != null) {
                merged.put(catalogKey, mergeAcrossSources(merged.get(catalogKey), result));
            } else {
                merged.merge(result.getIdentityKey(), result, ResultReconciler::mergeSameSource);
            }
        }

        List<RawResult> candidates = new ArrayList<>();
        for (RawResult result : merged.values()) {
            if (maxPrice != null && result.getPrice() != null && result.getPrice() > maxPrice) {
                continue;
            }
            candidates.add(result);
        }
        candidates.sort(RANKING);

        List<ReconciledResult> ranked = new ArrayList<>();
        for (int i = 0; i < candidates.size() && i < topN; i++) {
            ranked.add(ReconciledResult.from(candidates.get(i), i));
        }
        return ranked;
    }

    private static String catalogKeyFor(RawResult web, Map<String, RawResult> merged, Map<String, String> aliases) {
        RawResult direct = merged.get(web.getIdentityKey());
        if (direct != null && direct.getSource() == ResultSource.CATALOG) {
            return web.getIdentityKey();
        }
        String byUrl = aliases.get(web.getIdentityKey());
        if (byUrl != null) {
            return byUrl;
        }
        if (web.getItemCode() != null) {
            return aliases.get(itemAlias(web.getItemCode()));
        }
        return null;
    }

    private static String itemAlias(String id) {
        return "item:" + id.toUpperCase(Locale.ROOT);
    }

    private RawResult mergeAcrossSources(RawResult catalog, RawResult web) {
        Double price = pricePrecedence == PricePrecedence.WEB
                ? firstNonNull(web.getPrice(), catalog.getPrice())
                : firstNonNull(catalog.getPrice(), web.getPrice());
        return catalog.toBuilder()
                .title(isBlank(catalog.getTitle()) ? web.getTitle() : catalog.getTitle())
                .url(isBlank(catalog.getUrl()) ? web.getUrl() : catalog.getUrl())
                .snippet(isBlank(catalog.getSnippet()) ? web.getSnippet() : catalog.getSnippet())
                .price(price)
                .score(maxScore(catalog.getScore(), web.getScore()))
                .build();
    }

    /**
     * Duplicate within one source: the higher-scored record wins, absent fields are filled from the other.
     */
    static RawResult mergeSameSource(RawResult existing, RawResult incoming) {
        boolean keepExisting = scoreOrLowest(existing) >= scoreOrLowest(incoming);
        RawResult winner = keepExisting ? existing : incoming;
        RawResult other = keepExisting ? incoming : existing;
        return winner.toBuilder()
                .price(firstNonNull(winner.getPrice(), other.getPrice()))
                .snippet(isBlank(winner.getSnippet()) ? other.getSnippet() : winner.getSnippet())
                .title(isBlank(winner.getTitle()) ? other.getTitle() : winner.getTitle())
                .build();
    }

    private static double scoreOrLowest(RawResult result) {
        return Optional.ofNullable(result.getScore()).filter(s -> !s.isNaN()).orElse(-Double.MAX_VALUE);
    }

    private static Double maxScore(Double a, Double b) {
        if (a == null) return b;
        if (b == null) return a;
        return Math.max(a, b);
    }

    private static <T> T firstNonNull(T first, T second) {
        return first != null ? first : second;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
