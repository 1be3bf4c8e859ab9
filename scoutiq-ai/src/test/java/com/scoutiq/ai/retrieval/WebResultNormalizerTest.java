package com.scoutiq.ai.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import com.scoutiq.ai.model.RawResult;
import com.scoutiq.common.enums.ResultSource;
import com.scoutiq.web.normalize.PriceDomainNormalizer;
import java.util.List;
import org.junit.jupiter.api.Test;

class WebResultNormalizerTest {

    private final WebResultNormalizer normalizer =
        new WebResultNormalizer(new PriceDomainNormalizer(List.of("amazon.com", "walmart.com", "target.com")));

    @Test
    void rejectsHostsOutsideAllowlist() {
        List<RawResult> kept = normalizer.normalize(List.of(
            hit("https://amazon.com.evil.tld/dp/B07XJ8C8F5", "Fake", null),
            hit("https://www.ebay.com/itm/1", "Elsewhere", null),
            hit("https://www.amazon.com/dp/B07XJ8C8F5", "Real", null)));

        assertThat(kept).extracting(RawResult::getTitle).containsExactly("Real");
    }

    @Test
    void keepsProductPagesPerDomainAndFallsBackToListings() {
        List<RawResult> kept = normalizer.normalize(List.of(
            hit("https://www.amazon.com/s?k=cleaner", "Amazon search", null),
            hit("https://www.amazon.com/dp/B07XJ8C8F5", "Amazon item", null),
            hit("https://www.walmart.com/browse/cleaning/123", "Walmart listing", null)));

        assertThat(kept).extracting(RawResult::getTitle).containsExactly("Amazon item", "Walmart listing");
        assertThat(kept.get(0).isProductPage()).isTrue();
        assertThat(kept.get(0).getItemCode()).isEqualTo("B07XJ8C8F5");
        assertThat(kept.get(1).isProductPage()).isFalse();
    }

    @Test
    void resolvesPriceFromTypedFieldThenTitleThenSnippet() {
        RawResult typed = hit("https://www.target.com/p/a", "Cleaner $9.99", "Now $13.50").toBuilder().price(7.0).build();
        RawResult badTyped = hit("https://www.target.com/p/b", "Cleaner $9.99", "Now $13.50").toBuilder().price(-3.0).build();
        RawResult snippetOnly = hit("https://www.target.com/p/c", "Cleaner", "Now $13.50");
        RawResult none = hit("https://www.target.com/p/d", "Cleaner", "See price in cart");

        assertThat(WebResultNormalizer.resolveTextPrice(typed)).isEqualTo(7.0);
        assertThat(WebResultNormalizer.resolveTextPrice(badTyped)).isEqualTo(9.99);
        assertThat(WebResultNormalizer.resolveTextPrice(snippetOnly)).isEqualTo(13.50);
        assertThat(WebResultNormalizer.resolveTextPrice(none)).isNull();
    }

    private static RawResult hit(String url, String title, String snippet) {
        return RawResult.builder()
            .identityKey(PriceDomainNormalizer.normalizeUrl(url).orElse(url))
            .url(url)
            .title(title)
            .snippet(snippet)
            .score(0.5)
            .source(ResultSource.WEB)
            .build();
    }
}
