package com.scoutiq.web.normalize;

import com.scoutiq.web.config.WebSearchConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Price extraction, retailer allowlisting and product-page detection for web results.
 *
 * <p>Every method is total: malformed input yields {@code Optional.empty()} or {@code false},
 * never an exception.
 */
@Component
public class PriceDomainNormalizer {

    public static final double MAX_PRICE_EXCLUSIVE = 10_000.0;

    /** Digits may not continue past the match, so "$12.999" is rejected rather than read as 12.0 */
    private static final String AMOUNT = "(\\d{1,3}(?:,\\d{3})+(?:\\.\\d{1,2})?|\\d+(?:\\.\\d{1,2})?)(?![.,]?\\d)";

    private static final List<Pattern> PRICE_PATTERNS = List.of(
            Pattern.compile("\\$\\s*" + AMOUNT),
            Pattern.compile("\\bUSD\\s*" + AMOUNT, Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?<![\\d.,])" + AMOUNT + "\\s*USD\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?<![\\d.,])" + AMOUNT + "\\s*dollars?\\b", Pattern.CASE_INSENSITIVE)
    );

    private final List<String> allowedDomains;

    @Autowired
    public PriceDomainNormalizer(WebSearchConfig webSearchConfig) {
        this(webSearchConfig.getAllowedDomains());
    }

    public PriceDomainNormalizer(Collection<String> allowedDomains) {
        this.allowedDomains = allowedDomains == null
                ? List.of()
                : allowedDomains.stream()
                        .map(PriceDomainNormalizer::canonicalDomain)
                        .filter(d -> !d.isEmpty())
                        .distinct()
                        .toList();
    }

    public List<String> getAllowedDomains() {
        return allowedDomains;
    }

    /**
     * Extract the first plausible price from free text.
     * Recognizes "$12.99", "USD 12.99", "12.99 USD" and "12 dollars"; values outside (0, 10000) are skipped.
     */
    public static Optional<Double> extractPrice(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (Pattern pattern : PRICE_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                // AMOUNT only ever captures digits, grouping commas and one decimal point
                double value = Double.parseDouble(matcher.group(1).replace(",", ""));
                if (isValidPrice(value)) {
                    return Optional.of(value);
                }
            }
        }
        return Optional.empty();
    }

    public static boolean isValidPrice(Double price) {
        return price != null && !price.isNaN() && price > 0 && price < MAX_PRICE_EXCLUSIVE;
    }

    public boolean isAllowedDomain(String url) {
        return matchedDomain(url).isPresent();
    }

    /**
     * The allowlist entry the URL's host belongs to: the exact host or a proper subdomain of it.
     * "amazon.com.evil.tld" and "notamazon.com" match nothing.
     */
    public Optional<String> matchedDomain(String url) {
        Optional<String> host = hostOf(url);
        if (host.isEmpty()) {
            return Optional.empty();
        }
        String hostname = host.get();
        for (String allowed : allowedDomains) {
            if (hostname.equals(allowed) || hostname.endsWith("." + allowed)) {
                return Optional.of(allowed);
            }
        }
        return Optional.empty();
    }

    /**
     * True when the URL is on an allowlisted retailer and its path looks like a single item page.
     * Allowlisted domains without a known pattern set never qualify.
     */
    public boolean isProductPage(String url) {
        Optional<String> domain = matchedDomain(url);
        Optional<URI> uri = parse(url);
        if (domain.isEmpty() || uri.isEmpty()) {
            return false;
        }
        String path = Optional.ofNullable(uri.get().getRawPath()).orElse("");
        List<Pattern> patterns = ProductPagePatterns.BY_DOMAIN.getOrDefault(domain.get(), List.of());
        return patterns.stream().anyMatch(p -> p.matcher(path).find());
    }

    /**
     * Marketplace item code (Amazon ASIN) for URLs the price lookup service can resolve.
     */
    public Optional<String> extractItemCode(String url) {
        Optional<String> domain = matchedDomain(url);
        Optional<URI> uri = parse(url);
        if (domain.isEmpty() || uri.isEmpty() || !ProductPagePatterns.AMAZON.equals(domain.get())) {
            return Optional.empty();
        }
        String path = Optional.ofNullable(uri.get().getRawPath()).orElse("");
        for (Pattern pattern : ProductPagePatterns.AMAZON_ITEM) {
            Matcher matcher = pattern.matcher(path);
            if (matcher.find()) {
                return Optional.of(matcher.group(1).toUpperCase(Locale.ROOT));
            }
        }
        return Optional.empty();
    }

    /**
     * Identity form of a URL: lower-cased scheme and host plus path, with query, fragment,
     * port and trailing slash removed.
     */
    public static Optional<String> normalizeUrl(String url) {
        Optional<URI> parsed = parse(url);
        Optional<String> host = parsed.flatMap(PriceDomainNormalizer::hostOf);
        if (host.isEmpty()) {
            return Optional.empty();
        }
        String path = Optional.ofNullable(parsed.get().getRawPath()).orElse("");
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return Optional.of(parsed.get().getScheme().toLowerCase(Locale.ROOT) + "://" + host.get() + path);
    }

    private static Optional<String> hostOf(String url) {
        return parse(url).flatMap(PriceDomainNormalizer::hostOf);
    }

    private static Optional<String> hostOf(URI uri) {
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            return Optional.empty();
        }
        host = host.toLowerCase(Locale.ROOT);
        if (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        return Optional.of(host);
    }

    private static Optional<URI> parse(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                return Optional.empty();
            }
            return Optional.of(uri);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    private static String canonicalDomain(String domain) {
        if (domain == null) {
            return "";
        }
        String d = domain.trim().toLowerCase(Locale.ROOT);
        while (d.startsWith(".")) {
            d = d.substring(1);
        }
        if (d.startsWith("www.")) {
            d = d.substring(4);
        }
        return d;
    }
}
