package com.scoutiq.ai.config;

import com.scoutiq.common.exception.ConfigurationException;
import com.scoutiq.rag.config.RagConfig;
import com.scoutiq.web.config.WebSearchConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Fails application startup on configuration that would otherwise surface as per-query errors.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScoutConfigurationValidator {

    private static final Pattern DOMAIN = Pattern.compile("^\\.?([a-z0-9]([a-z0-9-]*[a-z0-9])?\\.)+[a-z]{2,}$");

    private final RetrievalConfig retrievalConfig;
    private final RagConfig ragConfig;
    private final WebSearchConfig webSearchConfig;

    @Value("${vertex.ai.project-id:}")
    private String vertexProjectId;

    @PostConstruct
    public void validate() {
        boolean catalog = retrievalConfig.isCatalogEnabled() && ragConfig.isEnabled();
        boolean web = retrievalConfig.isWebEnabled() && webSearchConfig.isEnabled();

        if (!catalog && !web) {
            throw new ConfigurationException("At least one of catalog search or web search must be enabled");
        }
        if (catalog) {
            requireSet(vertexProjectId, "vertex.ai.project-id");
            requireSet(ragConfig.getVectorSearch().getIndexEndpoint(), "scoutiq.rag.vector-search.index-endpoint");
            requireSet(ragConfig.getVectorSearch().getDeployedIndexId(), "scoutiq.rag.vector-search.deployed-index-id");
            requireSet(ragConfig.getVectorSearch().getApiEndpoint(), "scoutiq.rag.vector-search.api-endpoint");
        }
        if (web) {
            requireSet(webSearchConfig.getTavily().getApiKey(), "scoutiq.web.tavily.api-key");
            validateAllowlist(webSearchConfig.getAllowedDomains());
            if (webSearchConfig.getRainforest().isEnabled()) {
                requireSet(webSearchConfig.getRainforest().getApiKey(), "scoutiq.web.rainforest.api-key");
            }
        }

        requirePositive(retrievalConfig.getCatalogTimeoutMs(), "scoutiq.retrieval.catalog-timeout-ms");
        requirePositive(retrievalConfig.getWebTimeoutMs(), "scoutiq.retrieval.web-timeout-ms");
        requirePositive(retrievalConfig.getLookupTimeoutMs(), "scoutiq.retrieval.lookup-timeout-ms");
        requirePositive(retrievalConfig.getQueueTimeoutMs(), "scoutiq.retrieval.queue-timeout-ms");
        requirePositive(retrievalConfig.getLookupMaxConcurrency(), "scoutiq.retrieval.lookup-max-concurrency");
        requirePositive(retrievalConfig.getTopN(), "scoutiq.retrieval.top-n");
        requirePositive(retrievalConfig.getCatalogTopK(), "scoutiq.retrieval.catalog-top-k");
        requirePositive(retrievalConfig.getWebTopK(), "scoutiq.retrieval.web-top-k");

        log.info("Search configuration valid: catalog={}, web={}, allowedDomains={}, topN={}",
                catalog, web, webSearchConfig.getAllowedDomains(), retrievalConfig.getTopN());
    }

    static void validateAllowlist(List<String> domains) {
        if (domains == null || domains.isEmpty()) {
            throw ConfigurationException.invalidAllowlist("no domains configured");
        }
        for (String domain : domains) {
            String candidate = domain == null ? "" : domain.trim().toLowerCase(Locale.ROOT);
            if (!DOMAIN.matcher(candidate).matches()) {
                throw ConfigurationException.invalidAllowlist("'" + domain + "' is not a hostname");
            }
        }
    }

    private static void requireSet(String value, String property) {
        if (value == null || value.isBlank()) {
            throw ConfigurationException.missingCredential(property);
        }
    }

    private static void requirePositive(long value, String property) {
        if (value <= 0) {
            throw new ConfigurationException(property + " must be positive, was " + value);
        }
    }
}
