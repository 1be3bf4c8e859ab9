package com.scoutiq.ai.config;

import com.scoutiq.common.enums.PricePrecedence;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Retriever tuning: which sources run, how long each may take, and how results are capped.
 * Maps to scoutiq.retrieval.* properties in application.properties.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scoutiq.retrieval")
public class RetrievalConfig {

    private boolean catalogEnabled = true;
    private boolean webEnabled = true;

    /** Hits requested from each source */
    private int catalogTopK = 10;
    private int webTopK = 10;

    /** Results kept after ranking */
    private int topN = 10;

    private long catalogTimeoutMs = 8000;
    private long webTimeoutMs = 8000;

    /** Deadline for the whole batch of authoritative price lookups */
    private long lookupTimeoutMs = 5000;
    private int lookupMaxConcurrency = 3;

    /** Threads for the concurrent catalog/web dispatch; two per concurrent pipeline run */
    private int poolSize = 16;

    /** How long a source task may wait for a free dispatch thread before it counts as timed out */
    private long queueTimeoutMs = 30000;

    private PricePrecedence pricePrecedence = PricePrecedence.CATALOG;
}
