package com.scoutiq.ai.retrieval;

import com.scoutiq.ai.config.RetrievalConfig;
import com.scoutiq.ai.model.ConversationState;
import com.scoutiq.ai.model.RawResult;
import com.scoutiq.ai.model.ReconciledResult;
import com.scoutiq.common.enums.SearchStrategy;
import com.scoutiq.web.normalize.PriceDomainNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Third pipeline stage. Queries the catalog and the web concurrently, normalizes what comes back,
 * reconciles both into one ranked list and writes it to the state.
 *
 * Never throws for source failures: a source that times out or errors contributes nothing and is
 * recorded in the state log. If the calling thread is interrupted every in-flight task is cancelled,
 * the state is left without results and the interrupt flag is restored for the caller.
 */
@Slf4j
@Service
public class RetrieverService {

    public static final String NODE = "retriever";

    private final CatalogSearchAdapter catalogAdapter;
    private final WebSearchAdapter webAdapter;
    private final WebResultNormalizer webResultNormalizer;
    private final PriceDomainNormalizer priceDomainNormalizer;
    private final RetrievalConfig retrievalConfig;
    private final ExecutorService retrievalExecutor;
    private final ExecutorService priceLookupExecutor;

    public RetrieverService(
            CatalogSearchAdapter catalogAdapter,
            WebSearchAdapter webAdapter,
            WebResultNormalizer webResultNormalizer,
            PriceDomainNormalizer priceDomainNormalizer,
            RetrievalConfig retrievalConfig,
            @Qualifier("retrievalExecutor") ExecutorService retrievalExecutor,
            @Qualifier("priceLookupExecutor") ExecutorService priceLookupExecutor) {
        this.catalogAdapter = catalogAdapter;
        this.webAdapter = webAdapter;
        this.webResultNormalizer = webResultNormalizer;
        this.priceDomainNormalizer = priceDomainNormalizer;
        this.retrievalConfig = retrievalConfig;
        this.retrievalExecutor = retrievalExecutor;
        this.priceLookupExecutor = priceLookupExecutor;
    }

    public void retrieve(ConversationState state) {
        long startTime = System.currentTimeMillis();
        SearchStrategy strategy = state.getStrategy() != null ? state.getStrategy() : SearchStrategy.HYBRID;
        String text = state.getQuery();
        List<String> allowedDomains = priceDomainNormalizer.getAllowedDomains();

        long dispatchedAt = System.nanoTime();
        SourceTask catalogTask = strategy.usesCatalog()
                ? new SourceTask(() -> catalogAdapter.query(text, retrievalConfig.getCatalogTopK()))
                : null;
        SourceTask webTask = strategy.usesWeb()
                ? new SourceTask(() -> webAdapter.query(text, allowedDomains, retrievalConfig.getWebTopK()))
                : null;
        Future<List<RawResult>> catalogFuture = catalogTask != null ? retrievalExecutor.submit(catalogTask) : null;
        Future<List<RawResult>> webFuture = webTask != null ? retrievalExecutor.submit(webTask) : null;

        PriceLookupBatch lookups = new PriceLookupBatch(webAdapter, priceLookupExecutor, retrievalConfig.getLookupTimeoutMs());
        try {
            SourceOutcome catalog = await(CatalogSearchAdapter.SOURCE, catalogTask, catalogFuture, dispatchedAt,
                    retrievalConfig.getCatalogTimeoutMs());
            SourceOutcome web = await(WebSearchAdapter.SOURCE, webTask, webFuture, dispatchedAt,
                    retrievalConfig.getWebTimeoutMs());
            recordOutcome(state, catalog);
            recordOutcome(state, web);

            List<RawResult> catalogResults = normalizeCatalog(catalog.getResults());
            List<RawResult> webResults = webResultNormalizer.normalize(web.getResults());
            if (webAdapter.isLookupAvailable()) {
                webResults = lookups.resolve(webResults);
            }

            ResultReconciler reconciler = new ResultReconciler(retrievalConfig.getPricePrecedence());
            Double maxPrice = state.getConstraints() != null ? state.getConstraints().getMaxPrice() : null;
            int topN = state.getTopN() != null && state.getTopN() > 0 ? state.getTopN() : retrievalConfig.getTopN();
            List<ReconciledResult> reconciled = reconciler.reconcile(catalogResults, webResults, maxPrice, topN);

            state.setRawCatalogResults(catalogResults);
            state.setRawWebResults(webResults);
            state.setReconciledResults(reconciled);

            boolean anyDispatched = !catalog.isSkipped() || !web.isSkipped();
            boolean allFailed = anyDispatched
                    && (catalog.isSkipped() || catalog.isError())
                    && (web.isSkipped() || web.isError());
            state.setRetrievalFailed(allFailed);

            long tookMs = System.currentTimeMillis() - startTime;
            state.step(NODE, String.format("catalog=%d, web=%d, merged=%d%s",
                    catalogResults.size(), webResults.size(), reconciled.size(),
                    allFailed ? ", all sources unavailable" : ""));
            log.info("Retrieved query='{}' strategy={} catalog={} web={} reconciled={} in {}ms",
                    text, strategy, catalogResults.size(), webResults.size(), reconciled.size(), tookMs);

        } catch (InterruptedException e) {
            cancel(catalogFuture);
            cancel(webFuture);
            lookups.cancelAll();
            Thread.currentThread().interrupt();
            state.log(NODE + ": cancelled");
            log.info("Retrieval cancelled for query='{}'", text);
        }
    }

    /**
     * The source timeout runs from the moment a pool thread starts the task. Time spent queued behind
     * other requests is bounded separately by scoutiq.retrieval.queue-timeout-ms.
     */
    private SourceOutcome await(String source, SourceTask task, Future<List<RawResult>> future,
                                long dispatchedAt, long timeoutMs) throws InterruptedException {
        if (future == null) {
            return SourceOutcome.skipped(source);
        }
        long queueWaitNanos = dispatchedAt + TimeUnit.MILLISECONDS.toNanos(retrievalConfig.getQueueTimeoutMs())
                - System.nanoTime();
        if (!task.awaitStart(Math.max(0L, queueWaitNanos), TimeUnit.NANOSECONDS)) {
            future.cancel(true);
            log.warn("Search source {} never started within {}ms, retrieval pool saturated",
                    source, retrievalConfig.getQueueTimeoutMs());
            return SourceOutcome.timedOut(source, elapsedMs(dispatchedAt));
        }
        long remainingNanos = task.startedAtNanos() + TimeUnit.MILLISECONDS.toNanos(timeoutMs) - System.nanoTime();
        try {
            List<RawResult> results = future.get(Math.max(0L, remainingNanos), TimeUnit.NANOSECONDS);
            return SourceOutcome.success(source, results, elapsedMs(task.startedAtNanos()));
        } catch (TimeoutException e) {
            future.cancel(true);
            return SourceOutcome.timedOut(source, elapsedMs(task.startedAtNanos()));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return SourceOutcome.error(source, cause.getMessage(), elapsedMs(task.startedAtNanos()));
        }
    }

    private void recordOutcome(ConversationState state, SourceOutcome outcome) {
        if (outcome.isError()) {
            state.getUnavailableSources().add(outcome.getSource());
            state.log(NODE + ": degraded, " + outcome.describe());
            log.warn("Search source degraded: {}", outcome.describe());
        } else if (!outcome.isSkipped()) {
            log.debug("Search source finished: {}", outcome.describe());
        }
    }

    /**
     * Catalog rows keep their identity; a price outside (0, 10000) is treated as absent.
     */
    private List<RawResult> normalizeCatalog(List<RawResult> results) {
        List<RawResult> normalized = new ArrayList<>(results.size());
        for (RawResult result : results) {
            if (result.getPrice() != null && !PriceDomainNormalizer.isValidPrice(result.getPrice())) {
                log.debug("Ignoring out-of-range catalog price {} for {}", result.getPrice(), result.getIdentityKey());
                result = result.toBuilder().price(null).build();
            }
            normalized.add(result);
        }
        return normalized;
    }

    private static void cancel(Future<?> future) {
        if (future != null) {
            future.cancel(true);
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
