package com.scoutiq.ai.retrieval;

import com.scoutiq.ai.model.RawResult;
import com.scoutiq.web.dto.PriceLookupResult;
import com.scoutiq.web.normalize.PriceDomainNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Authoritative price lookups for web results that are still priceless but carry an item code.
 * All lookups share one deadline; anything unfinished at the deadline is cancelled and its
 * result keeps an absent price.
 */
@Slf4j
class PriceLookupBatch {

    private final WebSearchAdapter webSearchAdapter;
    private final ExecutorService executor;
    private final long deadlineMs;
    private final List<Future<?>> inFlight = new ArrayList<>();

    PriceLookupBatch(WebSearchAdapter webSearchAdapter, ExecutorService executor, long deadlineMs) {
        this.webSearchAdapter = webSearchAdapter;
        this.executor = executor;
        this.deadlineMs = deadlineMs;
    }

    /**
     * @return results in input order, with lookup prices filled where a lookup succeeded in time
     * @throws InterruptedException if the calling thread is interrupted; pending lookups are cancelled first
     */
    List<RawResult> resolve(List<RawResult> results) throws InterruptedException {
        Map<Integer, Future<Optional<PriceLookupResult>>> pending = new LinkedHashMap<>();
        for (int i = 0; i < results.size(); i++) {
            RawResult result = results.get(i);
            if (result.getPrice() == null && result.getItemCode() != null) {
                String itemCode = result.getItemCode();
                Future<Optional<PriceLookupResult>> future = executor.submit(() -> webSearchAdapter.lookupPrice(itemCode));
                pending.put(i, future);
                inFlight.add(future);
            }
        }
        if (pending.isEmpty()) {
            return results;
        }

        List<RawResult> resolved = new ArrayList<>(results);
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(deadlineMs);
        int filled = 0;
        int timedOut = 0;
        try {
            for (Map.Entry<Integer, Future<Optional<PriceLookupResult>>> entry : pending.entrySet()) {
                Future<Optional<PriceLookupResult>> future = entry.getValue();
                long remaining = Math.max(0L, deadline - System.nanoTime());
                try {
                    Optional<PriceLookupResult> lookup = future.get(remaining, TimeUnit.NANOSECONDS);
                    if (lookup.isPresent()) {
                        RawResult merged = apply(resolved.get(entry.getKey()), lookup.get());
                        if (merged.getPrice() != null) {
                            filled++;
                        }
                        resolved.set(entry.getKey(), merged);
                    }
                } catch (TimeoutException e) {
                    future.cancel(true);
                    timedOut++;
                } catch (ExecutionException e) {
                    log.warn("Price lookup failed for {}: {}", resolved.get(entry.getKey()).getItemCode(),
                            e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
                }
            }
        } catch (InterruptedException e) {
            cancelAll();
            throw e;
        }

        log.info("Price lookups: requested={}, filled={}, timedOut={}", pending.size(), filled, timedOut);
        return resolved;
    }

    void cancelAll() {
        inFlight.forEach(f -> f.cancel(true));
    }

    private static RawResult apply(RawResult result, PriceLookupResult lookup) {
        RawResult.RawResultBuilder builder = result.toBuilder();
        if (PriceDomainNormalizer.isValidPrice(lookup.getPrice())) {
            builder.price(lookup.getPrice());
        }
        if ((result.getTitle() == null || result.getTitle().isBlank()) && lookup.getTitle() != null) {
            builder.title(lookup.getTitle());
        }
        return builder.build();
    }
}
