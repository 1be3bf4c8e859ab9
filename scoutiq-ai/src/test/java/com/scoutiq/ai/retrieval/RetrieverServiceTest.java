package com.scoutiq.ai.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scoutiq.ai.config.RetrievalConfig;
import com.scoutiq.ai.model.Constraints;
import com.scoutiq.ai.model.ConversationState;
import com.scoutiq.ai.model.RawResult;
import com.scoutiq.ai.model.ReconciledResult;
import com.scoutiq.common.enums.ResultSource;
import com.scoutiq.common.enums.SearchStrategy;
import com.scoutiq.common.exception.SourceUnavailableException;
import com.scoutiq.web.dto.PriceLookupResult;
import com.scoutiq.web.normalize.PriceDomainNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RetrieverServiceTest {

    @Mock
    private CatalogSearchAdapter catalogAdapter;

    @Mock
    private WebSearchAdapter webAdapter;

    private RetrievalConfig config;
    private ExecutorService retrievalExecutor;
    private ExecutorService lookupExecutor;
    private RetrieverService retriever;

    @BeforeEach
    void setUp() {
        config = new RetrievalConfig();
        retrievalExecutor = Executors.newFixedThreadPool(4);
        lookupExecutor = Executors.newFixedThreadPool(3);
        PriceDomainNormalizer normalizer = new PriceDomainNormalizer(List.of("amazon.com", "walmart.com", "target.com"));
        retriever = new RetrieverService(
            catalogAdapter,
            webAdapter,
            new WebResultNormalizer(normalizer),
            normalizer,
            config,
            retrievalExecutor,
            lookupExecutor);
    }

    @AfterEach
    void tearDown() {
        retrievalExecutor.shutdownNow();
        lookupExecutor.shutdownNow();
    }

    @Test
    void fusesCatalogAndWebWithinBudget() {
        when(catalogAdapter.query(anyString(), anyInt())).thenReturn(List.of(
            catalogHit("B0CLEAN001", "Eco Stainless Steel Cleaner", 12.99, 0.82)));
        when(webAdapter.query(anyString(), anyList(), anyInt())).thenReturn(List.of(
            webHit("https://www.target.com/p/steel-cleaner/-/A-54321", "Steel Cleaner Spray", "Now $13.50", 0.74),
            webHit("https://www.walmart.com/ip/deluxe/999", "Deluxe Steel Cleaner Kit", "Only $24.99", 0.9)));
        ConversationState state = hybridState("eco stainless steel cleaner under $15", 15.0);

        retriever.retrieve(state);

        List<ReconciledResult> results = state.getReconciledResults();
        assertThat(results).extracting(ReconciledResult::getSource)
            .containsExactly(ResultSource.CATALOG, ResultSource.WEB);
        assertThat(results.get(0).getPrice()).isEqualTo(12.99);
        assertThat(results.get(1).getPrice()).isEqualTo(13.50);
        assertThat(results).allSatisfy(r -> assertThat(r.getPrice()).isLessThanOrEqualTo(15.0));
        assertThat(state.isRetrievalFailed()).isFalse();
        assertThat(state.getSteps()).extracting("node").containsExactly("retriever");
    }

    @Test
    void catalogPriceWinsWhenIdentityCollides() {
        when(catalogAdapter.query(anyString(), anyInt())).thenReturn(List.of(
            catalogHit("B07XJ8C8F5", "Eco Stainless Steel Cleaner", 12.99, 0.82)));
        when(webAdapter.query(anyString(), anyList(), anyInt())).thenReturn(List.of(
            webHit("https://www.amazon.com/Cleaner/dp/B07XJ8C8F5", "Amazon.com: Cleaner", "Now $13.50", 0.95)));
        ConversationState state = hybridState("eco stainless steel cleaner under $15", 15.0);

        retriever.retrieve(state);

        assertThat(state.getReconciledResults()).singleElement().satisfies(r -> {
            assertThat(r.getIdentityKey()).isEqualTo("B07XJ8C8F5");
            assertThat(r.getPrice()).isEqualTo(12.99);
            assertThat(r.getScore()).isEqualTo(0.95);
            assertThat(r.getTitle()).isEqualTo("Eco Stainless Steel Cleaner");
        });
    }

    @Test
    void webFailureDegradesToCatalogResults() {
        when(catalogAdapter.query(anyString(), anyInt())).thenReturn(List.of(
            catalogHit("p1", "One", 5.0, 0.9),
            catalogHit("p2", "Two", 6.0, 0.8)));
        when(webAdapter.query(anyString(), anyList(), anyInt()))
            .thenThrow(new SourceUnavailableException("web", "Web search failed: 503"));
        ConversationState state = hybridState("steel cleaner", null);

        retriever.retrieve(state);

        assertThat(state.getReconciledResults()).extracting(ReconciledResult::getIdentityKey).containsExactly("p1", "p2");
        assertThat(state.isRetrievalFailed()).isFalse();
        assertThat(state.getUnavailableSources()).containsExactly("web");
        assertThat(state.getLog()).anyMatch(line -> line.contains("degraded") && line.contains("web"));
    }

    @Test
    void slowWebSourceTimesOutWithoutBlockingCatalog() {
        config.setWebTimeoutMs(100);
        when(catalogAdapter.query(anyString(), anyInt())).thenReturn(List.of(catalogHit("p1", "One", 5.0, 0.9)));
        when(webAdapter.query(anyString(), anyList(), anyInt())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return List.of();
        });
        ConversationState state = hybridState("steel cleaner", null);

        long start = System.nanoTime();
        retriever.retrieve(state);
        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(tookMs).isLessThan(3_000);
        assertThat(state.getReconciledResults()).extracting(ReconciledResult::getIdentityKey).containsExactly("p1");
        assertThat(state.getLog()).anyMatch(line -> line.contains("timed out"));
    }

    @Test
    void sourceTimeoutStartsWhenTaskRunsNotWhenQueued() throws Exception {
        config.setCatalogTimeoutMs(400);
        config.setWebTimeoutMs(400);
        when(catalogAdapter.query(anyString(), anyInt())).thenAnswer(invocation -> {
            Thread.sleep(150);
            return List.of(catalogHit("p1", "One", 5.0, 0.9));
        });
        when(webAdapter.query(anyString(), anyList(), anyInt())).thenAnswer(invocation -> {
            Thread.sleep(150);
            return List.of(webHit("https://www.amazon.com/dp/B000000001", "Two", "Now $8.00", 0.8));
        });

        // 6 requests x 2 sources on 4 threads: the last tasks start well after 400ms
        ExecutorService callers = Executors.newFixedThreadPool(6);
        try {
            List<Future<ConversationState>> runs = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                runs.add(callers.submit(() -> {
                    ConversationState state = hybridState("steel cleaner", null);
                    retriever.retrieve(state);
                    return state;
                }));
            }
            for (Future<ConversationState> run : runs) {
                ConversationState state = run.get(10, TimeUnit.SECONDS);
                assertThat(state.isRetrievalFailed()).isFalse();
                assertThat(state.getUnavailableSources()).isEmpty();
                assertThat(state.getReconciledResults()).hasSize(2);
            }
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void saturatedPoolTimesOutAfterQueueWait() throws Exception {
        config.setQueueTimeoutMs(100);
        ExecutorService single = Executors.newSingleThreadExecutor();
        CountDownLatch release = new CountDownLatch(1);
        single.submit(() -> {
            release.await();
            return null;
        });
        RetrieverService saturated = new RetrieverService(
            catalogAdapter,
            webAdapter,
            new WebResultNormalizer(new PriceDomainNormalizer(List.of("amazon.com"))),
            new PriceDomainNormalizer(List.of("amazon.com")),
            config,
            single,
            lookupExecutor);
        ConversationState state = hybridState("steel cleaner", null);
        state.setStrategy(SearchStrategy.CATALOG_ONLY);

        try {
            long start = System.nanoTime();
            saturated.retrieve(state);

            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(3_000);
            assertThat(state.isRetrievalFailed()).isTrue();
            assertThat(state.getUnavailableSources()).containsExactly("catalog");
            verifyNoInteractions(catalogAdapter);
        } finally {
            release.countDown();
            single.shutdownNow();
        }
    }

    @Test
    void allSourcesFailingLeavesEmptyResultsAndFlag() {
        when(catalogAdapter.query(anyString(), anyInt())).thenThrow(new SourceUnavailableException("catalog", "down"));
        when(webAdapter.query(anyString(), anyList(), anyInt())).thenThrow(new SourceUnavailableException("web", "down"));
        ConversationState state = hybridState("steel cleaner", null);

        retriever.retrieve(state);

        assertThat(state.getReconciledResults()).isEmpty();
        assertThat(state.isRetrievalFailed()).isTrue();
        assertThat(state.getUnavailableSources()).containsExactlyInAnyOrder("catalog", "web");
    }

    @Test
    void strategyDecidesWhichSourcesRun() {
        when(catalogAdapter.query(anyString(), anyInt())).thenReturn(List.of(catalogHit("p1", "One", 5.0, 0.9)));
        ConversationState state = hybridState("something under $10", 10.0);
        state.setStrategy(SearchStrategy.CATALOG_ONLY);

        retriever.retrieve(state);

        assertThat(state.getReconciledResults()).hasSize(1);
        verify(webAdapter, never()).query(anyString(), anyList(), anyInt());
    }

    @Test
    void looksUpPriceOnlyForPricelessItemsWithItemCode() {
        when(webAdapter.query(anyString(), anyList(), anyInt())).thenReturn(List.of(
            webHit("https://www.amazon.com/dp/B000000001", "Priceless", "Great cleaner", 0.9),
            webHit("https://www.amazon.com/dp/B000000002", "Has price", "Now $8.00", 0.8),
            webHit("https://www.walmart.com/ip/123", "Walmart priceless", "Great cleaner", 0.7)));
        when(webAdapter.isLookupAvailable()).thenReturn(true);
        when(webAdapter.lookupPrice("B000000001"))
            .thenReturn(Optional.of(PriceLookupResult.builder().title("Ignored title").price(11.49).build()));
        ConversationState state = hybridState("steel cleaner", null);
        state.setStrategy(SearchStrategy.WEB_ONLY);

        retriever.retrieve(state);

        assertThat(state.getReconciledResults()).extracting(ReconciledResult::getPrice)
            .containsExactly(11.49, 8.00, null);
        assertThat(state.getReconciledResults().get(0).getTitle()).isEqualTo("Priceless");
        verify(webAdapter).lookupPrice(eq("B000000001"));
        verify(webAdapter, never()).lookupPrice(eq("B000000002"));
        verifyNoInteractions(catalogAdapter);
    }

    @Test
    void slowLookupLeavesPriceAbsent() {
        config.setLookupTimeoutMs(100);
        when(webAdapter.query(anyString(), anyList(), anyInt())).thenReturn(List.of(
            webHit("https://www.amazon.com/dp/B000000001", "Priceless", "Great cleaner", 0.9)));
        when(webAdapter.isLookupAvailable()).thenReturn(true);
        when(webAdapter.lookupPrice(anyString())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return Optional.of(PriceLookupResult.builder().price(1.0).build());
        });
        ConversationState state = hybridState("steel cleaner", null);
        state.setStrategy(SearchStrategy.WEB_ONLY);

        long start = System.nanoTime();
        retriever.retrieve(state);

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(3_000);
        assertThat(state.getReconciledResults()).singleElement()
            .satisfies(r -> assertThat(r.getPrice()).isNull());
    }

    @Test
    void interruptCancelsInFlightSourceQueries() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean adapterInterrupted = new AtomicBoolean();
        when(catalogAdapter.query(anyString(), anyInt())).thenAnswer(invocation -> {
            started.countDown();
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException e) {
                adapterInterrupted.set(true);
                throw e;
            }
            return List.of();
        });
        ConversationState state = hybridState("steel cleaner", null);
        state.setStrategy(SearchStrategy.CATALOG_ONLY);

        AtomicBoolean interruptRestored = new AtomicBoolean();
        CountDownLatch finished = new CountDownLatch(1);
        Thread caller = new Thread(() -> {
            retriever.retrieve(state);
            interruptRestored.set(Thread.currentThread().isInterrupted());
            finished.countDown();
        });
        caller.start();
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

        caller.interrupt();

        assertThat(finished.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(interruptRestored).isTrue();
        assertThat(state.getReconciledResults()).isEmpty();
        long deadline = System.currentTimeMillis() + 2_000;
        while (!adapterInterrupted.get() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(adapterInterrupted).isTrue();
    }

    private static ConversationState hybridState(String query, Double maxPrice) {
        ConversationState state = new ConversationState(query);
        state.setConstraints(Constraints.builder().maxPrice(maxPrice).build());
        state.setStrategy(SearchStrategy.HYBRID);
        return state;
    }

    private static RawResult catalogHit(String id, String title, Double price, double score) {
        return RawResult.builder()
            .identityKey(id).title(title).price(price).score(score)
            .source(ResultSource.CATALOG)
            .build();
    }

    private static RawResult webHit(String url, String title, String snippet, double score) {
        return RawResult.builder()
            .identityKey(PriceDomainNormalizer.normalizeUrl(url).orElseThrow())
            .url(url).title(title).snippet(snippet).score(score)
            .source(ResultSource.WEB)
            .build();
    }
}
