package it.floro.analytics.cache;

import it.floro.analytics.config.AnalyticsProperties;
import it.floro.analytics.domain.AnalysisRequest;
import it.floro.analytics.domain.AnalysisResult;
import it.floro.analytics.domain.AnalysisType;
import it.floro.analytics.domain.Section;
import it.floro.analytics.exception.AnalyticsException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryAnalysisCacheTest {

    private final InMemoryAnalysisCache cache = new InMemoryAnalysisCache(new AnalyticsProperties());

    private static InMemoryAnalysisCache bounded(int maxEntries) {
        AnalyticsProperties properties = new AnalyticsProperties();
        properties.getCache().setMaxEntries(maxEntries);
        return new InMemoryAnalysisCache(properties);
    }

    private static AnalysisResult result(String id) {
        return new AnalysisResult(id, AnalysisType.TREND, "ds", "test", Instant.EPOCH, Map.of(), null,
                Section.notRequested(), Section.notRequested(), Section.notRequested(), List.of());
    }

    @Test
    void testKeyIgnoresParameterOrder() {
        AnalysisKey a = AnalysisKey.of("ds", new AnalysisRequest("Trend", Map.of("a", 1, "b", 2)));
        AnalysisKey b = AnalysisKey.of("ds", new AnalysisRequest("trend", Map.of("b", 2, "a", 1)));
        assertEquals(a, b);
        assertNotEquals(a, AnalysisKey.of("other", AnalysisRequest.of("trend")));
    }

    @Test
    void testSecondCallServedFromCache() {
        AnalysisKey key = AnalysisKey.of("ds", AnalysisRequest.of("trend"));
        AtomicInteger calls = new AtomicInteger();

        AnalysisResult first = cache.getOrCompute(key, () -> result("r" + calls.incrementAndGet()));
        AnalysisResult second = cache.getOrCompute(key, () -> result("r" + calls.incrementAndGet()));

        assertSame(first, second);
        assertEquals(1, calls.get());
        assertEquals(1, cache.size());
    }

    @Test
    void testConcurrentCallersShareOneComputation() throws Exception {
        AnalysisKey key = AnalysisKey.of("ds", AnalysisRequest.of("anomaly"));
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<AnalysisResult> a = pool.submit(() -> cache.getOrCompute(key, () -> {
                calls.incrementAndGet();
                started.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return result("shared");
            }));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            Future<AnalysisResult> b = pool.submit(() -> cache.getOrCompute(key, () -> {
                calls.incrementAndGet();
                return result("duplicate");
            }));
            release.countDown();

            assertSame(a.get(5, TimeUnit.SECONDS), b.get(5, TimeUnit.SECONDS));
            assertEquals(1, calls.get());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testFailureIsNotCached() {
        AnalysisKey key = AnalysisKey.of("ds", AnalysisRequest.of("model-eval"));
        assertThrows(AnalyticsException.class, () -> cache.getOrCompute(key, () -> {
            throw new AnalyticsException("boom");
        }));
        assertEquals(0, cache.size());

        AnalysisResult r = cache.getOrCompute(key, () -> result("retry"));
        assertEquals("retry", r.id());
    }

    @Test
    void testInvalidate() {
        AnalysisKey key = AnalysisKey.of("ds", AnalysisRequest.of("trend"));
        cache.getOrCompute(key, () -> result("one"));
        cache.invalidate(key);
        assertEquals("two", cache.getOrCompute(key, () -> result("two")).id());
    }

    // ========================================================================
    // LIMITE DI DIMENSIONE
    // ========================================================================

    @Test
    void testSizeBoundedByMaxEntries() {
        InMemoryAnalysisCache small = bounded(50);
        for (int i = 0; i < 2000; i++) {
            String id = "ds-" + i;
            small.getOrCompute(AnalysisKey.of(id, AnalysisRequest.of("trend")), () -> result(id));
        }
        assertEquals(50, small.size());
    }

    @Test
    void testOldestEntryEvictedFirst() {
        InMemoryAnalysisCache small = bounded(2);
        AnalysisKey a = AnalysisKey.of("a", AnalysisRequest.of("trend"));
        AnalysisKey b = AnalysisKey.of("b", AnalysisRequest.of("trend"));
        AnalysisKey c = AnalysisKey.of("c", AnalysisRequest.of("trend"));
        AnalysisResult ra = small.getOrCompute(a, () -> result("a1"));
        AnalysisResult rb = small.getOrCompute(b, () -> result("b1"));
        small.getOrCompute(c, () -> result("c1"));

        assertEquals(2, small.size());
        assertSame(rb, small.getOrCompute(b, () -> result("b2")));
        assertNotSame(ra, small.getOrCompute(a, () -> result("a2")));
    }

    @Test
    void testInFlightEntryNotEvicted() throws Exception {
        InMemoryAnalysisCache small = bounded(1);
        AnalysisKey slow = AnalysisKey.of("slow", AnalysisRequest.of("trend"));
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<AnalysisResult> first = pool.submit(() -> small.getOrCompute(slow, () -> {
                calls.incrementAndGet();
                started.countDown();
                await(release);
                return result("slow");
            }));
            assertTrue(started.await(5, TimeUnit.SECONDS));

            // Altre chiavi completate mentre "slow" è ancora in calcolo
            for (int i = 0; i < 5; i++) {
                String id = "k" + i;
                small.getOrCompute(AnalysisKey.of(id, AnalysisRequest.of("trend")), () -> result(id));
            }
            Future<AnalysisResult> second = pool.submit(() -> small.getOrCompute(slow, () -> {
                calls.incrementAndGet();
                return result("duplicate");
            }));
            release.countDown();

            assertSame(first.get(5, TimeUnit.SECONDS), second.get(5, TimeUnit.SECONDS));
            assertEquals(1, calls.get());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testInvalidMaxEntriesRejected() {
        assertThrows(IllegalArgumentException.class, () -> bounded(0));
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
