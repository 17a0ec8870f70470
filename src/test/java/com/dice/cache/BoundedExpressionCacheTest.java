package com.dice.cache;

import com.dice.expression.DiceExpressionParser;
import com.dice.expression.ParsedExpression;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BoundedExpressionCache.
 */
class BoundedExpressionCacheTest {

    private DiceExpressionParser parser;
    private BoundedExpressionCache cache;

    @BeforeEach
    void setUp() {
        parser = new DiceExpressionParser();
        cache = new BoundedExpressionCache(2);
    }

    private void store(String expression) {
        cache.put(expression, parser.read(expression));
    }

    @Test
    @DisplayName("Should return stored expressions and count hits and misses")
    void shouldCountHitsAndMisses() {
        store("3d6");

        assertTrue(cache.get("3d6").isPresent());
        assertTrue(cache.get("1d20").isEmpty());

        CacheStats stats = cache.getStats();
        assertEquals(1, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(0.5, stats.hitRate());
    }

    @Test
    @DisplayName("Should evict the oldest entry when full")
    void shouldEvictOldest() {
        store("1d4");
        store("1d6");
        store("1d8");

        assertEquals(2, cache.size());
        assertTrue(cache.get("1d4").isEmpty());
        assertTrue(cache.get("1d6").isPresent());
        assertTrue(cache.get("1d8").isPresent());
        assertEquals(1, cache.getStats().evictions());
    }

    @Test
    @DisplayName("Should clear all entries")
    void shouldClear() {
        store("1d4");
        store("1d6");

        cache.clear();

        assertEquals(0, cache.size());
        assertTrue(cache.get("1d4").isEmpty());
    }

    @Test
    @DisplayName("Hit rate of an unused cache should be zero")
    void unusedCacheHitRate() {
        assertEquals(0.0, cache.getStats().hitRate());
        assertEquals(2, cache.getStats().capacity());
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void shouldRejectNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedExpressionCache(0));
    }

    @Test
    @DisplayName("Should stay within capacity under concurrent use")
    void shouldStayBoundedConcurrently() throws InterruptedException {
        BoundedExpressionCache shared = new BoundedExpressionCache(10);
        List<ParsedExpression> parsed = new ArrayList<>();
        for (int i = 1; i <= 50; i++) {
            parsed.add(parser.read("1d" + i));
        }

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);
        for (int t = 0; t < 4; t++) {
            pool.submit(() -> {
                for (ParsedExpression p : parsed) {
                    shared.put(p.source(), p);
                    shared.get(p.source());
                }
                done.countDown();
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdown();

        assertEquals(10, shared.size());
        CacheStats stats = shared.getStats();
        assertEquals(200, stats.hits() + stats.misses());
    }
}
