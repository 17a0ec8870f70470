package com.dice.cache;

import com.dice.expression.ParsedExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Expression cache with insertion-order eviction.
 * All access is synchronized on the backing map, so one instance may be shared between threads.
 */
public class BoundedExpressionCache implements ExpressionCache {

    private static final Logger log = LoggerFactory.getLogger(BoundedExpressionCache.class);

    private final int capacity;
    private final Map<String, ParsedExpression> entries;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public BoundedExpressionCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ParsedExpression> eldest) {
                boolean evict = size() > BoundedExpressionCache.this.capacity;
                if (evict) {
                    evictions.incrementAndGet();
                    log.debug("Evicting cached expression '{}'", eldest.getKey());
                }
                return evict;
            }
        };
    }

    @Override
    public Optional<ParsedExpression> get(String expression) {
        ParsedExpression parsed;
        synchronized (entries) {
            parsed = entries.get(expression);
        }
        if (parsed == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(parsed);
    }

    @Override
    public void put(String expression, ParsedExpression parsed) {
        synchronized (entries) {
            entries.put(expression, parsed);
        }
    }

    @Override
    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }

    @Override
    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    @Override
    public CacheStats getStats() {
        return new CacheStats(size(), capacity, hits.get(), misses.get(), evictions.get());
    }
}
