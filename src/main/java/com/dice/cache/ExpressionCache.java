package com.dice.cache;

import com.dice.expression.ParsedExpression;

import java.util.Optional;

/**
 * Bounded map from exact source text to its parsed form.
 */
public interface ExpressionCache {

    /**
     * Look up a previously parsed expression.
     *
     * @param expression Source text, compared exactly
     * @return Cached entry, empty on a miss
     */
    Optional<ParsedExpression> get(String expression);

    /**
     * Store a parsed expression, evicting the oldest entry when full.
     */
    void put(String expression, ParsedExpression parsed);

    void clear();

    int size();

    CacheStats getStats();
}
