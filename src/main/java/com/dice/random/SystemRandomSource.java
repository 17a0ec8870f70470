package com.dice.random;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Non-deterministic source backed by {@link ThreadLocalRandom}; safe to share between threads.
 */
public final class SystemRandomSource implements RandomSource {

    static final SystemRandomSource INSTANCE = new SystemRandomSource();

    private SystemRandomSource() {
    }

    @Override
    public double nextDouble() {
        return ThreadLocalRandom.current().nextDouble();
    }

    @Override
    public String toString() {
        return "SystemRandomSource";
    }
}
