package com.dice.random;

/**
 * Deterministic source for reproducible rolls.
 * <p>
 * Linear congruential generator with the glibc parameters:
 * {@code state = (state * 1103515245 + 12345) mod 2^31}, yielding {@code state / 2^31}.
 * Two sources created with the same seed produce the same sequence.
 */
public final class SeededRandomSource implements RandomSource {

    private static final long MULTIPLIER = 1103515245L;
    private static final long INCREMENT = 12345L;
    private static final long MODULUS = 1L << 31;

    private final long seed;
    private long state;

    public SeededRandomSource(long seed) {
        this.seed = seed;
        this.state = Math.floorMod(seed, MODULUS);
    }

    @Override
    public synchronized double nextDouble() {
        state = Math.floorMod(state * MULTIPLIER + INCREMENT, MODULUS);
        return (double) state / MODULUS;
    }

    /**
     * Seed this source was created with, for recording and later replay.
     */
    public long getSeed() {
        return seed;
    }

    /**
     * Restart the sequence from the original seed.
     */
    public synchronized void reset() {
        this.state = Math.floorMod(seed, MODULUS);
    }

    @Override
    public String toString() {
        return "SeededRandomSource{seed=" + seed + "}";
    }
}
