package com.dice.random;

/**
 * Source of uniform random values for dice rolls.
 * <p>
 * Implementations may hold state (a seeded generator, for replay). A stateful
 * instance is not safe for concurrent use; callers sharing one across threads
 * must serialize access.
 */
@FunctionalInterface
public interface RandomSource {

    /**
     * Next uniform value in {@code [0, 1)}.
     */
    double nextDouble();

    /**
     * Roll one die: {@code floor(nextDouble() * sides) + 1}, a value in {@code [1, sides]}.
     * Values outside {@code [0, 1)} are clamped to the nearest face.
     *
     * @param sides Faces on the die, positive
     */
    default int roll(int sides) {
        double face = Math.floor(nextDouble() * sides) + 1;
        // Negative values and NaN fail this test
        if (!(face >= 1)) {
            return 1;
        }
        return (int) Math.min(face, sides);
    }

    static RandomSource system() {
        return SystemRandomSource.INSTANCE;
    }

    static SeededRandomSource seeded(long seed) {
        return new SeededRandomSource(seed);
    }
}
