package com.dice.evaluation;

/**
 * Inclusive bounds of the values an expression can produce.
 *
 * @param min Smallest possible value
 * @param max Largest possible value
 */
public record Range(long min, long max) {

    public Range {
        if (min > max) {
            throw new IllegalArgumentException("Range min " + min + " exceeds max " + max);
        }
    }

    public static Range of(long value) {
        return new Range(value, value);
    }

    public double average() {
        return (min + (double) max) / 2;
    }

    public boolean contains(long value) {
        return value >= min && value <= max;
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
