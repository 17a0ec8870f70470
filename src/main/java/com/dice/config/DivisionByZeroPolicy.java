package com.dice.config;

/**
 * What integer division does when the divisor is zero.
 */
public enum DivisionByZeroPolicy {
    /**
     * Raise an evaluation error.
     */
    ERROR,
    /**
     * Return 0, matching legacy results.
     */
    ZERO
}
