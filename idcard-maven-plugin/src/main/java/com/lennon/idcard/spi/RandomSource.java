package com.lennon.idcard.spi;

public interface RandomSource {
    /** Uniform value in {@code [0, bound)}. */
    int nextInt(int bound);

    /** Uniform value in {@code [origin, boundInclusive]}. */
    default int nextIntClosed(int origin, int boundInclusive) {
        if (boundInclusive < origin) {
            throw new IllegalArgumentException("bound " + boundInclusive + " < origin " + origin);
        }
        return origin + nextInt(boundInclusive - origin + 1);
    }
}
