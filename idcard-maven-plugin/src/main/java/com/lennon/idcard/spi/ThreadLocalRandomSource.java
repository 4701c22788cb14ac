package com.lennon.idcard.spi;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Default source: one generator per thread, nothing shared between callers.
 */
public final class ThreadLocalRandomSource implements RandomSource {
    public static final ThreadLocalRandomSource INSTANCE = new ThreadLocalRandomSource();

    private ThreadLocalRandomSource() {}

    @Override
    public int nextInt(int bound) {
        return ThreadLocalRandom.current().nextInt(bound);
    }
}
