package com.lennon.idcard.region;

import com.lennon.idcard.spi.RandomSource;

import java.util.Optional;

/**
 * Read-only administrative division table: 6-digit code to full name.
 */
public interface RegionRegistry {
    Optional<String> lookup(String code);

    boolean contains(String code);

    String randomCode(RandomSource random);

    /** A random code starting with {@code prefix}, or empty if none does. */
    Optional<String> randomCodeWithPrefix(String prefix, RandomSource random);
}
