package com.lennon.idcard.core;

import com.lennon.idcard.fake.FakeGenerator;
import com.lennon.idcard.region.ClasspathRegionRegistry;
import com.lennon.idcard.region.ProvinceTable;
import com.lennon.idcard.region.RegionRegistry;
import com.lennon.idcard.spi.RandomSource;
import com.lennon.idcard.spi.SeededRandomSource;
import com.lennon.idcard.spi.ThreadLocalRandomSource;

import java.time.Clock;

public final class IdCardServices {

    private IdCardServices() {}

    /** Bundled tables, per-thread randomness, system clock. */
    public static IdCardService build() {
        return build(ThreadLocalRandomSource.INSTANCE, Clock.systemDefaultZone());
    }

    /** Same seed, same fake numbers (for a fixed clock). */
    public static IdCardService seeded(byte[] seed) {
        return build(new SeededRandomSource(seed), Clock.systemDefaultZone());
    }

    public static IdCardService build(RandomSource random, Clock clock) {
        return build(ClasspathRegionRegistry.bundled(), random, clock);
    }

    /** Use a full region table in place of the bundled sample. */
    public static IdCardService build(RegionRegistry regions, RandomSource random, Clock clock) {
        return new IdCardService(ProvinceTable.DEFAULT, regions, new FakeGenerator(regions, random, clock));
    }
}
