package com.lennon.idcard.fake;

import com.lennon.idcard.model.Gender;

import java.util.Optional;

/**
 * Constraints for {@link FakeGenerator}. Every field is optional and nothing is checked until
 * generation. Setters return a new instance.
 */
public final class FakeOptions {
    private static final FakeOptions NONE = new FakeOptions(null, null, null, null);

    private final String region;
    private final Integer minYear;
    private final Integer maxYear;
    private final Gender gender;

    private FakeOptions(String region, Integer minYear, Integer maxYear, Gender gender) {
        this.region = region;
        this.minYear = minYear;
        this.maxYear = maxYear;
        this.gender = gender;
    }

    public static FakeOptions none() {
        return NONE;
    }

    /** Region code or prefix, 2 to 6 digits. */
    public FakeOptions region(String code) {
        return new FakeOptions(code, minYear, maxYear, gender);
    }

    /** Earliest birth year, inclusive; {@code minYear <= maxYear <= current year}. */
    public FakeOptions minYear(int year) {
        return new FakeOptions(region, year, maxYear, gender);
    }

    /** Latest birth year, inclusive. */
    public FakeOptions maxYear(int year) {
        return new FakeOptions(region, minYear, year, gender);
    }

    public FakeOptions gender(Gender g) {
        return new FakeOptions(region, minYear, maxYear, g);
    }

    public Optional<String> region() { return Optional.ofNullable(region); }

    public Optional<Integer> minYear() { return Optional.ofNullable(minYear); }

    public Optional<Integer> maxYear() { return Optional.ofNullable(maxYear); }

    public Optional<Gender> gender() { return Optional.ofNullable(gender); }

    @Override
    public String toString() {
        return "FakeOptions{region=" + region + ", minYear=" + minYear
                + ", maxYear=" + maxYear + ", gender=" + gender + "}";
    }
}
