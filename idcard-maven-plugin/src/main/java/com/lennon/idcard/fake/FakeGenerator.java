package com.lennon.idcard.fake;

import com.lennon.idcard.checksum.ChecksumEngine;
import com.lennon.idcard.cn.FieldDecomposer;
import com.lennon.idcard.model.Gender;
import com.lennon.idcard.region.RegionRegistry;
import com.lennon.idcard.spi.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Synthetic 18-digit Mainland numbers for tests and fixtures. Every number produced passes
 * validation; region, birth year range and gender follow the request exactly and only the
 * sequence digits are random.
 */
public final class FakeGenerator {
    private static final Logger log = LoggerFactory.getLogger(FakeGenerator.class);

    static final int DEFAULT_YEAR_SPAN = 100;
    private static final int SEQUENCE_BOUND = 999;

    private final RegionRegistry regions;
    private final RandomSource random;
    private final Clock clock;

    public FakeGenerator(RegionRegistry regions, RandomSource random, Clock clock) {
        this.regions = Objects.requireNonNull(regions, "regions null");
        this.random = Objects.requireNonNull(random, "random null");
        this.clock = Objects.requireNonNull(clock, "clock null");
    }

    public String generate() {
        return generate(FakeOptions.none());
    }

    public String generate(FakeOptions opts) {
        Objects.requireNonNull(opts, "options null");
        LocalDate today = LocalDate.now(clock);
        int currentYear = today.getYear();

        // 先校验约束，再采样
        int maxYear = opts.maxYear().orElse(currentYear);
        int minYear = opts.minYear().orElse(Math.min(currentYear - DEFAULT_YEAR_SPAN, maxYear));
        if (opts.maxYear().isPresent() && maxYear > currentYear) {
            throw reject(opts, "Max year must be less than or equal to " + currentYear);
        }
        if (opts.minYear().isPresent() && minYear > currentYear) {
            throw reject(opts, "Min year must be less than or equal to " + currentYear);
        }
        if (maxYear < minYear) {
            throw reject(opts, "Max year must be greater than or equal to min year");
        }
        if (minYear <= 0) {
            throw reject(opts, "Min year must be greater than 0");
        }
        String region = resolveRegion(opts);

        int minAge = Math.max(0, currentYear - maxYear);
        int maxAge = currentYear - minYear;
        int age = minAge == maxAge ? minAge : random.nextIntClosed(minAge, maxAge);
        int birthYear = currentYear - age;

        // 当年出生的不能晚于今天
        int lastDay = birthYear == currentYear ? today.getDayOfYear() : LocalDate.of(birthYear, 1, 1).lengthOfYear();
        LocalDate birth = LocalDate.ofYearDay(birthYear, random.nextIntClosed(1, lastDay));

        Gender gender = opts.gender().orElseGet(() -> random.nextInt(2) == 0 ? Gender.MALE : Gender.FEMALE);
        return assemble(region, birth, gender);
    }

    /**
     * Number for an exact birth date.
     *
     * @param region 6-digit region code; not required to be in the registry
     */
    public String generate(String region, int year, int month, int day, Gender gender) {
        if (region == null || !region.matches("\\d{6}")) {
            throw new GenerationException("The length of region code must be 6 digits");
        }
        Objects.requireNonNull(gender, "gender null");
        LocalDate birth;
        try {
            birth = LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            throw new GenerationException("Invalid date of birth: " + year + "-" + month + "-" + day);
        }
        if (year <= 0 || year > 9999) {
            throw new GenerationException("Invalid date of birth: year " + year);
        }
        return assemble(region, birth, gender);
    }

    private String resolveRegion(FakeOptions opts) {
        if (!opts.region().isPresent()) {
            return regions.randomCode(random);
        }
        String prefix = opts.region().get().trim();
        if (!prefix.matches("\\d{2,6}")) {
            throw reject(opts, "Invalid region code: must be 2 to 6 digits");
        }
        Optional<String> code = regions.randomCodeWithPrefix(prefix, random);
        if (!code.isPresent()) {
            throw reject(opts, "Invalid region code: no region starts with " + prefix);
        }
        return code.get();
    }

    private String assemble(String region, LocalDate birth, Gender gender) {
        int seq = random.nextInt(SEQUENCE_BOUND);
        if (!gender.matchesParity(seq % 10)) {
            seq += 1;
        }
        String first17 = region + FieldDecomposer.format(birth) + String.format(Locale.ROOT, "%03d", seq);
        return first17 + ChecksumEngine.cnCheckSymbol(first17);
    }

    private static GenerationException reject(FakeOptions opts, String message) {
        log.debug("Rejected {}: {}", opts, message);
        return new GenerationException(message);
    }
}
