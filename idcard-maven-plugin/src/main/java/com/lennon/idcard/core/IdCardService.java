package com.lennon.idcard.core;

import com.lennon.idcard.cn.Identity;
import com.lennon.idcard.cn.UpgradeTransformer;
import com.lennon.idcard.fake.FakeGenerator;
import com.lennon.idcard.fake.FakeOptions;
import com.lennon.idcard.model.Gender;
import com.lennon.idcard.region.ProvinceTable;
import com.lennon.idcard.region.RegionRegistry;
import com.lennon.idcard.validate.IdNumberValidator;
import com.lennon.idcard.validate.ValidationResult;

import java.util.Objects;
import java.util.Optional;

/**
 * Business wrapper over the engine, wired with one set of read-only tables.
 *
 * API:
 *  - validate / check         : any jurisdiction, detected from the input
 *  - identity                 : Mainland decode (15-digit input comes back upgraded)
 *  - upgrade                  : 15 -> 18 digits
 *  - fake                     : synthetic Mainland numbers
 *  - taiwanGender / taiwanRegion
 */
public final class IdCardService {
    private final ProvinceTable provinces;
    private final RegionRegistry regions;
    private final IdNumberValidator validator;
    private final FakeGenerator generator;

    public IdCardService(ProvinceTable provinces, RegionRegistry regions, FakeGenerator generator) {
        this.provinces = Objects.requireNonNull(provinces, "provinces null");
        this.regions = Objects.requireNonNull(regions, "regions null");
        this.generator = Objects.requireNonNull(generator, "generator null");
        this.validator = new IdNumberValidator(provinces, regions);
    }

    public boolean validate(String number) {
        return validator.validate(number);
    }

    public ValidationResult check(String number) {
        return validator.check(number);
    }

    public Identity identity(String number) {
        return Identity.parse(number, provinces, regions);
    }

    /**
     * @throws com.lennon.idcard.cn.UpgradeException when the input is not a well-formed 15-digit number
     */
    public String upgrade(String number) {
        return UpgradeTransformer.upgrade(number);
    }

    public String fake() {
        return generator.generate();
    }

    /**
     * @throws com.lennon.idcard.fake.GenerationException when the options contradict each other
     */
    public String fake(FakeOptions options) {
        return generator.generate(options);
    }

    public String fake(String region, int year, int month, int day, Gender gender) {
        return generator.generate(region, year, month, day, gender);
    }

    public Optional<Gender> taiwanGender(String number) {
        return validator.taiwan().gender(number);
    }

    public Optional<String> taiwanRegion(String number) {
        return validator.taiwan().region(number);
    }

    public Optional<String> regionName(String code) {
        return regions.lookup(code);
    }
}
