package com.lennon.idcard.validate;

import com.lennon.idcard.checksum.AsciiCase;
import com.lennon.idcard.cn.Identity;
import com.lennon.idcard.cn.MainlandRules;
import com.lennon.idcard.model.ValidationError;
import com.lennon.idcard.region.ProvinceTable;
import com.lennon.idcard.region.RegionRegistry;
import com.lennon.idcard.spi.IdValidator;

import java.util.Objects;
import java.util.Optional;

/**
 * Mainland 15 and 18 digit numbers. A valid result carries the decoded identity,
 * upgraded to 18 digits for the 15-digit form.
 */
public final class MainlandValidator implements IdValidator {
    private final Jurisdiction jurisdiction;
    private final ProvinceTable provinces;
    private final RegionRegistry regions;

    private MainlandValidator(Jurisdiction jurisdiction, ProvinceTable provinces, RegionRegistry regions) {
        this.jurisdiction = jurisdiction;
        this.provinces = Objects.requireNonNull(provinces, "provinces null");
        this.regions = Objects.requireNonNull(regions, "regions null");
    }

    public static MainlandValidator legacy(ProvinceTable provinces, RegionRegistry regions) {
        return new MainlandValidator(Jurisdiction.CN15, provinces, regions);
    }

    public static MainlandValidator modern(ProvinceTable provinces, RegionRegistry regions) {
        return new MainlandValidator(Jurisdiction.CN18, provinces, regions);
    }

    @Override
    public Jurisdiction jurisdiction() { return jurisdiction; }

    @Override
    public ValidationResult validate(String number) {
        String n = number == null ? "" : AsciiCase.toUpper(number.trim());
        Optional<ValidationError> error = jurisdiction == Jurisdiction.CN15
                ? MainlandRules.check15(n, provinces)
                : MainlandRules.check18(n);
        if (error.isPresent()) {
            return ValidationResult.invalid(jurisdiction, error.get());
        }
        return ValidationResult.valid(jurisdiction, Identity.parse(n, provinces, regions));
    }
}
