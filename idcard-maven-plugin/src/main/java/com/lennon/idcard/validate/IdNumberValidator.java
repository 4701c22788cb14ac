package com.lennon.idcard.validate;

import com.lennon.idcard.checksum.AsciiCase;
import com.lennon.idcard.model.ValidationError;
import com.lennon.idcard.region.ProvinceTable;
import com.lennon.idcard.region.RegionRegistry;
import com.lennon.idcard.spi.IdValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Entry point for validation: detects the jurisdiction from the shape of the input and delegates.
 * Total over all strings; never throws for bad input.
 */
public final class IdNumberValidator {
    private static final Logger log = LoggerFactory.getLogger(IdNumberValidator.class);

    // 看起来像大陆号码（纯数字，可带末位 X）但长度不对
    private static final Pattern MAINLAND_LIKE = Pattern.compile("^[0-9]*X?$");

    private final Map<Jurisdiction, IdValidator> validators;
    private final TaiwanValidator taiwan;

    public IdNumberValidator(ProvinceTable provinces, RegionRegistry regions) {
        this.taiwan = new TaiwanValidator();
        Map<Jurisdiction, IdValidator> m = new EnumMap<>(Jurisdiction.class);
        register(m, MainlandValidator.legacy(provinces, regions));
        register(m, MainlandValidator.modern(provinces, regions));
        register(m, new HongKongValidator());
        register(m, new MacauValidator());
        register(m, taiwan);
        this.validators = Collections.unmodifiableMap(m);
    }

    private static void register(Map<Jurisdiction, IdValidator> m, IdValidator v) {
        if (m.put(v.jurisdiction(), v) != null) {
            throw new IllegalArgumentException("Duplicate validator for " + v.jurisdiction());
        }
    }

    public boolean validate(String number) {
        return check(number).isValid();
    }

    public ValidationResult check(String number) {
        Optional<Jurisdiction> detected = Jurisdiction.detect(number);
        ValidationResult result = detected.isPresent()
                ? validators.get(detected.get()).validate(number)
                : ValidationResult.unrecognized(classifyUnrecognized(number));
        if (!result.isValid() && log.isDebugEnabled()) {
            // 不记录号码本身
            log.debug("Rejected {} input of {} chars: {}",
                    result.jurisdiction().map(Enum::name).orElse("unrecognized"),
                    number == null ? 0 : number.length(),
                    result.error().orElse(null));
        }
        return result;
    }

    /** Validates against one jurisdiction's rules, skipping detection. */
    public ValidationResult check(Jurisdiction jurisdiction, String number) {
        return validators.get(jurisdiction).validate(number);
    }

    public TaiwanValidator taiwan() {
        return taiwan;
    }

    private static ValidationError classifyUnrecognized(String number) {
        String n = number == null ? "" : AsciiCase.toUpper(number.trim());
        if (n.isEmpty()) return ValidationError.TOO_SHORT;
        if (MAINLAND_LIKE.matcher(n).matches()) {
            return n.length() < 18 ? ValidationError.TOO_SHORT : ValidationError.TOO_LONG;
        }
        return ValidationError.UNRECOGNIZED_FORMAT;
    }
}
