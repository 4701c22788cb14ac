package com.lennon.idcard.validate;

import com.lennon.idcard.checksum.AsciiCase;
import com.lennon.idcard.model.ValidationError;
import com.lennon.idcard.spi.IdValidator;

import java.util.regex.Pattern;

/**
 * Macau: 1, 5 or 7, six digits, one trailing symbol. Shape only; the trailing symbol is not verified.
 */
public final class MacauValidator implements IdValidator {

    private static final Pattern SHAPE = Pattern.compile("^[157][0-9]{6}[0-9A-Z]$");
    private static final int LENGTH = 8;

    @Override
    public Jurisdiction jurisdiction() { return Jurisdiction.MO; }

    @Override
    public ValidationResult validate(String number) {
        if (number == null) return ValidationResult.invalid(Jurisdiction.MO, ValidationError.TOO_SHORT);
        String n = AsciiCase.toUpper(Jurisdiction.stripParentheses(number));
        if (n.length() < LENGTH) return ValidationResult.invalid(Jurisdiction.MO, ValidationError.TOO_SHORT);
        if (n.length() > LENGTH) return ValidationResult.invalid(Jurisdiction.MO, ValidationError.TOO_LONG);
        if (!SHAPE.matcher(n).matches()) return ValidationResult.invalid(Jurisdiction.MO, ValidationError.UNRECOGNIZED_FORMAT);
        return ValidationResult.valid(Jurisdiction.MO);
    }
}
