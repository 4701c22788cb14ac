package com.lennon.idcard.spi;

import com.lennon.idcard.validate.Jurisdiction;
import com.lennon.idcard.validate.ValidationResult;

/**
 * One jurisdiction's rules. Implementations are stateless and accept any string, null included.
 */
public interface IdValidator {
    Jurisdiction jurisdiction();

    ValidationResult validate(String number);
}
