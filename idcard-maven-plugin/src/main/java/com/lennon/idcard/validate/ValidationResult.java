package com.lennon.idcard.validate;

import com.lennon.idcard.cn.Identity;
import com.lennon.idcard.model.ValidationError;

import java.util.Optional;

/**
 * Verdict for one input. Mainland numbers carry the decoded {@link Identity} when valid;
 * other jurisdictions report the verdict only.
 */
public final class ValidationResult {
    private final Jurisdiction jurisdiction;
    private final ValidationError error;
    private final Identity identity;

    private ValidationResult(Jurisdiction jurisdiction, ValidationError error, Identity identity) {
        this.jurisdiction = jurisdiction;
        this.error = error;
        this.identity = identity;
    }

    public static ValidationResult valid(Jurisdiction jurisdiction) {
        return new ValidationResult(jurisdiction, null, null);
    }

    public static ValidationResult valid(Jurisdiction jurisdiction, Identity identity) {
        return new ValidationResult(jurisdiction, null, identity);
    }

    public static ValidationResult invalid(Jurisdiction jurisdiction, ValidationError error) {
        return new ValidationResult(jurisdiction, error, null);
    }

    /** No jurisdiction recognized the shape of the input. */
    public static ValidationResult unrecognized(ValidationError error) {
        return new ValidationResult(null, error, null);
    }

    public boolean isValid() { return error == null; }

    public Optional<Jurisdiction> jurisdiction() { return Optional.ofNullable(jurisdiction); }

    public Optional<ValidationError> error() { return Optional.ofNullable(error); }

    public Optional<Identity> identity() { return Optional.ofNullable(identity); }

    @Override
    public String toString() {
        return "ValidationResult{jurisdiction=" + jurisdiction
                + ", valid=" + isValid()
                + (error == null ? "" : ", error=" + error)
                + (identity == null ? "" : ", number=" + identity.number())
                + "}";
    }
}
