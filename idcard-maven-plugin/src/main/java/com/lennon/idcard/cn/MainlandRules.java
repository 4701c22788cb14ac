package com.lennon.idcard.cn;

import com.lennon.idcard.checksum.AsciiCase;
import com.lennon.idcard.checksum.ChecksumEngine;
import com.lennon.idcard.checksum.DigitArray;
import com.lennon.idcard.model.ValidationError;
import com.lennon.idcard.region.ProvinceTable;

import java.util.Optional;

/**
 * Mainland checks shared by {@link Identity} and the validators. Input is expected trimmed and
 * uppercased; the result is the first failed check, or empty when the number is valid.
 */
public final class MainlandRules {

    private MainlandRules() {}

    public static Optional<ValidationError> check15(String n, ProvinceTable provinces) {
        if (n == null || n.length() != FieldDecomposer.CN15_LENGTH) return Optional.of(lengthError(n, FieldDecomposer.CN15_LENGTH));
        if (!DigitArray.isNumeric(n)) return Optional.of(ValidationError.NON_DIGIT_CHARACTER);
        if (!provinces.contains(n.substring(0, 2))) return Optional.of(ValidationError.UNKNOWN_REGION_CODE);
        if (!FieldDecomposer.parseLegacyDate(n).isPresent()) return Optional.of(ValidationError.INVALID_CALENDAR_DATE);
        return Optional.empty();
    }

    public static Optional<ValidationError> check18(String n) {
        if (n == null || n.length() != FieldDecomposer.CN18_LENGTH) return Optional.of(lengthError(n, FieldDecomposer.CN18_LENGTH));
        String first17 = n.substring(0, 17);
        char last = n.charAt(17);
        if (!DigitArray.isNumeric(first17)) return Optional.of(ValidationError.NON_DIGIT_CHARACTER);
        if (!FieldDecomposer.parseDate(n.substring(6, 14)).isPresent()) return Optional.of(ValidationError.INVALID_CALENDAR_DATE);
        if ((last < '0' || last > '9') && AsciiCase.toUpper(last) != 'X') {
            return Optional.of(ValidationError.NON_DIGIT_CHARACTER);
        }
        if (!ChecksumEngine.matchesCnCheckSymbol(first17, last)) return Optional.of(ValidationError.CHECKSUM_MISMATCH);
        return Optional.empty();
    }

    private static ValidationError lengthError(String n, int expected) {
        int len = n == null ? 0 : n.length();
        return len < expected ? ValidationError.TOO_SHORT : ValidationError.TOO_LONG;
    }
}
