package com.lennon.idcard.validate;

import com.lennon.idcard.checksum.AsciiCase;
import com.lennon.idcard.checksum.ChecksumEngine;
import com.lennon.idcard.checksum.DigitArray;
import com.lennon.idcard.model.ValidationError;
import com.lennon.idcard.spi.IdValidator;


/**
 * Hong Kong: one or two letters, six digits, check symbol 0-9 or A, optionally in parentheses.
 *
 * <pre>
 *   two letters : L1*9 + L2*8 + d1*7 .. d6*2 + check
 *   one letter  : 522  + L1*8 + d1*7 .. d6*2 + check
 *   valid when sum % 11 == 0, letter A=10 .. Z=35, check A=10
 * </pre>
 * 522 and 36*9 (a blank first position) agree mod 11.
 */
public final class HongKongValidator implements IdValidator {

    private static final int[] DIGIT_WEIGHTS = {7, 6, 5, 4, 3, 2};
    private static final int SINGLE_LETTER_BASE = 522;

    @Override
    public Jurisdiction jurisdiction() { return Jurisdiction.HK; }

    @Override
    public ValidationResult validate(String number) {
        if (number == null) return ValidationResult.invalid(Jurisdiction.HK, ValidationError.TOO_SHORT);
        // 先校验原始大小写，再去括号
        if (!Jurisdiction.HK_SHAPE.matcher(number.trim()).matches()) {
            return ValidationResult.invalid(Jurisdiction.HK, ValidationError.UNRECOGNIZED_FORMAT);
        }
        String n = AsciiCase.toUpper(Jurisdiction.stripParentheses(number));

        int sum;
        String card;
        if (n.length() == 9) {
            sum = letterValue(n.charAt(0)) * 9 + letterValue(n.charAt(1)) * 8;
            card = n.substring(1);
        } else {
            sum = SINGLE_LETTER_BASE + letterValue(n.charAt(0)) * 8;
            card = n;
        }
        sum += ChecksumEngine.weightedSum(DigitArray.of(card.substring(1, 7)), DIGIT_WEIGHTS);

        char end = card.charAt(7);
        sum += end == 'A' ? 10 : end - '0';

        return sum % 11 == 0
                ? ValidationResult.valid(Jurisdiction.HK)
                : ValidationResult.invalid(Jurisdiction.HK, ValidationError.CHECKSUM_MISMATCH);
    }

    static int letterValue(char c) {
        return c - 'A' + 10;
    }
}
