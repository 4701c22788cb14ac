package com.lennon.idcard.validate;

import com.lennon.idcard.checksum.AsciiCase;
import com.lennon.idcard.checksum.CheckSymbolTable;
import com.lennon.idcard.checksum.ChecksumEngine;
import com.lennon.idcard.checksum.DigitArray;
import com.lennon.idcard.model.Gender;
import com.lennon.idcard.model.ValidationError;
import com.lennon.idcard.spi.IdValidator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Taiwan: prefix letter, gender marker 1/2, seven digits, check digit.
 *
 * <p>The letter maps to a two-digit code (10..35) whose tens digit has weight 1 and units digit
 * weight 9; the next eight digits are weighted 8 down to 1. The check digit is
 * {@code (10 - sum % 10) % 10}.
 */
public final class TaiwanValidator implements IdValidator {

    private static final int LENGTH = 10;
    private static final int[] DIGIT_WEIGHTS = {8, 7, 6, 5, 4, 3, 2, 1};
    private static final CheckSymbolTable DECIMAL = CheckSymbolTable.of(CheckSymbolTable.Kind.DECIMAL);

    private static final Map<Character, Prefix> PREFIXES = prefixes();

    private static final class Prefix {
        final int code;
        final String name;

        Prefix(int code, String name) {
            this.code = code;
            this.name = name;
        }
    }

    @Override
    public Jurisdiction jurisdiction() { return Jurisdiction.TW; }

    @Override
    public ValidationResult validate(String number) {
        if (number == null) return ValidationResult.invalid(Jurisdiction.TW, ValidationError.TOO_SHORT);
        String n = AsciiCase.toUpper(Jurisdiction.stripParentheses(number));
        if (n.length() < LENGTH) return ValidationResult.invalid(Jurisdiction.TW, ValidationError.TOO_SHORT);
        if (n.length() > LENGTH) return ValidationResult.invalid(Jurisdiction.TW, ValidationError.TOO_LONG);

        Prefix prefix = PREFIXES.get(n.charAt(0));
        if (prefix == null) return ValidationResult.invalid(Jurisdiction.TW, ValidationError.INVALID_PREFIX);
        if (!DigitArray.isNumeric(n.substring(1))) {
            return ValidationResult.invalid(Jurisdiction.TW, ValidationError.NON_DIGIT_CHARACTER);
        }
        char sex = n.charAt(1);
        if (sex != '1' && sex != '2') return ValidationResult.invalid(Jurisdiction.TW, ValidationError.INVALID_PREFIX);

        int sum = prefix.code / 10 + (prefix.code % 10) * 9
                + ChecksumEngine.weightedSum(DigitArray.of(n.substring(1, 9)), DIGIT_WEIGHTS);
        char expected = DECIMAL.symbolFor(10 - sum % 10);
        return expected == n.charAt(9)
                ? ValidationResult.valid(Jurisdiction.TW)
                : ValidationResult.invalid(Jurisdiction.TW, ValidationError.CHECKSUM_MISMATCH);
    }

    /** 1 = male, 2 = female; empty unless the number is valid. */
    public Optional<Gender> gender(String number) {
        if (!validate(number).isValid()) return Optional.empty();
        char sex = Jurisdiction.stripParentheses(number).charAt(1);
        return Optional.of(sex == '1' ? Gender.MALE : Gender.FEMALE);
    }

    /** Issuing city or county named by the prefix letter; empty unless the number is valid. */
    public Optional<String> region(String number) {
        if (!validate(number).isValid()) return Optional.empty();
        char letter = AsciiCase.toUpper(Jurisdiction.stripParentheses(number).charAt(0));
        return Optional.of(PREFIXES.get(letter).name);
    }

    private static Map<Character, Prefix> prefixes() {
        Map<Character, Prefix> m = new LinkedHashMap<>();
        m.put('A', new Prefix(10, "台北市"));
        m.put('B', new Prefix(11, "台中市"));
        m.put('C', new Prefix(12, "基隆市"));
        m.put('D', new Prefix(13, "台南市"));
        m.put('E', new Prefix(14, "高雄市"));
        m.put('F', new Prefix(15, "新北市"));
        m.put('G', new Prefix(16, "宜兰县"));
        m.put('H', new Prefix(17, "桃园市"));
        m.put('J', new Prefix(18, "新竹县"));
        m.put('K', new Prefix(19, "苗栗县"));
        m.put('L', new Prefix(20, "台中县")); // 已废止
        m.put('M', new Prefix(21, "南投县"));
        m.put('N', new Prefix(22, "彰化县"));
        m.put('P', new Prefix(23, "云林县"));
        m.put('Q', new Prefix(24, "嘉义县"));
        m.put('R', new Prefix(25, "台南县")); // 已废止
        m.put('S', new Prefix(26, "高雄县")); // 已废止
        m.put('T', new Prefix(27, "屏东县"));
        m.put('U', new Prefix(28, "花莲县"));
        m.put('V', new Prefix(29, "台东县"));
        m.put('X', new Prefix(30, "澎湖县"));
        m.put('Y', new Prefix(31, "阳明山管理局")); // 已废止
        m.put('W', new Prefix(32, "金门县"));
        m.put('Z', new Prefix(33, "连江县"));
        m.put('I', new Prefix(34, "嘉义市"));
        m.put('O', new Prefix(35, "新竹市"));
        return Collections.unmodifiableMap(m);
    }
}
