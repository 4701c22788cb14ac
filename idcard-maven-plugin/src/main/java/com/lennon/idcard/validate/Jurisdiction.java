package com.lennon.idcard.validate;

import com.lennon.idcard.checksum.AsciiCase;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Supported number formats, detected from the shape of the input.
 */
public enum Jurisdiction {
    CN15,
    CN18,
    HK,
    MO,
    TW;

    // 大小写敏感：括号内的小写 a 不算
    static final Pattern HK_SHAPE = Pattern.compile("^[A-Z]{1,2}[0-9]{6}\\(?[0-9A]\\)?$");

    private static final Pattern PARENTHESES = Pattern.compile("[()]");

    /**
     * Detection order: Hong Kong pattern on the trimmed text, then CN by length,
     * then Macau / Taiwan by the length and first character once parentheses are removed.
     */
    public static Optional<Jurisdiction> detect(String raw) {
        if (raw == null) return Optional.empty();
        String trimmed = raw.trim();
        if (HK_SHAPE.matcher(trimmed).matches()) return Optional.of(HK);

        String n = AsciiCase.toUpper(trimmed);
        if (n.length() == 15) return Optional.of(CN15);
        if (n.length() == 18) return Optional.of(CN18);

        String stripped = stripParentheses(n);
        if (stripped.isEmpty()) return Optional.empty();
        char first = stripped.charAt(0);
        if (stripped.length() == 8 && first >= '0' && first <= '9') return Optional.of(MO);
        if ((stripped.length() == 9 || stripped.length() == 10) && first >= 'A' && first <= 'Z') {
            return Optional.of(TW);
        }
        return Optional.empty();
    }

    static String stripParentheses(String s) {
        return PARENTHESES.matcher(s).replaceAll("").trim();
    }
}
