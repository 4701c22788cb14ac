package com.lennon.idcard.cn;

import com.lennon.idcard.checksum.AsciiCase;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Slices an 18-char Mainland number into its fields:
 * <pre>
 *   [0,6)   region code
 *   [6,14)  birth date, yyyyMMdd
 *   [14,17) sequence, last digit odd = male
 *   [17]    check symbol
 * </pre>
 * The check symbol is not verified here; see {@link com.lennon.idcard.checksum.ChecksumEngine}.
 */
public final class FieldDecomposer {

    public static final int CN15_LENGTH = 15;
    public static final int CN18_LENGTH = 18;

    private static final Pattern CN18 = Pattern.compile("^(\\d{6})(\\d{8})(\\d{3})([0-9Xx])$");

    // STRICT 拒绝 2月30日、非闰年的 2月29日
    private static final DateTimeFormatter BASIC_DATE =
            DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);

    private FieldDecomposer() {}

    public static Optional<CnFields> decompose(String number) {
        if (number == null) return Optional.empty();
        Matcher m = CN18.matcher(number);
        if (!m.matches()) return Optional.empty();
        return parseDate(m.group(2))
                .map(birth -> new CnFields(m.group(1), birth, m.group(3),
                        AsciiCase.toUpper(m.group(4).charAt(0))));
    }

    /** Parses {@code yyyyMMdd}; empty unless it names a real calendar day. */
    public static Optional<LocalDate> parseDate(String yyyymmdd) {
        if (yyyymmdd == null || yyyymmdd.length() != 8) return Optional.empty();
        try {
            return Optional.of(LocalDate.parse(yyyymmdd, BASIC_DATE));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /** Birth date of a 15-digit number, which always belongs to the 1900s. */
    public static Optional<LocalDate> parseLegacyDate(String number15) {
        if (number15 == null || number15.length() != CN15_LENGTH) return Optional.empty();
        return parseDate("19" + number15.substring(6, 12));
    }

    public static String format(LocalDate date) {
        return BASIC_DATE.format(date);
    }

    /** {@code currentYear - birthYear}, or empty when the birth year lies ahead. */
    public static Optional<Integer> ageIn(int birthYear, int year) {
        int age = year - birthYear;
        return age < 0 ? Optional.empty() : Optional.of(age);
    }
}
