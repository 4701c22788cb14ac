package com.lennon.idcard.validate;

import com.lennon.idcard.cn.Identity;
import com.lennon.idcard.model.ValidationError;
import com.lennon.idcard.region.ClasspathRegionRegistry;
import com.lennon.idcard.region.ProvinceTable;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class IdNumberValidatorTests {
    private static final Logger log = LoggerFactory.getLogger(IdNumberValidatorTests.class);

    static IdNumberValidator validator;

    @BeforeAll
    static void init() {
        validator = new IdNumberValidator(ProvinceTable.DEFAULT, ClasspathRegionRegistry.bundled());
    }

    @Test
    public void mainland_known_numbers() {
        assertTrue(validator.validate("511702800222130"));
        assertTrue(validator.validate("230127197908177456"));
        assertTrue(validator.validate("21021119810503545X"));
        assertTrue(validator.validate("21021119810503545x"));
        assertTrue(validator.validate("  330421197402080974\t"));
        assertFalse(validator.validate("230127197908177455"));
    }

    @Test
    public void non_ascii_letters_are_not_folded() {
        ValidationResult tw = validator.check("\u0131123456781");
        log.info("{}", tw);
        assertFalse(tw.isValid());
        assertEquals(Optional.of(ValidationError.UNRECOGNIZED_FORMAT), tw.error());
        assertFalse(validator.validate("1123456\u017f"));
        assertFalse(validator.validate("21021119810503545\u0131"));
        assertTrue(validator.validate("I123456781"));
        assertFalse(Jurisdiction.detect("\u0131123456781").isPresent());
    }

    @Test
    public void rejection_log_omits_the_number() {
        String number = "632123198209270519";
        PrintStream original = System.err;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setErr(new PrintStream(captured, true, StandardCharsets.UTF_8));
        try {
            validator.check(number);
        } finally {
            System.setErr(original);
        }
        String out = captured.toString(StandardCharsets.UTF_8);
        assertFalse(out.contains(number), out);
        assertFalse(out.contains("20927051"), out);
        if (LoggerFactory.getLogger(IdNumberValidator.class).isDebugEnabled()) {
            assertTrue(out.contains("CHECKSUM_MISMATCH"), out);
        }
    }

    @Test
    public void mainland_result_carries_identity() {
        ValidationResult legacy = validator.check("632123820927051");
        log.info("{}", legacy);
        assertTrue(legacy.isValid());
        assertEquals(Optional.of(Jurisdiction.CN15), legacy.jurisdiction());
        assertEquals("632123198209270518", legacy.identity().map(Identity::number).orElseThrow());

        ValidationResult modern = validator.check("230127197908177456");
        assertEquals(Optional.of(Jurisdiction.CN18), modern.jurisdiction());
        assertEquals("230127197908177456", modern.identity().orElseThrow().number());
    }

    @Test
    public void other_jurisdictions_carry_no_identity() {
        for (String n : new String[]{"G123456(A)", "1123456(A)", "A123456789"}) {
            ValidationResult r = validator.check(n);
            assertTrue(r.isValid(), n);
            assertFalse(r.identity().isPresent(), n);
        }
    }

    @Test
    public void error_taxonomy() {
        assertError(ValidationError.CHECKSUM_MISMATCH, "230127197908177455");
        assertError(ValidationError.INVALID_CALENDAR_DATE, "230127197902297456");
        assertError(ValidationError.NON_DIGIT_CHARACTER, "2301271979081774A6");
        assertError(ValidationError.NON_DIGIT_CHARACTER, "23012719790817745Y");
        assertError(ValidationError.UNKNOWN_REGION_CODE, "992123820927051");
        assertError(ValidationError.INVALID_CALENDAR_DATE, "632123821327051");
        assertError(ValidationError.NON_DIGIT_CHARACTER, "63212382092705X");
        assertError(ValidationError.TOO_SHORT, "");
        assertError(ValidationError.TOO_SHORT, "12345");
        assertError(ValidationError.TOO_SHORT, "2301271979081774");
        assertError(ValidationError.TOO_LONG, "2301271979081774561");
        assertError(ValidationError.UNRECOGNIZED_FORMAT, "hello, world");
        assertError(ValidationError.UNRECOGNIZED_FORMAT, "G123456(a)");
        assertError(ValidationError.CHECKSUM_MISMATCH, "Q155304680");
    }

    @Test
    public void validation_is_total() {
        assertFalse(validator.validate(null));
        assertFalse(validator.check(null).jurisdiction().isPresent());
        for (String n : new String[]{"(", ")(", "()()()()", "X", "\u0000", "中华人民共和国居民身份证号码是十八位"}) {
            assertFalse(validator.validate(n), n);
        }
    }

    @Test
    public void explicit_jurisdiction_skips_detection() {
        assertTrue(validator.check(Jurisdiction.TW, "A123456789").isValid());
        assertFalse(validator.check(Jurisdiction.HK, "A123456789").isValid());
        assertEquals(Optional.of(ValidationError.TOO_SHORT),
                validator.check(Jurisdiction.CN18, "632123820927051").error());
    }

    /**
     * 18 位纯数字串：当且仅当日期合法且校验码一致时通过。
     */
    @Test
    public void mainland18_accepts_iff_date_and_checksum_hold() {
        Random rnd = new Random(20240615L);
        int[] w = {7, 9, 10, 5, 8, 4, 2, 1, 6, 3, 7, 9, 10, 5, 8, 4, 2};
        String symbols = "10X98765432";
        DateTimeFormatter strict = DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);
        int accepted = 0;
        for (int i = 0; i < 5000; i++) {
            StringBuilder sb = new StringBuilder();
            for (int k = 0; k < 6; k++) sb.append(rnd.nextInt(10));
            sb.append(1900 + rnd.nextInt(130));
            sb.append(String.format(Locale.ROOT, "%02d", rnd.nextInt(14)));
            sb.append(String.format(Locale.ROOT, "%02d", rnd.nextInt(33)));
            for (int k = 0; k < 3; k++) sb.append(rnd.nextInt(10));
            int sum = 0;
            for (int k = 0; k < 17; k++) sum += (sb.charAt(k) - '0') * w[k];
            char expected = symbols.charAt(sum % 11);
            // 一半概率放正确校验码
            char last = rnd.nextBoolean() ? expected : "0123456789Xx".charAt(rnd.nextInt(12));
            sb.append(last);
            String n = sb.toString();

            boolean dateOk;
            try {
                LocalDate.parse(n.substring(6, 14), strict);
                dateOk = true;
            } catch (DateTimeParseException e) {
                dateOk = false;
            }
            boolean want = dateOk && Character.toUpperCase(last) == expected;
            assertEquals(want, validator.validate(n), n);
            if (want) accepted++;
        }
        log.info("accepted {} of 5000 random candidates", accepted);
        assertTrue(accepted > 0);
    }

    private static void assertError(ValidationError expected, String number) {
        ValidationResult r = validator.check(number);
        assertFalse(r.isValid(), number);
        assertEquals(Optional.of(expected), r.error(), number);
    }
}
