package com.lennon.idcard.validate;

import com.lennon.idcard.model.Gender;
import com.lennon.idcard.model.ValidationError;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class TaiwanValidatorTests {

    private final TaiwanValidator tw = new TaiwanValidator();

    @Test
    public void test_validate() {
        assertTrue(tw.validate("A123456789").isValid());
        assertTrue(tw.validate("B142610160").isValid());
        assertTrue(tw.validate("Q155304682").isValid());
        assertTrue(tw.validate("q155304682").isValid());
        assertTrue(tw.validate("A22537662(4)").isValid());
        assertFalse(tw.validate("Q155304680").isValid());
    }

    @Test
    public void non_ascii_letters_are_not_folded() {
        // ı / ſ 在 Unicode 大写后会变成 I / S
        assertEquals(Optional.of(ValidationError.INVALID_PREFIX), tw.validate("\u0131123456781").error());
        assertEquals(Optional.of(ValidationError.INVALID_PREFIX), tw.validate("\u017f123456789").error());
        assertFalse(tw.region("\u0131123456781").isPresent());
        assertFalse(tw.gender("\u0131123456781").isPresent());
        assertTrue(tw.validate("I123456781").isValid());
        assertTrue(tw.validate("i123456781").isValid());
    }

    @Test
    public void rejection_reasons() {
        assertEquals(Optional.of(ValidationError.CHECKSUM_MISMATCH), tw.validate("Q155304680").error());
        assertEquals(Optional.of(ValidationError.INVALID_PREFIX), tw.validate("A323456789").error());
        assertEquals(Optional.of(ValidationError.INVALID_PREFIX), tw.validate("0142610160").error());
        assertEquals(Optional.of(ValidationError.NON_DIGIT_CHARACTER), tw.validate("A12345678B").error());
        assertEquals(Optional.of(ValidationError.TOO_SHORT), tw.validate("A12345678").error());
        assertEquals(Optional.of(ValidationError.TOO_LONG), tw.validate("A1234567890").error());
    }

    @Test
    public void test_get_region() {
        assertEquals(Optional.of("台中市"), tw.region("B142610160"));
        assertEquals(Optional.of("台北市"), tw.region("a123456789"));
        assertFalse(tw.region("0142610160").isPresent());
        assertFalse(tw.region("Q155304680").isPresent());
    }

    @Test
    public void test_get_gender() {
        assertEquals(Optional.of(Gender.MALE), tw.gender("Q155304682"));
        assertEquals(Optional.of(Gender.FEMALE), tw.gender("A225376624"));
        assertFalse(tw.gender("Q155304680").isPresent());
        assertFalse(tw.gender(null).isPresent());
    }
}
