package com.lennon.idcard.validate;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class JurisdictionTests {

    @Test
    public void detect_by_shape() {
        assertEquals(Optional.of(Jurisdiction.CN15), Jurisdiction.detect("632123820927051"));
        assertEquals(Optional.of(Jurisdiction.CN18), Jurisdiction.detect("21021119810503545x"));
        assertEquals(Optional.of(Jurisdiction.HK), Jurisdiction.detect("G123456(A)"));
        assertEquals(Optional.of(Jurisdiction.HK), Jurisdiction.detect("AB987654(3)"));
        assertEquals(Optional.of(Jurisdiction.HK), Jurisdiction.detect("G123456A"));
        assertEquals(Optional.of(Jurisdiction.MO), Jurisdiction.detect("1123456(A)"));
        assertEquals(Optional.of(Jurisdiction.MO), Jurisdiction.detect("5215299A"));
        assertEquals(Optional.of(Jurisdiction.TW), Jurisdiction.detect("A123456789"));
        assertEquals(Optional.of(Jurisdiction.TW), Jurisdiction.detect("a123456789"));
        assertEquals(Optional.of(Jurisdiction.TW), Jurisdiction.detect("A12345678"));
    }

    @Test
    public void detect_nothing() {
        assertFalse(Jurisdiction.detect(null).isPresent());
        assertFalse(Jurisdiction.detect("").isPresent());
        assertFalse(Jurisdiction.detect("()").isPresent());
        assertFalse(Jurisdiction.detect("G123456(a)").isPresent());
        assertFalse(Jurisdiction.detect("12345").isPresent());
    }
}
