package com.lennon.idcard.model;

import java.util.Locale;

public enum Gender {
    MALE,
    FEMALE;

    /** Odd sequence digit is male, even is female. */
    public static Gender ofParityDigit(int digit) {
        return digit % 2 != 0 ? MALE : FEMALE;
    }

    public boolean matchesParity(int digit) {
        return ofParityDigit(digit) == this;
    }

    public static Gender parse(String s) {
        if (s == null) throw new IllegalArgumentException("gender null");
        switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "m":
            case "male":
            case "男":
                return MALE;
            case "f":
            case "female":
            case "女":
                return FEMALE;
            default:
                throw new IllegalArgumentException("Unknown gender: " + s);
        }
    }
}
