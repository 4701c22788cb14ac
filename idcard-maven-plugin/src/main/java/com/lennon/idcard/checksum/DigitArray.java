package com.lennon.idcard.checksum;

/**
 * Numeric string to digit values. The trailing 'X' check symbol is never passed in here.
 */
public final class DigitArray {

    private DigitArray() {}

    public static int[] of(String s) {
        if (s == null) throw new IllegalArgumentException("digits null");
        int[] out = new int[s.length()];
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                throw new IllegalArgumentException("Not a digit at " + i + ": '" + c + "'");
            }
            out[i] = c - '0';
        }
        return out;
    }

    /** ASCII digits only; empty is not numeric. */
    public static boolean isNumeric(CharSequence s) {
        if (s == null || s.length() == 0) return false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return true;
    }
}
