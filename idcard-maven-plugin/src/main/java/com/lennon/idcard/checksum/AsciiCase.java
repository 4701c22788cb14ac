package com.lennon.idcard.checksum;

/**
 * Case folding limited to a-z. {@link String#toUpperCase} would also map 'ı' to 'I' and 'ſ' to 'S',
 * letting non-ASCII input pass the letter checks.
 */
public final class AsciiCase {

    private AsciiCase() {}

    public static char toUpper(char c) {
        return c >= 'a' && c <= 'z' ? (char) (c - ('a' - 'A')) : c;
    }

    public static String toUpper(String s) {
        if (s == null) return null;
        char[] out = s.toCharArray();
        for (int i = 0; i < out.length; i++) {
            out[i] = toUpper(out[i]);
        }
        return new String(out);
    }
}
