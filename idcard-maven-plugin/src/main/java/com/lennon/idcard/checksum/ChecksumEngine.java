package com.lennon.idcard.checksum;

/**
 * Weighted positional sum and the GB 11643 check symbol (Mainland China, 18 digits).
 *
 * <p>Hong Kong and Taiwan reuse {@link #weightedSum(int[], int[])} with their own weights and
 * letter tables; only the Mainland scheme maps the remainder through {@link CheckSymbolTable}.
 */
public final class ChecksumEngine {

    /** Weights for positions 0..16 of an 18-digit number. */
    private static final int[] CN17_WEIGHTS = {7, 9, 10, 5, 8, 4, 2, 1, 6, 3, 7, 9, 10, 5, 8, 4, 2};

    private static final CheckSymbolTable CN_SYMBOLS = CheckSymbolTable.of(CheckSymbolTable.Kind.GB11643);

    private ChecksumEngine() {}

    public static int[] cn17Weights() {
        return CN17_WEIGHTS.clone();
    }

    /**
     * @throws IllegalArgumentException when the two arrays differ in length
     */
    public static int weightedSum(int[] digits, int[] weights) {
        if (digits.length != weights.length) {
            throw new IllegalArgumentException("Length mismatch: " + digits.length
                    + " digits vs " + weights.length + " weights");
        }
        int sum = 0;
        for (int i = 0; i < digits.length; i++) {
            sum += digits[i] * weights[i];
        }
        return sum;
    }

    public static char checkSymbol(int sum) {
        return CN_SYMBOLS.symbolFor(sum % 11);
    }

    /**
     * Check symbol for the first 17 digits of a Mainland number.
     *
     * @throws IllegalArgumentException if {@code first17} is not 17 ASCII digits
     */
    public static char cnCheckSymbol(String first17) {
        return checkSymbol(weightedSum(DigitArray.of(first17), CN17_WEIGHTS));
    }

    /** Case-insensitive comparison of the trailing symbol of an 18-char number. */
    public static boolean matchesCnCheckSymbol(String first17, char actual) {
        return CN_SYMBOLS.contains(actual) && cnCheckSymbol(first17) == AsciiCase.toUpper(actual);
    }
}
