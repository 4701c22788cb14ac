package com.lennon.idcard.checksum;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps a checksum remainder to the symbol printed at the end of a number.
 */
public final class CheckSymbolTable {
    public enum Kind { GB11643, DECIMAL }

    private final char[] symbols;
    private final Map<Character, Integer> index;

    private CheckSymbolTable(char[] symbols) {
        this.symbols = symbols;
        this.index = new HashMap<>(symbols.length * 2);
        for (int i = 0; i < symbols.length; i++) {
            if (index.put(symbols[i], i) != null) {
                throw new IllegalArgumentException("Duplicate symbol in table: " + symbols[i]);
            }
        }
    }

    public static CheckSymbolTable of(Kind kind) {
        switch (kind) {
            case GB11643:
                // 余数 0..10 -> 校验码
                return new CheckSymbolTable("10X98765432".toCharArray());
            case DECIMAL:
                return new CheckSymbolTable("0123456789".toCharArray());
            default:
                throw new IllegalArgumentException("Unknown kind: " + kind);
        }
    }

    public int modulus() { return symbols.length; }

    public boolean contains(char c) { return index.containsKey(AsciiCase.toUpper(c)); }

    public char symbolFor(int sum) {
        return symbols[Math.floorMod(sum, symbols.length)];
    }
}
