package com.lennon.idcard.cn;

import com.lennon.idcard.model.Gender;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Fixed fields of an 18-digit Mainland number.
 */
public final class CnFields {
    private final String regionCode;
    private final LocalDate birthDate;
    private final String sequence;
    private final char checkSymbol;

    CnFields(String regionCode, LocalDate birthDate, String sequence, char checkSymbol) {
        this.regionCode = regionCode;
        this.birthDate = birthDate;
        this.sequence = sequence;
        this.checkSymbol = checkSymbol;
    }

    public String regionCode() { return regionCode; }

    public String provinceCode() { return regionCode.substring(0, 2); }

    public LocalDate birthDate() { return birthDate; }

    public String sequence() { return sequence; }

    public char checkSymbol() { return checkSymbol; }

    /** Parity of the last sequence digit. */
    public Gender gender() {
        return Gender.ofParityDigit(sequence.charAt(sequence.length() - 1) - '0');
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CnFields)) return false;
        CnFields that = (CnFields) o;
        return checkSymbol == that.checkSymbol
                && regionCode.equals(that.regionCode)
                && birthDate.equals(that.birthDate)
                && sequence.equals(that.sequence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(regionCode, birthDate, sequence, checkSymbol);
    }

    @Override
    public String toString() {
        return "CnFields{region=" + regionCode + ", birth=" + birthDate
                + ", seq=" + sequence + ", check=" + checkSymbol + "}";
    }
}
