package com.lennon.idcard.cn;

import com.lennon.idcard.checksum.AsciiCase;
import com.lennon.idcard.model.Gender;
import com.lennon.idcard.region.ClasspathRegionRegistry;
import com.lennon.idcard.region.ProvinceTable;
import com.lennon.idcard.region.RegionRegistry;

import java.time.LocalDate;
import java.time.Year;
import java.util.Objects;
import java.util.Optional;

/**
 * A Mainland China identity number, decoded.
 *
 * <p>The number is kept trimmed and uppercased. A valid 15-digit number is upgraded to its
 * 18-digit form on construction. Every derived field is read from a slice of the 18-digit number
 * on demand and is empty when the number is invalid.
 *
 * <p>Equality covers the canonical number and the validity flag only.
 */
public final class Identity {
    private final String number;
    private final boolean valid;
    private final ProvinceTable provinces;
    private final RegionRegistry regions;

    private Identity(String number, boolean valid, ProvinceTable provinces, RegionRegistry regions) {
        this.number = number;
        this.valid = valid;
        this.provinces = provinces;
        this.regions = regions;
    }

    /** Uses the built-in province table and the bundled region table. */
    public static Identity of(String raw) {
        return parse(raw, ProvinceTable.DEFAULT, ClasspathRegionRegistry.bundled());
    }

    public static Identity parse(String raw, ProvinceTable provinces, RegionRegistry regions) {
        Objects.requireNonNull(provinces, "provinces null");
        Objects.requireNonNull(regions, "regions null");
        String n = raw == null ? "" : AsciiCase.toUpper(raw.trim());
        if (n.length() == FieldDecomposer.CN15_LENGTH) {
            if (MainlandRules.check15(n, provinces).isPresent()) {
                return new Identity(n, false, provinces, regions);
            }
            return new Identity(UpgradeTransformer.upgrade(n), true, provinces, regions);
        }
        if (n.length() == FieldDecomposer.CN18_LENGTH) {
            return new Identity(n, !MainlandRules.check18(n).isPresent(), provinces, regions);
        }
        return new Identity(n, false, provinces, regions);
    }

    public String number() { return number; }

    public boolean isValid() { return valid; }

    public boolean isEmpty() { return number.isEmpty(); }

    public int length() { return number.length(); }

    public Optional<CnFields> fields() {
        if (!valid) return Optional.empty();
        return FieldDecomposer.decompose(number);
    }

    public Optional<LocalDate> birthDate() {
        return fields().map(CnFields::birthDate);
    }

    /** yyyy-MM-dd */
    public Optional<String> birthDateText() {
        if (!valid) return Optional.empty();
        return Optional.of(number.substring(6, 10) + "-" + number.substring(10, 12) + "-" + number.substring(12, 14));
    }

    public Optional<Integer> year() {
        return slice(6, 10);
    }

    public Optional<Integer> month() {
        return slice(10, 12);
    }

    public Optional<Integer> day() {
        return slice(12, 14);
    }

    public Optional<Integer> age() {
        return ageIn(Year.now().getValue());
    }

    /** Age reached in {@code year}; empty when born after it. */
    public Optional<Integer> ageIn(int year) {
        return year().flatMap(birthYear -> FieldDecomposer.ageIn(birthYear, year));
    }

    public Optional<Gender> gender() {
        return slice(16, 17).map(Gender::ofParityDigit);
    }

    public Optional<String> province() {
        if (!valid) return Optional.empty();
        return provinces.lookup(number.substring(0, 2));
    }

    public Optional<String> region() {
        if (!valid) return Optional.empty();
        return regions.lookup(number.substring(0, 6));
    }

    public Optional<String> constellation() {
        if (!valid) return Optional.empty();
        return month().flatMap(m -> day().map(d -> BirthAttributes.constellation(m, d)));
    }

    public Optional<String> chineseEra() {
        return year().map(BirthAttributes::chineseEra);
    }

    public Optional<String> chineseZodiac() {
        return year().map(BirthAttributes::chineseZodiac);
    }

    private Optional<Integer> slice(int from, int to) {
        if (!valid) return Optional.empty();
        return Optional.of(Integer.parseInt(number.substring(from, to)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Identity)) return false;
        Identity that = (Identity) o;
        return valid == that.valid && number.equals(that.number);
    }

    @Override
    public int hashCode() {
        return Objects.hash(number, valid);
    }

    @Override
    public String toString() {
        return "Identity{number=" + number + ", valid=" + valid + "}";
    }
}
