package com.lennon.idcard.cn;

import com.lennon.idcard.checksum.AsciiCase;
import com.lennon.idcard.checksum.ChecksumEngine;
import com.lennon.idcard.checksum.DigitArray;


/**
 * 15 位升级 18 位：区划码后插入世纪 "19"，再补校验码。
 * The province prefix is not checked; callers that need it validate first.
 */
public final class UpgradeTransformer {

    private UpgradeTransformer() {}

    public static String upgrade(String number) {
        if (number == null) throw new UpgradeException("Upgrade failed: number is null");
        String n = AsciiCase.toUpper(number.trim());
        if (n.length() != FieldDecomposer.CN15_LENGTH) {
            throw new UpgradeException("Upgrade failed: expected 15 digits, got " + n.length() + " chars");
        }
        if (!DigitArray.isNumeric(n)) {
            throw new UpgradeException("Upgrade failed: non-digit character in " + n);
        }
        if (!FieldDecomposer.parseLegacyDate(n).isPresent()) {
            throw new UpgradeException("Upgrade failed: invalid birth date 19" + n.substring(6, 12));
        }
        String first17 = n.substring(0, 6) + "19" + n.substring(6);
        return first17 + ChecksumEngine.cnCheckSymbol(first17);
    }
}
