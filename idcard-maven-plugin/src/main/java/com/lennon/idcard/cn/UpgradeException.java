package com.lennon.idcard.cn;

import com.lennon.idcard.core.IdCardException;

public class UpgradeException extends IdCardException {
    public UpgradeException(String message) {
        super(message);
    }
}
