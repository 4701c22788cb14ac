package com.lennon.idcard.core;

/**
 * Base of the failures the library reports by exception. Validation never throws;
 * it answers with a verdict instead.
 */
public class IdCardException extends RuntimeException {
    public IdCardException(String message) {
        super(message);
    }

    public IdCardException(String message, Throwable cause) {
        super(message, cause);
    }
}
