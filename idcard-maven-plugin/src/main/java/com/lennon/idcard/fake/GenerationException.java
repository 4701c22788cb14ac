package com.lennon.idcard.fake;

import com.lennon.idcard.core.IdCardException;

/**
 * The requested constraints cannot be satisfied: year ordering, years out of range, unknown region.
 */
public class GenerationException extends IdCardException {
    public GenerationException(String message) {
        super(message);
    }
}
