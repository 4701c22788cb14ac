package com.lennon.idcard.model;

/**
 * Why a number was rejected. Only the first failing check is reported.
 */
public enum ValidationError {
    TOO_SHORT,
    TOO_LONG,
    NON_DIGIT_CHARACTER,
    INVALID_CALENDAR_DATE,
    /** 15-digit numbers only: the province prefix is not in the table. */
    UNKNOWN_REGION_CODE,
    CHECKSUM_MISMATCH,
    /** Taiwan: unknown prefix letter or gender marker other than 1/2. */
    INVALID_PREFIX,
    UNRECOGNIZED_FORMAT
}
