package com.quotepay.payments.domain;

import java.util.Locale;

/**
 * Classifies where a payment attempt broke. {@link #EXTERNAL_API_ERROR} and
 * {@link #CIRCUIT_OPEN} mean nothing was created at the gateway;
 * {@link #DATABASE_ERROR_AFTER_EXTERNAL_SUCCESS} means the gateway holds an
 * order we failed to book; {@link #EXTERNAL_CALL_INDETERMINATE} means we do
 * not know (timeout, I/O error, 5xx).
 */
public enum ErrorContext {
    EXTERNAL_API_ERROR,
    EXTERNAL_CALL_INDETERMINATE,
    CIRCUIT_OPEN,
    DATABASE_ERROR_AFTER_EXTERNAL_SUCCESS,
    UNKNOWN_ERROR;

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }
}
