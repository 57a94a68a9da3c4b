package com.quotepay.payments.domain;

import java.util.Locale;

/**
 * Last checkpoint a payment attempt reached, stored in the ledger metadata
 * so an operator can tell which recovery path applies.
 */
public enum CompensationStep {
    INITIAL_INSERT,
    EXTERNAL_CREATED,
    DB_RECORDED,
    ERROR_HANDLING,
    WEBHOOK_RECONCILED;

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }
}
