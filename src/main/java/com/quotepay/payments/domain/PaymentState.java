package com.quotepay.payments.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Compensation lifecycle of a payment attempt. The row is written in
 * {@link #PENDING} before any external call; {@link #DB_RECORDED},
 * {@link #FAILED} and {@link #ORPHANED} are terminal.
 */
public enum PaymentState {

    INITIALIZED,
    PENDING,
    EXTERNAL_CREATED,
    DB_RECORDED,
    FAILED,
    ORPHANED;

    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == DB_RECORDED || this == FAILED || this == ORPHANED;
    }

    /**
     * Forward-only transitions. {@code PENDING -> DB_RECORDED} exists for
     * attempts without a gateway leg and for callbacks that overtake the
     * synchronous path; the ledger decides which callers may use it.
     */
    public boolean canTransitionTo(PaymentState next) {
        if (next == null) {
            return false;
        }
        switch (this) {
            case INITIALIZED:
                return next == PENDING;
            case PENDING:
                return next == EXTERNAL_CREATED || next == DB_RECORDED
                        || next == FAILED || next == ORPHANED;
            case EXTERNAL_CREATED:
                return next == DB_RECORDED || next == ORPHANED;
            default:
                return false;
        }
    }
}
