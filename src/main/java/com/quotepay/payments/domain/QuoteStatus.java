package com.quotepay.payments.domain;

/**
 * Quote lifecycle as seen by payments. Only {@link #acceptsPayment()}
 * statuses may start a payment or be moved to {@link #PAID}.
 */
public enum QuoteStatus {
    DRAFT,
    PENDING,
    SENT,
    APPROVED,
    PAID,
    EXPIRED,
    CANCELLED,
    REJECTED;

    public boolean acceptsPayment() {
        return this == PENDING || this == SENT || this == APPROVED;
    }
}
