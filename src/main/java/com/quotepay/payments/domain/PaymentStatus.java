package com.quotepay.payments.domain;

/**
 * Customer-facing business outcome of a payment attempt.
 */
public enum PaymentStatus {
    PENDING,
    COMPLETED,
    FAILED
}
