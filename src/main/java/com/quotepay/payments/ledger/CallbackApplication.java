package com.quotepay.payments.ledger;

/**
 * Result of applying a verified callback to a ledger row.
 */
public enum CallbackApplication {

    /** The row changed. */
    APPLIED,

    /** The row already reflected this outcome; nothing changed. */
    ALREADY_APPLIED,

    /** The outcome contradicts the row (e.g. success for a failed attempt); left for manual review. */
    REJECTED
}
