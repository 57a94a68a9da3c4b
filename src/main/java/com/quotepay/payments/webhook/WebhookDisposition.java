package com.quotepay.payments.webhook;

/**
 * What happened to one callback delivery.
 */
public enum WebhookDisposition {

    PROCESSED,

    /** Closed without full effect, e.g. unknown transaction or unparseable reference. */
    PROCESSED_WITH_ERROR,

    /** Event already processed or being processed by a concurrent delivery. */
    DUPLICATE,

    /** Recorded for audit; signature did not verify so nothing was applied. */
    UNVERIFIED,

    /** Informational event with no ledger effect. */
    IGNORED,

    /** Processing failed; the event stays open for the gateway's next delivery. */
    DEFERRED
}
