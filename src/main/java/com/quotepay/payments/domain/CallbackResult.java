package com.quotepay.payments.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Typed view of one gateway callback, produced by a pure parse of the
 * callback payload. Quote ids are empty when the reference field could not
 * be parsed; {@link #referenceError} then says why.
 */
@Value
@Builder
public class CallbackResult {

    GatewayCode gatewayCode;

    /** Dedup key together with the gateway code. */
    String eventId;

    String eventType;
    CallbackOutcome outcome;

    /** Our transaction id when the gateway echoes it back. */
    String transactionId;

    String gatewayTransactionId;

    List<String> quoteIds;
    String referenceError;

    String amount;
    String currency;

    /** Non-sensitive callback fields worth keeping on the ledger row. */
    Map<String, Object> details;

    public boolean hasQuoteReference() {
        return quoteIds != null && !quoteIds.isEmpty();
    }
}
