package com.quotepay.payments.integration;

import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.domain.QuoteSnapshot;

import java.util.List;

/**
 * Quote persistence as payments sees it: read amount, currency and
 * ownership; write payment fields on confirmed outcomes only.
 */
public interface QuoteStore {

    /** Quotes found among {@code quoteIds}, in request order; missing ids are skipped. */
    List<QuoteSnapshot> findAll(List<String> quoteIds);

    /**
     * Moves payable quotes to paid. Quotes already paid are left alone, so
     * repeating the call has no further effect.
     *
     * @return number of quotes transitioned by this call
     */
    int markPaid(List<String> quoteIds, String transactionId, GatewayCode gatewayCode);
}
