package com.quotepay.payments.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Validated, authorized and fully resolved payment request. Every adapter
 * receives this and maps it to its gateway's native request.
 */
@Value
@Builder
public class NormalizedPaymentRequest {

    String transactionId;
    GatewayCode gatewayCode;

    /** Ordered; the first id is the primary quote. */
    List<String> quoteIds;

    /** Amount in major units, in {@link #currency}. */
    BigDecimal amount;

    /** Upper-case ISO 4217 code. */
    String currency;

    long amountMinor;

    CustomerInfo customer;
    String description;
    String successUrl;
    String cancelUrl;

    String userId;
    String guestSessionToken;

    Map<String, String> metadata;

    public String getPrimaryQuoteId() {
        return quoteIds.get(0);
    }
}
