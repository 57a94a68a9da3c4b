package com.quotepay.payments.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Checkout's request to pay for one or more quotes, together with the
 * caller credentials the orchestrator hands to the session validator.
 */
@Value
@Builder
public class PaymentCreationRequest {

    List<String> quoteIds;

    /** Raw gateway code as sent by the client; resolved by the orchestrator. */
    String gateway;

    String successUrl;
    String cancelUrl;

    /** Optional explicit amount; derived from the quotes when absent. */
    BigDecimal amount;

    /** Optional ISO 4217 code; derived from the quotes when absent. */
    String currency;

    CustomerInfo customerInfo;
    Map<String, String> metadata;

    String bearerToken;
    String guestSessionToken;
    String clientIp;
}
