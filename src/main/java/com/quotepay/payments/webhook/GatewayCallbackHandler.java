package com.quotepay.payments.webhook;

import com.quotepay.payments.config.PaymentGatewayProperties.GatewaySettings;
import com.quotepay.payments.domain.CallbackResult;
import com.quotepay.payments.domain.GatewayCode;

import java.time.Instant;

/**
 * Gateway-specific half of callback handling. Parsing and verification are
 * separate so that an unverifiable callback can still be recorded.
 */
public interface GatewayCallbackHandler {

    GatewayCode getGatewayCode();

    /**
     * Pure parse of the payload; no verification, no I/O.
     *
     * @throws CallbackParseException if the payload cannot be read
     */
    CallbackResult parse(InboundCallback callback);

    /**
     * @throws com.quotepay.payments.api.SignatureVerificationException on a missing or wrong signature
     */
    void verify(InboundCallback callback, GatewaySettings settings, Instant now);
}
