package com.quotepay.payments.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Normalized result of an adapter's submit step.
 */
@Value
@Builder
public class PaymentCreationResult {

    boolean success;

    /** Where the browser goes (redirect) or posts {@link #formData} to. */
    String redirectUrl;

    /** Form fields for gateways that expect a browser-side POST. */
    Map<String, String> formData;

    /** Secret for client-side confirmation (intent-based gateways). */
    String clientSecret;

    /** External reference; null for manual methods. */
    String gatewayTransactionId;

    /** Gateway response kept for audit; never contains client secrets. */
    Map<String, Object> gatewayResponse;

    String error;
}
