package com.quotepay.payments.messaging;

import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.domain.PaymentState;
import com.quotepay.payments.domain.PaymentStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Emitted on every ledger transition of a payment attempt. Carries no
 * customer contact data.
 */
@Value
@Builder
@Jacksonized
public class PaymentLifecycleEvent {

    String eventId;
    /** PAYMENT_PENDING, PAYMENT_EXTERNAL_CREATED, PAYMENT_RECORDED, PAYMENT_FAILED, PAYMENT_ORPHANED, PAYMENT_COMPLETED */
    String eventType;
    String transactionId;
    GatewayCode gatewayCode;
    List<String> quoteIds;
    PaymentStatus status;
    PaymentState paymentState;
    String gatewayTransactionId;
    String compensationStep;
    String errorContext;
    BigDecimal amount;
    String currency;
    Instant timestamp;
}
