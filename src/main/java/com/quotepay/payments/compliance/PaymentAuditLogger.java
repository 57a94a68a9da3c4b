package com.quotepay.payments.compliance;

import com.quotepay.payments.domain.CallbackResult;
import com.quotepay.payments.domain.NormalizedPaymentRequest;
import com.quotepay.payments.domain.PaymentCreationOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Audit trail of payment attempts and gateway callbacks. Lines carry an
 * {@code [AUDIT]} prefix and never include unmasked contact data.
 */
@Slf4j
@Component
public class PaymentAuditLogger {

    public void logRequest(NormalizedPaymentRequest request) {
        log.info("[AUDIT] PAYMENT_REQUEST transactionId={} gateway={} quoteIds={} amount={} currency={} payer={} guest={}",
                request.getTransactionId(),
                request.getGatewayCode(),
                request.getQuoteIds(),
                request.getAmount(),
                request.getCurrency(),
                request.getCustomer() != null ? PiiMasker.maskEmail(request.getCustomer().getEmail()) : null,
                request.getGuestSessionToken() != null);
    }

    public void logOutcome(PaymentCreationOutcome outcome) {
        log.info("[AUDIT] PAYMENT_OUTCOME transactionId={} gateway={} success={} paymentState={}",
                outcome.getTransactionId(),
                outcome.getGatewayCode(),
                outcome.isSuccess(),
                outcome.getPaymentState());
    }

    public void logCallback(CallbackResult callback, boolean verified, String disposition) {
        log.info("[AUDIT] GATEWAY_CALLBACK gateway={} eventId={} outcome={} transactionId={} gatewayTxId={} verified={} disposition={}",
                callback.getGatewayCode(),
                callback.getEventId(),
                callback.getOutcome(),
                callback.getTransactionId(),
                callback.getGatewayTransactionId(),
                verified,
                disposition);
    }
}
