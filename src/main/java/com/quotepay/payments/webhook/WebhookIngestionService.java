package com.quotepay.payments.webhook;

import com.quotepay.payments.api.ErrorKind;
import com.quotepay.payments.api.PaymentValidationException;
import com.quotepay.payments.api.SignatureVerificationException;
import com.quotepay.payments.compliance.PaymentAuditLogger;
import com.quotepay.payments.config.PaymentGatewayProperties.GatewaySettings;
import com.quotepay.payments.core.crypto.KeyedHash;
import com.quotepay.payments.domain.CallbackResult;
import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.integration.GatewayConfigurationStore;
import com.quotepay.payments.persistence.service.WebhookEventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Receives gateway callbacks: parse, verify, record in the inbox, then
 * reconcile. Every parseable callback is recorded before anything else,
 * including ones whose signature does not verify; those are kept for audit
 * and never change ledger or quote state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookIngestionService {

    static final String ERROR_NOT_CONFIGURED = "gateway_not_configured";

    private final List<GatewayCallbackHandler> handlers;
    private final GatewayConfigurationStore configurationStore;
    private final WebhookEventStore eventStore;
    private final WebhookReconciler reconciler;
    private final PaymentAuditLogger auditLogger;
    private final Clock clock;

    private Map<GatewayCode, GatewayCallbackHandler> handlerByCode;

    @jakarta.annotation.PostConstruct
    void init() {
        handlerByCode = new EnumMap<>(GatewayCode.class);
        handlers.forEach(h -> handlerByCode.putIfAbsent(h.getGatewayCode(), h));
        log.info("Registered callback handlers: {}", handlerByCode.keySet());
    }

    public WebhookReceipt receive(GatewayCode gatewayCode, InboundCallback callback) {
        GatewayCallbackHandler handler = handlerByCode.get(gatewayCode);
        if (handler == null) {
            throw new PaymentValidationException(ErrorKind.UNSUPPORTED_GATEWAY,
                    "Gateway does not send callbacks: " + gatewayCode.getCode());
        }
        String rawBody = callback.getRawBody() == null ? "" : callback.getRawBody();
        String payloadHash = KeyedHash.sha256Hex(rawBody);

        CallbackResult result;
        try {
            result = handler.parse(callback);
        } catch (CallbackParseException e) {
            log.warn("Unparseable callback recorded: gateway={}, payloadHash={}, error={}",
                    gatewayCode.getCode(), payloadHash, e.getMessage());
            eventStore.registerUnparseable(gatewayCode, payloadHash, rawBody, e.getMessage());
            return WebhookReceipt.builder()
                    .gatewayCode(gatewayCode)
                    .disposition(WebhookDisposition.PROCESSED_WITH_ERROR)
                    .build();
        }

        boolean verified;
        String verificationError = null;
        Optional<GatewaySettings> settings = configurationStore.findSettings(gatewayCode);
        if (settings.isEmpty()) {
            verified = false;
            verificationError = ERROR_NOT_CONFIGURED;
        } else {
            try {
                handler.verify(callback, settings.get(), clock.instant());
                verified = true;
            } catch (SignatureVerificationException e) {
                verified = false;
                verificationError = e.getMessage();
                log.warn("Callback signature not verified, recording without effect: gateway={}, eventId={}, reason={}",
                        gatewayCode.getCode(), result.getEventId(), e.getMessage());
            }
        }

        WebhookEventStore.Registration registration =
                eventStore.register(result, payloadHash, rawBody, verified, verificationError);
        WebhookDisposition disposition;
        if (registration.isDuplicate()) {
            disposition = WebhookDisposition.DUPLICATE;
        } else if (!verified) {
            disposition = WebhookDisposition.UNVERIFIED;
        } else {
            try {
                disposition = reconciler.reconcile(registration.getEventRowId(), result);
            } catch (RuntimeException e) {
                log.error("Callback processing failed, left open for redelivery: gateway={}, eventId={}",
                        gatewayCode.getCode(), result.getEventId(), e);
                eventStore.recordProcessingFailure(registration.getEventRowId(), e.getMessage());
                disposition = WebhookDisposition.DEFERRED;
            }
        }
        auditLogger.logCallback(result, verified, disposition.name());

        return WebhookReceipt.builder()
                .gatewayCode(gatewayCode)
                .eventId(result.getEventId())
                .transactionId(result.getTransactionId())
                .outcome(result.getOutcome())
                .verified(verified)
                .disposition(disposition)
                .build();
    }
}
