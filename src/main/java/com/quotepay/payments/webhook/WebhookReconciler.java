package com.quotepay.payments.webhook;

import com.quotepay.payments.domain.CallbackOutcome;
import com.quotepay.payments.domain.CallbackResult;
import com.quotepay.payments.domain.QuoteSnapshot;
import com.quotepay.payments.domain.QuoteStatus;
import com.quotepay.payments.integration.QuoteStore;
import com.quotepay.payments.ledger.CallbackApplication;
import com.quotepay.payments.ledger.TransactionLedger;
import com.quotepay.payments.persistence.entity.PaymentTransactionEntity;
import com.quotepay.payments.persistence.entity.WebhookEventEntity;
import com.quotepay.payments.persistence.repository.WebhookEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Applies a recorded, verified callback to the ledger and quotes. Runs in
 * one transaction with the inbox row locked, so the ledger update, the quote
 * transition and {@code processedAt} commit together or not at all.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookReconciler {

    static final String ERROR_TRANSACTION_NOT_FOUND = "transaction_not_found";
    static final String ERROR_OUTCOME_CONFLICT = "outcome_conflicts_with_ledger";
    static final String ERROR_REFERENCE_MISMATCH = "reference_mismatch";
    static final String ERROR_QUOTE_NOT_PAYABLE = "quote_not_payable";

    private final WebhookEventRepository eventRepository;
    private final TransactionLedger ledger;
    private final QuoteStore quoteStore;
    private final Clock clock;

    @Transactional
    public WebhookDisposition reconcile(Long eventRowId, CallbackResult callback) {
        WebhookEventEntity event = eventRepository.findForUpdate(eventRowId)
                .orElseThrow(() -> new IllegalStateException("Webhook event row missing: id=" + eventRowId));
        if (event.isProcessed()) {
            log.info("Webhook event already processed: gateway={}, eventId={}", event.getGatewayCode(), event.getEventId());
            return WebhookDisposition.DUPLICATE;
        }
        if (!event.isVerified()) {
            return WebhookDisposition.UNVERIFIED;
        }

        String error = null;
        switch (callback.getOutcome()) {
            case SUCCEEDED:
            case FAILED: {
                Optional<PaymentTransactionEntity> row = resolveRow(callback);
                if (row.isEmpty()) {
                    log.warn("Callback for unknown transaction: gateway={}, eventId={}, transactionId={}, gatewayTxId={}",
                            callback.getGatewayCode(), callback.getEventId(), callback.getTransactionId(),
                            callback.getGatewayTransactionId());
                    error = ERROR_TRANSACTION_NOT_FOUND;
                    break;
                }
                PaymentTransactionEntity transaction = row.get();
                event.setTransactionId(transaction.getTransactionId());
                error = callback.getOutcome() == CallbackOutcome.SUCCEEDED
                        ? applySuccess(transaction, callback, event.getEventId())
                        : applyFailure(transaction, callback, event.getEventId());
                break;
            }
            default:
                log.info("Callback without ledger effect: gateway={}, eventId={}, outcome={}",
                        callback.getGatewayCode(), callback.getEventId(), callback.getOutcome());
                event.setProcessedAt(clock.instant());
                eventRepository.save(event);
                return WebhookDisposition.IGNORED;
        }

        WebhookDisposition disposition = error == null ? WebhookDisposition.PROCESSED : WebhookDisposition.PROCESSED_WITH_ERROR;
        event.setProcessingError(error);
        event.setProcessedAt(clock.instant());
        eventRepository.save(event);
        return disposition;
    }

    /** @return processing error, or null */
    private String applySuccess(PaymentTransactionEntity transaction, CallbackResult callback, String eventId) {
        CallbackApplication application = ledger.completeFromCallback(
                transaction.getTransactionId(), callback.getGatewayTransactionId(), eventId);
        if (application == CallbackApplication.REJECTED) {
            return ERROR_OUTCOME_CONFLICT;
        }
        if (callback.getReferenceError() != null) {
            log.warn("Callback reference unreadable, quotes left unchanged: transactionId={}, eventId={}",
                    transaction.getTransactionId(), eventId);
            return callback.getReferenceError();
        }
        List<String> quoteIds = callback.hasQuoteReference() ? callback.getQuoteIds() : transaction.getQuoteIds();
        if (!transaction.getQuoteIds().containsAll(quoteIds)) {
            log.warn("Callback references quotes outside the transaction, quotes left unchanged: transactionId={}, "
                    + "referenced={}, recorded={}", transaction.getTransactionId(), quoteIds, transaction.getQuoteIds());
            return ERROR_REFERENCE_MISMATCH;
        }
        int transitioned = quoteStore.markPaid(quoteIds, transaction.getTransactionId(), transaction.getGatewayCode());
        if (transitioned < quoteIds.size()) {
            List<String> unpaid = unpaidQuotes(quoteIds);
            if (!unpaid.isEmpty()) {
                log.warn("Payment captured for quotes that could not be marked paid, manual review needed: "
                        + "transactionId={}, eventId={}, quoteIds={}", transaction.getTransactionId(), eventId, unpaid);
                return ERROR_QUOTE_NOT_PAYABLE;
            }
        }
        return null;
    }

    /** Quotes from {@code quoteIds} that are missing or not PAID after the update. */
    private List<String> unpaidQuotes(List<String> quoteIds) {
        Set<String> paid = quoteStore.findAll(quoteIds).stream()
                .filter(quote -> quote.getStatus() == QuoteStatus.PAID)
                .map(QuoteSnapshot::getId)
                .collect(Collectors.toSet());
        return quoteIds.stream().filter(id -> !paid.contains(id)).collect(Collectors.toList());
    }

    private String applyFailure(PaymentTransactionEntity transaction, CallbackResult callback, String eventId) {
        Object reason = callback.getDetails() == null ? null : callback.getDetails().get("failure_code");
        CallbackApplication application = ledger.failFromCallback(transaction.getTransactionId(), eventId,
                reason == null ? callback.getEventType() : reason.toString());
        return application == CallbackApplication.REJECTED ? ERROR_OUTCOME_CONFLICT : null;
    }

    private Optional<PaymentTransactionEntity> resolveRow(CallbackResult callback) {
        if (callback.getTransactionId() != null) {
            Optional<PaymentTransactionEntity> byId = ledger.find(callback.getTransactionId());
            if (byId.isPresent()) {
                if (byId.get().getGatewayCode() != callback.getGatewayCode()) {
                    log.warn("Callback gateway does not match transaction: transactionId={}, callbackGateway={}, "
                            + "recordedGateway={}", callback.getTransactionId(), callback.getGatewayCode(),
                            byId.get().getGatewayCode());
                    return Optional.empty();
                }
                return byId;
            }
        }
        if (callback.getGatewayTransactionId() != null) {
            return ledger.findByGatewayTransactionId(callback.getGatewayTransactionId())
                    .filter(t -> t.getGatewayCode() == callback.getGatewayCode());
        }
        return Optional.empty();
    }
}
