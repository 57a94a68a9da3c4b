package com.quotepay.payments.ledger;

import com.quotepay.payments.api.ErrorKind;
import com.quotepay.payments.api.LedgerPersistenceException;
import com.quotepay.payments.api.PaymentException;
import com.quotepay.payments.domain.CompensationStep;
import com.quotepay.payments.domain.CustomerInfo;
import com.quotepay.payments.domain.ErrorContext;
import com.quotepay.payments.domain.NormalizedPaymentRequest;
import com.quotepay.payments.domain.PaymentState;
import com.quotepay.payments.domain.PaymentStatus;
import com.quotepay.payments.domain.gateway.GatewayRequest;
import com.quotepay.payments.messaging.PaymentLifecycleEventProducer;
import com.quotepay.payments.persistence.entity.PaymentTransactionEntity;
import com.quotepay.payments.persistence.repository.PaymentTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Write-ahead ledger of payment attempts and the compensation state machine
 * over them. Every method runs in its own transaction, so a step that
 * completed is durable even if the next one fails.
 * <p>
 * {@code gatewayTransactionId} is written together with the move to
 * {@link PaymentState#EXTERNAL_CREATED} and kept through
 * {@link PaymentState#ORPHANED}. States only move forward.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionLedger {

    public static final String EVENT_PENDING = "PAYMENT_PENDING";
    public static final String EVENT_EXTERNAL_CREATED = "PAYMENT_EXTERNAL_CREATED";
    public static final String EVENT_RECORDED = "PAYMENT_RECORDED";
    public static final String EVENT_FAILED = "PAYMENT_FAILED";
    public static final String EVENT_ORPHANED = "PAYMENT_ORPHANED";
    public static final String EVENT_COMPLETED = "PAYMENT_COMPLETED";
    public static final String EVENT_CALLBACK_FAILED = "PAYMENT_CALLBACK_FAILED";

    static final String META_WEBHOOK_EVENT_ID = "webhook_event_id";
    static final String META_COMPLETED_AT = "completed_at";
    static final String META_FAILED_AT = "failed_at";
    static final String META_QUOTE_AMOUNT = "quote_amount";
    static final String META_QUOTE_CURRENCY = "quote_currency";
    private static final int MAX_ERROR_MESSAGE = 500;

    private final PaymentTransactionRepository repository;
    private final PaymentLifecycleEventProducer eventProducer;
    private final Clock clock;

    /**
     * Inserts the row in {@link PaymentState#PENDING} before any external call.
     */
    @Transactional
    public PaymentTransactionEntity open(NormalizedPaymentRequest request, GatewayRequest gatewayRequest) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(PaymentTransactionEntity.META_COMPENSATION_STEP, CompensationStep.INITIAL_INSERT.getCode());
        metadata.put(PaymentTransactionEntity.META_LAST_COMPLETED_STEP, CompensationStep.INITIAL_INSERT.getCode());
        if (request.getGuestSessionToken() != null) {
            metadata.put(PaymentTransactionEntity.META_GUEST_SESSION_TOKEN, request.getGuestSessionToken());
        }
        if (request.getCustomer() != null) {
            metadata.put(PaymentTransactionEntity.META_CUSTOMER, customerMap(request.getCustomer()));
        }
        if (request.getSuccessUrl() != null) {
            metadata.put(PaymentTransactionEntity.META_SUCCESS_URL, request.getSuccessUrl());
        }
        if (request.getCancelUrl() != null) {
            metadata.put(PaymentTransactionEntity.META_CANCEL_URL, request.getCancelUrl());
        }
        metadata.put(META_QUOTE_AMOUNT, request.getAmount().toPlainString());
        metadata.put(META_QUOTE_CURRENCY, request.getCurrency());
        if (request.getMetadata() != null) {
            request.getMetadata().forEach(metadata::putIfAbsent);
        }
        metadata.putAll(gatewayRequest.getAuditDetails());

        PaymentTransactionEntity entity = PaymentTransactionEntity.builder()
                .transactionId(request.getTransactionId())
                .gatewayCode(request.getGatewayCode())
                .quoteIds(new ArrayList<>(request.getQuoteIds()))
                .userId(request.getUserId())
                .amountMinor(gatewayRequest.getChargedAmountMinor())
                .amountMajor(gatewayRequest.getChargedAmount())
                .currency(gatewayRequest.getChargedCurrency())
                .status(PaymentStatus.PENDING)
                .paymentState(PaymentState.PENDING)
                .metadata(metadata)
                .build();
        try {
            PaymentTransactionEntity saved = repository.saveAndFlush(entity);
            log.info("Ledger row opened: transactionId={}, gateway={}, quotes={}, amount={} {}",
                    saved.getTransactionId(), saved.getGatewayCode().getCode(), saved.getQuoteIds(),
                    saved.getAmountMajor(), saved.getCurrency());
            eventProducer.publish(saved, EVENT_PENDING);
            return saved;
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to open ledger row: transactionId=" + request.getTransactionId(), e);
        }
    }

    /** Records the gateway reference and raw response once the gateway accepted. */
    @Transactional
    public PaymentTransactionEntity markExternalCreated(String transactionId, String gatewayTransactionId,
                                                        Map<String, Object> gatewayResponse) {
        try {
            PaymentTransactionEntity entity = lockRow(transactionId);
            transition(entity, PaymentState.EXTERNAL_CREATED);
            entity.setGatewayTransactionId(gatewayTransactionId);
            entity.setGatewayResponse(gatewayResponse == null ? new LinkedHashMap<>() : new LinkedHashMap<>(gatewayResponse));
            entity.mergeMetadata(stepMetadata(CompensationStep.EXTERNAL_CREATED));
            PaymentTransactionEntity saved = repository.saveAndFlush(entity);
            log.info("Ledger row external_created: transactionId={}, gatewayTransactionId={}",
                    transactionId, gatewayTransactionId);
            eventProducer.publish(saved, EVENT_EXTERNAL_CREATED);
            return saved;
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to mark external_created: transactionId=" + transactionId, e);
        }
    }

    /** Final bookkeeping of a successful gateway call. */
    @Transactional
    public PaymentTransactionEntity markRecorded(String transactionId, Map<String, ?> auditMetadata) {
        try {
            PaymentTransactionEntity entity = lockRow(transactionId);
            if (entity.getPaymentState() != PaymentState.EXTERNAL_CREATED) {
                throw new IllegalStateException("Cannot record " + transactionId + " from state " + entity.getPaymentState());
            }
            transition(entity, PaymentState.DB_RECORDED);
            if (auditMetadata != null) {
                entity.mergeMetadata(auditMetadata);
            }
            entity.mergeMetadata(stepMetadata(CompensationStep.DB_RECORDED));
            PaymentTransactionEntity saved = repository.saveAndFlush(entity);
            log.info("Ledger row db_recorded: transactionId={}", transactionId);
            eventProducer.publish(saved, EVENT_RECORDED);
            return saved;
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to mark db_recorded: transactionId=" + transactionId, e);
        }
    }

    /**
     * Bank transfer and cash on delivery: nothing external happens, the row
     * goes straight to {@link PaymentState#DB_RECORDED} and stays pending
     * until staff confirm receipt.
     */
    @Transactional
    public PaymentTransactionEntity recordWithoutGatewayLeg(String transactionId) {
        try {
            PaymentTransactionEntity entity = lockRow(transactionId);
            if (!entity.getGatewayCode().isManual()) {
                throw new IllegalStateException("Gateway " + entity.getGatewayCode() + " requires an external call");
            }
            transition(entity, PaymentState.DB_RECORDED);
            entity.mergeMetadata(stepMetadata(CompensationStep.DB_RECORDED));
            PaymentTransactionEntity saved = repository.saveAndFlush(entity);
            log.info("Ledger row db_recorded without gateway leg: transactionId={}, gateway={}",
                    transactionId, entity.getGatewayCode().getCode());
            eventProducer.publish(saved, EVENT_RECORDED);
            return saved;
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to record manual payment: transactionId=" + transactionId, e);
        }
    }

    /** Nothing external happened; no compensation needed. */
    @Transactional
    public PaymentTransactionEntity markFailed(String transactionId, ErrorContext errorContext, String errorMessage) {
        try {
            PaymentTransactionEntity entity = lockRow(transactionId);
            transition(entity, PaymentState.FAILED);
            entity.setStatus(PaymentStatus.FAILED);
            entity.mergeMetadata(errorMetadata(CompensationStep.ERROR_HANDLING, errorContext, errorMessage));
            PaymentTransactionEntity saved = repository.saveAndFlush(entity);
            log.warn("Ledger row failed: transactionId={}, errorContext={}", transactionId, errorContext.getCode());
            eventProducer.publish(saved, EVENT_FAILED);
            return saved;
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to mark failed: transactionId=" + transactionId, e);
        }
    }

    /**
     * The external effect happened, or may have, but local bookkeeping did not
     * finish. Keeps the gateway reference when one is known.
     *
     * @param lastCompletedStep step that was durably completed before the error
     */
    @Transactional
    public PaymentTransactionEntity markOrphaned(String transactionId, CompensationStep lastCompletedStep,
                                                 ErrorContext errorContext, String gatewayTransactionId,
                                                 String errorMessage) {
        try {
            PaymentTransactionEntity entity = lockRow(transactionId);
            transition(entity, PaymentState.ORPHANED);
            if (entity.getGatewayTransactionId() == null && gatewayTransactionId != null) {
                entity.setGatewayTransactionId(gatewayTransactionId);
            }
            Map<String, Object> metadata = errorMetadata(CompensationStep.ERROR_HANDLING, errorContext, errorMessage);
            metadata.put(PaymentTransactionEntity.META_LAST_COMPLETED_STEP, lastCompletedStep.getCode());
            entity.mergeMetadata(metadata);
            PaymentTransactionEntity saved = repository.saveAndFlush(entity);
            log.error("Ledger row orphaned, manual reconciliation needed: transactionId={}, gatewayTransactionId={}, "
                            + "lastCompletedStep={}, errorContext={}",
                    transactionId, saved.getGatewayTransactionId(), lastCompletedStep.getCode(), errorContext.getCode());
            eventProducer.publish(saved, EVENT_ORPHANED);
            return saved;
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to mark orphaned: transactionId=" + transactionId, e);
        }
    }

    /**
     * Stores a gateway reference that arrived after the row was already
     * settled by a callback. The payment state is left alone.
     */
    @Transactional
    public PaymentTransactionEntity attachGatewayReference(String transactionId, String gatewayTransactionId) {
        try {
            PaymentTransactionEntity entity = lockRow(transactionId);
            if (entity.getGatewayTransactionId() != null || gatewayTransactionId == null) {
                return entity;
            }
            entity.setGatewayTransactionId(gatewayTransactionId);
            PaymentTransactionEntity saved = repository.saveAndFlush(entity);
            log.info("Late gateway reference stored: transactionId={}, gatewayTransactionId={}, paymentState={}",
                    transactionId, gatewayTransactionId, saved.getPaymentState().getCode());
            return saved;
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to attach gateway reference: transactionId=" + transactionId, e);
        }
    }

    /**
     * Applies a verified success callback. A row the synchronous path has not
     * finished yet is moved forward to {@link PaymentState#DB_RECORDED};
     * orphaned rows keep their state and only the business status changes.
     */
    @Transactional
    public CallbackApplication completeFromCallback(String transactionId, String gatewayTransactionId, String webhookEventId) {
        try {
            PaymentTransactionEntity entity = lockRow(transactionId);
            if (entity.getStatus() == PaymentStatus.COMPLETED) {
                return CallbackApplication.ALREADY_APPLIED;
            }
            if (entity.getPaymentState() == PaymentState.FAILED) {
                log.warn("Success callback for failed attempt, manual review needed: transactionId={}, webhookEventId={}",
                        transactionId, webhookEventId);
                return CallbackApplication.REJECTED;
            }
            if (entity.getGatewayTransactionId() == null && gatewayTransactionId != null) {
                entity.setGatewayTransactionId(gatewayTransactionId);
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            if (entity.getPaymentState() == PaymentState.PENDING || entity.getPaymentState() == PaymentState.EXTERNAL_CREATED) {
                transition(entity, PaymentState.DB_RECORDED);
                metadata.putAll(stepMetadata(CompensationStep.WEBHOOK_RECONCILED));
            }
            entity.setStatus(PaymentStatus.COMPLETED);
            metadata.put(META_WEBHOOK_EVENT_ID, webhookEventId);
            metadata.put(META_COMPLETED_AT, clock.instant().toString());
            entity.mergeMetadata(metadata);
            PaymentTransactionEntity saved = repository.saveAndFlush(entity);
            log.info("Ledger row completed from callback: transactionId={}, paymentState={}, webhookEventId={}",
                    transactionId, saved.getPaymentState().getCode(), webhookEventId);
            eventProducer.publish(saved, EVENT_COMPLETED);
            return CallbackApplication.APPLIED;
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to complete from callback: transactionId=" + transactionId, e);
        }
    }

    /** Applies a verified failure callback. Quotes are never touched for failures. */
    @Transactional
    public CallbackApplication failFromCallback(String transactionId, String webhookEventId, String reason) {
        try {
            PaymentTransactionEntity entity = lockRow(transactionId);
            if (entity.getStatus() == PaymentStatus.FAILED) {
                return CallbackApplication.ALREADY_APPLIED;
            }
            if (entity.getStatus() == PaymentStatus.COMPLETED) {
                log.warn("Failure callback for completed payment, manual review needed: transactionId={}, webhookEventId={}",
                        transactionId, webhookEventId);
                return CallbackApplication.REJECTED;
            }
            if (entity.getPaymentState().canTransitionTo(PaymentState.FAILED)) {
                transition(entity, PaymentState.FAILED);
            }
            entity.setStatus(PaymentStatus.FAILED);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(META_WEBHOOK_EVENT_ID, webhookEventId);
            metadata.put(META_FAILED_AT, clock.instant().toString());
            metadata.put(PaymentTransactionEntity.META_ERROR_MESSAGE, truncate(reason));
            entity.mergeMetadata(metadata);
            PaymentTransactionEntity saved = repository.saveAndFlush(entity);
            log.info("Ledger row failed from callback: transactionId={}, paymentState={}, webhookEventId={}",
                    transactionId, saved.getPaymentState().getCode(), webhookEventId);
            eventProducer.publish(saved, EVENT_CALLBACK_FAILED);
            return CallbackApplication.APPLIED;
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Failed to fail from callback: transactionId=" + transactionId, e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<PaymentTransactionEntity> find(String transactionId) {
        return repository.findById(transactionId);
    }

    @Transactional(readOnly = true)
    public Optional<PaymentTransactionEntity> findByGatewayTransactionId(String gatewayTransactionId) {
        return repository.findFirstByGatewayTransactionId(gatewayTransactionId);
    }

    @Transactional(readOnly = true)
    public Page<PaymentTransactionEntity> findOrphaned(Pageable pageable) {
        return repository.findByPaymentStateOrderByCreatedAtDesc(PaymentState.ORPHANED, pageable);
    }

    private PaymentTransactionEntity lockRow(String transactionId) {
        return repository.findForUpdate(transactionId)
                .orElseThrow(() -> new PaymentException(ErrorKind.TRANSACTION_NOT_FOUND,
                        "Ledger row not found: transactionId=" + transactionId));
    }

    private static void transition(PaymentTransactionEntity entity, PaymentState next) {
        PaymentState current = entity.getPaymentState();
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal payment state transition " + current.getCode() + " -> "
                    + next.getCode() + " for " + entity.getTransactionId());
        }
        entity.setPaymentState(next);
    }

    private static Map<String, Object> stepMetadata(CompensationStep step) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(PaymentTransactionEntity.META_COMPENSATION_STEP, step.getCode());
        metadata.put(PaymentTransactionEntity.META_LAST_COMPLETED_STEP, step.getCode());
        return metadata;
    }

    private Map<String, Object> errorMetadata(CompensationStep step, ErrorContext errorContext, String errorMessage) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(PaymentTransactionEntity.META_COMPENSATION_STEP, step.getCode());
        metadata.put(PaymentTransactionEntity.META_ERROR_CONTEXT, errorContext.getCode());
        metadata.put(PaymentTransactionEntity.META_ERROR_MESSAGE, truncate(errorMessage));
        metadata.put(PaymentTransactionEntity.META_ERROR_TIME, clock.instant().toString());
        return metadata;
    }

    private static Map<String, Object> customerMap(CustomerInfo customer) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", customer.getName());
        map.put("email", customer.getEmail());
        map.put("phone", customer.getPhone());
        map.values().removeIf(v -> v == null);
        return map;
    }

    private static String truncate(String message) {
        if (message == null) return null;
        return message.length() <= MAX_ERROR_MESSAGE ? message : message.substring(0, MAX_ERROR_MESSAGE);
    }
}
