package com.quotepay.payments.persistence.service;

import com.quotepay.payments.compliance.PiiMasker;
import com.quotepay.payments.domain.CallbackResult;
import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.persistence.entity.WebhookEventEntity;
import com.quotepay.payments.persistence.repository.WebhookEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Records received callbacks in the webhook inbox. Every callback is written
 * before any processing, verified or not. The unique key on
 * {@code (gateway_code, event_id)} settles concurrent duplicate deliveries;
 * the losing insert is treated as an idempotent no-op.
 * <p>
 * Methods are not transactional: each repository call commits
 * on its own so a constraint violation does not poison a surrounding
 * transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookEventStore {

    static final int MAX_PAYLOAD_LENGTH = 8000;

    private final WebhookEventRepository repository;
    private final Clock clock;

    @Value
    public static class Registration {
        Long eventRowId;
        boolean alreadyProcessed;
        boolean concurrentDuplicate;

        public boolean isDuplicate() {
            return alreadyProcessed || concurrentDuplicate;
        }
    }

    public Registration register(CallbackResult callback, String payloadHash, String payload,
                                 boolean verified, String verificationError) {
        Optional<WebhookEventEntity> existing =
                repository.findByGatewayCodeAndEventId(callback.getGatewayCode(), callback.getEventId());
        if (existing.isPresent()) {
            return reuse(existing.get(), verified, verificationError);
        }
        WebhookEventEntity entity = WebhookEventEntity.builder()
                .gatewayCode(callback.getGatewayCode())
                .eventId(callback.getEventId())
                .eventType(callback.getEventType())
                .transactionId(callback.getTransactionId())
                .payloadHash(payloadHash)
                .payload(PiiMasker.truncate(payload, MAX_PAYLOAD_LENGTH - 3))
                .verified(verified)
                .verificationError(PiiMasker.truncate(verificationError, 490))
                .receivedAt(clock.instant())
                .build();
        try {
            WebhookEventEntity saved = repository.saveAndFlush(entity);
            log.debug("Recorded webhook event: gateway={}, eventId={}, verified={}",
                    callback.getGatewayCode(), callback.getEventId(), verified);
            return new Registration(saved.getId(), false, false);
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent delivery of webhook event detected (database constraint): gateway={}, eventId={}. "
                    + "Treating as duplicate.", callback.getGatewayCode(), callback.getEventId());
            return new Registration(null, false, true);
        }
    }

    /**
     * Records a callback whose payload could not be parsed at all. The event
     * id is derived from the payload hash and the row is closed immediately.
     */
    public Registration registerUnparseable(GatewayCode gatewayCode, String payloadHash, String payload, String error) {
        String eventId = "unparseable-" + payloadHash;
        Optional<WebhookEventEntity> existing = repository.findByGatewayCodeAndEventId(gatewayCode, eventId);
        if (existing.isPresent()) {
            return new Registration(existing.get().getId(), true, false);
        }
        WebhookEventEntity entity = WebhookEventEntity.builder()
                .gatewayCode(gatewayCode)
                .eventId(eventId)
                .payloadHash(payloadHash)
                .payload(PiiMasker.truncate(payload, MAX_PAYLOAD_LENGTH - 3))
                .verified(false)
                .processingError(PiiMasker.truncate(error, 990))
                .receivedAt(clock.instant())
                .processedAt(clock.instant())
                .build();
        try {
            WebhookEventEntity saved = repository.saveAndFlush(entity);
            return new Registration(saved.getId(), false, false);
        } catch (DataIntegrityViolationException e) {
            log.info("Unparseable webhook payload already recorded: gateway={}, eventId={}", gatewayCode, eventId);
            return new Registration(null, false, true);
        }
    }

    /** Notes a processing failure; the event stays unprocessed for a later delivery. */
    public void recordProcessingFailure(Long eventRowId, String error) {
        repository.findById(eventRowId).ifPresent(event -> {
            if (event.isProcessed()) {
                return;
            }
            event.setProcessingError(PiiMasker.truncate(error, 990));
            repository.save(event);
        });
    }

    private Registration reuse(WebhookEventEntity event, boolean verified, String verificationError) {
        if (event.isProcessed()) {
            return new Registration(event.getId(), true, false);
        }
        if (verified && !event.isVerified()) {
            event.setVerified(true);
            event.setVerificationError(null);
            repository.save(event);
            log.info("Previously unverified webhook event now verified: gateway={}, eventId={}",
                    event.getGatewayCode(), event.getEventId());
        } else if (!verified) {
            event.setVerificationError(PiiMasker.truncate(verificationError, 490));
            repository.save(event);
        }
        return new Registration(event.getId(), false, false);
    }
}
