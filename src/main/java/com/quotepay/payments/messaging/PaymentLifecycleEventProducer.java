package com.quotepay.payments.messaging;

import com.quotepay.payments.persistence.entity.PaymentTransactionEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes ledger transitions to Kafka, keyed by transaction id so all
 * events of one attempt land on one partition. Publishing is best effort:
 * failures are logged and never reach the payment flow.
 */
@Slf4j
@Component
public class PaymentLifecycleEventProducer {

    private final KafkaTemplate<String, PaymentLifecycleEvent> kafkaTemplate;
    private final Clock clock;
    private final String topic;

    public PaymentLifecycleEventProducer(KafkaTemplate<String, PaymentLifecycleEvent> kafkaTemplate,
                                         Clock clock,
                                         @Value("${payment.kafka.topic.lifecycle-events:payment-lifecycle-events}") String topic) {
        this.kafkaTemplate = kafkaTemplate;
        this.clock = clock;
        this.topic = topic;
    }

    public void publish(PaymentTransactionEntity entity, String eventType) {
        PaymentLifecycleEvent event = PaymentLifecycleEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(eventType)
                .transactionId(entity.getTransactionId())
                .gatewayCode(entity.getGatewayCode())
                .quoteIds(entity.getQuoteIds() == null ? null : new ArrayList<>(entity.getQuoteIds()))
                .status(entity.getStatus())
                .paymentState(entity.getPaymentState())
                .gatewayTransactionId(entity.getGatewayTransactionId())
                .compensationStep(entity.metadataValue(PaymentTransactionEntity.META_COMPENSATION_STEP))
                .errorContext(entity.metadataValue(PaymentTransactionEntity.META_ERROR_CONTEXT))
                .amount(entity.getAmountMajor())
                .currency(entity.getCurrency())
                .timestamp(clock.instant())
                .build();
        send(entity.getTransactionId(), event);
    }

    private void send(String key, PaymentLifecycleEvent event) {
        log.debug("Publishing lifecycle event: key={}, eventId={}, eventType={}", key, event.getEventId(), event.getEventType());
        CompletableFuture<SendResult<String, PaymentLifecycleEvent>> future;
        try {
            future = kafkaTemplate.send(topic, key, event);
        } catch (RuntimeException e) {
            log.error("Failed to publish lifecycle event key={} eventId={} eventType={}",
                    key, event.getEventId(), event.getEventType(), e);
            return;
        }
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish lifecycle event key={} eventId={}", key, event.getEventId(), ex);
            } else {
                log.debug("Published lifecycle event: key={}, eventId={}, partition={}, offset={}",
                        key, event.getEventId(),
                        result != null ? result.getRecordMetadata().partition() : null,
                        result != null ? result.getRecordMetadata().offset() : null);
            }
        });
    }
}
