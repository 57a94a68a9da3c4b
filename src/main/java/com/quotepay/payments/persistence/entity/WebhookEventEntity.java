package com.quotepay.payments.persistence.entity;

import com.quotepay.payments.domain.GatewayCode;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Inbox of received gateway callbacks. The unique key on
 * {@code (gateway_code, event_id)} makes redelivery a no-op; a row is
 * immutable once {@code processedAt} is set.
 */
@Entity
@Table(name = "webhook_events",
        uniqueConstraints = @UniqueConstraint(name = "uk_webhook_gateway_event", columnNames = {"gateway_code", "event_id"}),
        indexes = {
            @Index(name = "idx_webhook_transaction_id", columnList = "transaction_id"),
            @Index(name = "idx_webhook_received_at", columnList = "received_at")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "gateway_code", nullable = false, length = 32)
    private GatewayCode gatewayCode;

    @Column(name = "event_id", nullable = false, length = 191)
    private String eventId;

    @Column(name = "event_type", length = 128)
    private String eventType;

    @Column(name = "transaction_id", length = 64)
    private String transactionId;

    @Column(name = "payload_hash", nullable = false, length = 64)
    private String payloadHash;

    @Column(name = "payload", length = 8000)
    private String payload;

    @Column(name = "verified", nullable = false)
    private boolean verified;

    @Column(name = "verification_error", length = 500)
    private String verificationError;

    @Column(name = "processing_error", length = 1000)
    private String processingError;

    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @PrePersist
    protected void onCreate() {
        if (receivedAt == null) {
            receivedAt = Instant.now();
        }
    }

    public boolean isProcessed() {
        return processedAt != null;
    }
}
