package com.quotepay.payments.persistence.entity;

import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.domain.PaymentState;
import com.quotepay.payments.domain.PaymentStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One row per payment attempt. Written before the external gateway call and
 * never deleted: failed and orphaned attempts stay for audit.
 */
@Entity
@Table(name = "payment_transactions", indexes = {
    @Index(name = "idx_payment_gateway_tx_id", columnList = "gateway_transaction_id"),
    @Index(name = "idx_payment_state", columnList = "payment_state"),
    @Index(name = "idx_payment_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentTransactionEntity {

    public static final String META_COMPENSATION_STEP = "compensation_step";
    public static final String META_LAST_COMPLETED_STEP = "last_completed_step";
    public static final String META_ERROR_CONTEXT = "error_context";
    public static final String META_ERROR_MESSAGE = "error_message";
    public static final String META_ERROR_TIME = "error_time";
    public static final String META_GUEST_SESSION_TOKEN = "guest_session_token";
    public static final String META_CUSTOMER = "customer";
    public static final String META_SUCCESS_URL = "success_url";
    public static final String META_CANCEL_URL = "cancel_url";

    @Id
    @Column(name = "transaction_id", nullable = false, length = 64)
    private String transactionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "gateway_code", nullable = false, length = 32)
    private GatewayCode gatewayCode;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "payment_transaction_quotes", joinColumns = @JoinColumn(name = "transaction_id"))
    @OrderColumn(name = "quote_order")
    @Column(name = "quote_id", nullable = false, length = 64)
    @Builder.Default
    private List<String> quoteIds = new ArrayList<>();

    @Column(name = "user_id")
    private String userId;

    @Column(name = "amount_minor", nullable = false)
    private long amountMinor;

    @Column(name = "amount_major", nullable = false, precision = 19, scale = 3)
    private BigDecimal amountMajor;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PaymentStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_state", nullable = false, length = 32)
    private PaymentState paymentState;

    @Column(name = "gateway_transaction_id", length = 128)
    private String gatewayTransactionId;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "gateway_response", length = 8000)
    @Builder.Default
    private Map<String, Object> gatewayResponse = new LinkedHashMap<>();

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata", length = 8000)
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public String metadataValue(String key) {
        Object value = metadata == null ? null : metadata.get(key);
        return value == null ? null : value.toString();
    }

    /** Replaces the metadata map so the change is always detected as dirty. */
    public void mergeMetadata(Map<String, ?> entries) {
        Map<String, Object> merged = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
        entries.forEach((k, v) -> {
            if (v != null) {
                merged.put(k, v);
            }
        });
        this.metadata = merged;
    }
}
