package com.quotepay.payments.persistence.entity;

import com.quotepay.payments.domain.QuoteStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Quote columns payments reads and the payment fields it writes. Quotes are
 * created and owned elsewhere.
 */
@Entity
@Table(name = "quotes")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuoteEntity {

    @Id
    @Column(name = "id", nullable = false, length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private QuoteStatus status;

    @Column(name = "final_total", precision = 19, scale = 3)
    private BigDecimal finalTotal;

    @Column(name = "currency", length = 3)
    private String currency;

    @Column(name = "user_id")
    private String ownerId;

    @Column(name = "customer_name")
    private String customerName;

    @Column(name = "customer_email")
    private String customerEmail;

    @Column(name = "customer_phone")
    private String customerPhone;

    @Column(name = "product_summary", length = 500)
    private String productSummary;

    @Column(name = "payment_status", length = 32)
    private String paymentStatus;

    @Column(name = "payment_method", length = 32)
    private String paymentMethod;

    @Column(name = "payment_transaction_id", length = 64)
    private String paymentTransactionId;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }
}
