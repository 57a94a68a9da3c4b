package com.quotepay.payments.persistence.entity;

import com.quotepay.payments.domain.GuestSessionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Guest checkout session issued by the storefront; bound to exactly one quote.
 */
@Entity
@Table(name = "guest_checkout_sessions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GuestCheckoutSessionEntity {

    @Id
    @Column(name = "session_token", nullable = false, length = 128)
    private String sessionToken;

    @Column(name = "quote_id", nullable = false, length = 64)
    private String quoteId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private GuestSessionStatus status;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;
}
