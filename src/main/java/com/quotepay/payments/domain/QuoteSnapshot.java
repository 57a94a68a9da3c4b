package com.quotepay.payments.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Read-only view of a quote: the fields payment creation needs.
 */
@Value
@Builder
public class QuoteSnapshot {
    String id;
    QuoteStatus status;
    BigDecimal finalTotal;
    String currency;
    String ownerId;
    String customerName;
    String customerEmail;
    String customerPhone;
    String productSummary;
}
