package com.quotepay.payments.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.domain.PaymentState;
import com.quotepay.payments.domain.PaymentStatus;
import com.quotepay.payments.persistence.entity.PaymentTransactionEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Ledger view for status polling and operators. Carries no customer data.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransactionStatusDto {

    String transactionId;
    GatewayCode gateway;
    List<String> quoteIds;
    PaymentStatus status;
    PaymentState paymentState;
    String gatewayTransactionId;
    BigDecimal amount;
    String currency;
    String compensationStep;
    String lastCompletedStep;
    String errorContext;
    Instant createdAt;
    Instant updatedAt;

    public static TransactionStatusDto from(PaymentTransactionEntity entity) {
        return TransactionStatusDto.builder()
                .transactionId(entity.getTransactionId())
                .gateway(entity.getGatewayCode())
                .quoteIds(List.copyOf(entity.getQuoteIds()))
                .status(entity.getStatus())
                .paymentState(entity.getPaymentState())
                .gatewayTransactionId(entity.getGatewayTransactionId())
                .amount(entity.getAmountMajor())
                .currency(entity.getCurrency())
                .compensationStep(entity.metadataValue(PaymentTransactionEntity.META_COMPENSATION_STEP))
                .lastCompletedStep(entity.metadataValue(PaymentTransactionEntity.META_LAST_COMPLETED_STEP))
                .errorContext(entity.metadataValue(PaymentTransactionEntity.META_ERROR_CONTEXT))
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
