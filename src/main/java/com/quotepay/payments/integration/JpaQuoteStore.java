package com.quotepay.payments.integration;

import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.domain.QuoteSnapshot;
import com.quotepay.payments.domain.QuoteStatus;
import com.quotepay.payments.persistence.entity.QuoteEntity;
import com.quotepay.payments.persistence.repository.QuoteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaQuoteStore implements QuoteStore {

    private final QuoteRepository quoteRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public List<QuoteSnapshot> findAll(List<String> quoteIds) {
        Map<String, QuoteEntity> byId = quoteRepository.findAllById(quoteIds).stream()
                .collect(Collectors.toMap(QuoteEntity::getId, Function.identity()));
        List<QuoteSnapshot> snapshots = new ArrayList<>();
        for (String id : quoteIds) {
            QuoteEntity quote = byId.get(id);
            if (quote != null) {
                snapshots.add(toSnapshot(quote));
            }
        }
        return snapshots;
    }

    @Override
    @Transactional
    public int markPaid(List<String> quoteIds, String transactionId, GatewayCode gatewayCode) {
        int transitioned = 0;
        for (QuoteEntity quote : quoteRepository.findAllById(quoteIds)) {
            if (quote.getStatus() == QuoteStatus.PAID) {
                log.debug("Quote already paid: quoteId={}, transactionId={}", quote.getId(), transactionId);
                continue;
            }
            if (!quote.getStatus().acceptsPayment()) {
                log.warn("Quote not in a payable status, leaving unchanged: quoteId={}, status={}, transactionId={}",
                        quote.getId(), quote.getStatus(), transactionId);
                continue;
            }
            quote.setStatus(QuoteStatus.PAID);
            quote.setPaymentStatus("paid");
            quote.setPaymentMethod(gatewayCode.getCode());
            quote.setPaymentTransactionId(transactionId);
            quote.setPaidAt(clock.instant());
            quoteRepository.save(quote);
            transitioned++;
        }
        log.info("Marked quotes paid: transactionId={}, requested={}, transitioned={}",
                transactionId, quoteIds.size(), transitioned);
        return transitioned;
    }

    private static QuoteSnapshot toSnapshot(QuoteEntity quote) {
        return QuoteSnapshot.builder()
                .id(quote.getId())
                .status(quote.getStatus())
                .finalTotal(quote.getFinalTotal())
                .currency(quote.getCurrency())
                .ownerId(quote.getOwnerId())
                .customerName(quote.getCustomerName())
                .customerEmail(quote.getCustomerEmail())
                .customerPhone(quote.getCustomerPhone())
                .productSummary(quote.getProductSummary())
                .build();
    }
}
