package com.quotepay.payments;

import com.jayway.jsonpath.JsonPath;
import com.quotepay.payments.core.GatewayRateLimiter;
import com.quotepay.payments.domain.CompensationStep;
import com.quotepay.payments.domain.ErrorContext;
import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.domain.GuestSessionStatus;
import com.quotepay.payments.domain.NormalizedPaymentRequest;
import com.quotepay.payments.domain.PaymentState;
import com.quotepay.payments.domain.PaymentStatus;
import com.quotepay.payments.domain.QuoteStatus;
import com.quotepay.payments.domain.gateway.CardIntentRequest;
import com.quotepay.payments.integration.AccessTokenVerifier;
import com.quotepay.payments.ledger.TransactionLedger;
import com.quotepay.payments.persistence.entity.GuestCheckoutSessionEntity;
import com.quotepay.payments.persistence.entity.PaymentTransactionEntity;
import com.quotepay.payments.persistence.entity.QuoteEntity;
import com.quotepay.payments.persistence.entity.WebhookEventEntity;
import com.quotepay.payments.persistence.repository.GuestCheckoutSessionRepository;
import com.quotepay.payments.persistence.repository.PaymentTransactionRepository;
import com.quotepay.payments.persistence.repository.QuoteRepository;
import com.quotepay.payments.persistence.repository.WebhookEventRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full application context on H2 and Embedded Kafka: the ledger's JPA
 * mapping, the webhook inbox constraint and guest checkout over HTTP.
 * The Redis-backed rate limiter is replaced by a mock.
 */
@SpringBootTest(classes = QuotePaymentsApplication.class, properties = {
        "spring.datasource.url=jdbc:h2:mem:quotepay;MODE=PostgreSQL;DB_CLOSE_DELAY=-1",
        "spring.datasource.username=sa",
        "spring.datasource.password=",
        "spring.jpa.hibernate.ddl-auto=create-drop",
        "payment.gateways.card.webhook-secret=whsec_integration"
})
@AutoConfigureMockMvc
@EmbeddedKafka(partitions = 1, topics = { "payment-lifecycle-events" },
        bootstrapServersProperty = "spring.kafka.bootstrap-servers")
class PaymentLedgerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TransactionLedger ledger;

    @Autowired
    private WebhookEventRepository webhookEventRepository;

    @Autowired
    private QuoteRepository quoteRepository;

    @Autowired
    private GuestCheckoutSessionRepository guestSessionRepository;

    @Autowired
    private PaymentTransactionRepository transactionRepository;

    @MockitoBean
    private AccessTokenVerifier accessTokenVerifier;

    @MockitoBean
    private GatewayRateLimiter rateLimiter;

    @Test
    @DisplayName("Guest bank transfer is recorded without a gateway leg and leaves the quote payable")
    void guestBankTransferIsRecorded() throws Exception {
        quoteRepository.save(QuoteEntity.builder()
                .id("Q-INT-1")
                .status(QuoteStatus.APPROVED)
                .finalTotal(new BigDecimal("12.82"))
                .currency("USD")
                .customerName("Asha")
                .customerEmail("asha@example.com")
                .build());
        guestSessionRepository.save(GuestCheckoutSessionEntity.builder()
                .sessionToken("guest-int-1")
                .quoteId("Q-INT-1")
                .status(GuestSessionStatus.ACTIVE)
                .expiresAt(Instant.now().plusSeconds(3600))
                .build());

        String body = mockMvc.perform(post("/api/v1/payments/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Guest-Session-Token", "guest-int-1")
                        .content("""
                                {"quoteIds": ["Q-INT-1"], "gateway": "bank-transfer"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.paymentState").value("db_recorded"))
                .andExpect(jsonPath("$.trackable").value(false))
                .andReturn().getResponse().getContentAsString();

        String transactionId = JsonPath.read(body, "$.transactionId");
        PaymentTransactionEntity row = transactionRepository.findById(transactionId).orElseThrow();
        assertThat(row.getPaymentState()).isEqualTo(PaymentState.DB_RECORDED);
        assertThat(row.getGatewayCode()).isEqualTo(GatewayCode.BANK_TRANSFER);
        assertThat(row.getGatewayTransactionId()).isNull();
        assertThat(row.getQuoteIds()).containsExactly("Q-INT-1");
        assertThat(quoteRepository.findById("Q-INT-1").orElseThrow().getStatus()).isEqualTo(QuoteStatus.APPROVED);
    }

    @Test
    @DisplayName("Orphaned attempt keeps its gateway reference and last completed step after reload")
    void orphanedAttemptIsDurable() {
        String transactionId = "CRD_1700000000000_ORPHAN";
        ledger.open(cardPayment(transactionId), cardIntent(transactionId));
        ledger.markExternalCreated(transactionId, "pi_int_1", Map.of("id", "pi_int_1"));
        ledger.markOrphaned(transactionId, CompensationStep.EXTERNAL_CREATED,
                ErrorContext.DATABASE_ERROR_AFTER_EXTERNAL_SUCCESS, null, "connection reset");

        PaymentTransactionEntity reloaded = transactionRepository.findById(transactionId).orElseThrow();
        assertThat(reloaded.getPaymentState()).isEqualTo(PaymentState.ORPHANED);
        assertThat(reloaded.getGatewayTransactionId()).isEqualTo("pi_int_1");
        assertThat(reloaded.getGatewayResponse()).containsEntry("id", "pi_int_1");
        assertThat(reloaded.metadataValue(PaymentTransactionEntity.META_LAST_COMPLETED_STEP)).isEqualTo("external_created");
        assertThat(reloaded.metadataValue(PaymentTransactionEntity.META_ERROR_CONTEXT))
                .isEqualTo("database_error_after_external_success");
        assertThat(ledger.findOrphaned(PageRequest.of(0, 50)).getContent())
                .extracting(PaymentTransactionEntity::getTransactionId)
                .contains(transactionId);
        assertThat(ledger.findByGatewayTransactionId("pi_int_1")).isPresent();
    }

    @Test
    @DisplayName("The same gateway event id cannot be stored twice")
    void webhookInboxRejectsSecondRowForSameEvent() {
        webhookEventRepository.saveAndFlush(inboxRow("evt_int_dup"));

        assertThatThrownBy(() -> webhookEventRepository.saveAndFlush(inboxRow("evt_int_dup")))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("Forged card webhook is stored unverified and does not complete the payment")
    void forgedWebhookIsStoredButNotApplied() throws Exception {
        String transactionId = "CRD_1700000000000_FORGED";
        ledger.open(cardPayment(transactionId), cardIntent(transactionId));
        ledger.markExternalCreated(transactionId, "pi_int_2", Map.of());
        ledger.markRecorded(transactionId, Map.of());

        mockMvc.perform(post("/api/v1/webhooks/card")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Stripe-Signature", "t=" + Instant.now().getEpochSecond() + ",v1=" + "0".repeat(64))
                        .content("""
                                {"id": "evt_int_forged", "type": "payment_intent.succeeded",
                                 "data": {"object": {"id": "pi_int_2", "status": "succeeded",
                                   "metadata": {"transaction_id": "CRD_1700000000000_FORGED", "order_reference": "Order_Q-INT-9"}}}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UNVERIFIED"));

        WebhookEventEntity stored = webhookEventRepository
                .findByGatewayCodeAndEventId(GatewayCode.CARD, "evt_int_forged").orElseThrow();
        assertThat(stored.isVerified()).isFalse();
        assertThat(stored.getProcessedAt()).isNull();
        PaymentTransactionEntity row = transactionRepository.findById(transactionId).orElseThrow();
        assertThat(row.getStatus()).isEqualTo(PaymentStatus.PENDING);
    }

    @Test
    @DisplayName("Guest session cannot pay for a second quote")
    void guestCannotPayForOtherQuote() throws Exception {
        guestSessionRepository.save(GuestCheckoutSessionEntity.builder()
                .sessionToken("guest-int-2")
                .quoteId("Q-INT-2")
                .status(GuestSessionStatus.ACTIVE)
                .expiresAt(Instant.now().plusSeconds(3600))
                .build());

        mockMvc.perform(post("/api/v1/payments/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Guest-Session-Token", "guest-int-2")
                        .content("""
                                {"quoteIds": ["Q-INT-2", "Q-INT-3"], "gateway": "cash-on-delivery"}
                                """))
                .andExpect(status().isForbidden());
    }

    private static NormalizedPaymentRequest cardPayment(String transactionId) {
        return NormalizedPaymentRequest.builder()
                .transactionId(transactionId)
                .gatewayCode(GatewayCode.CARD)
                .quoteIds(List.of("Q-INT-9"))
                .amount(new BigDecimal("12.82"))
                .currency("USD")
                .amountMinor(1282L)
                .userId("user-int")
                .build();
    }

    private static CardIntentRequest cardIntent(String transactionId) {
        return CardIntentRequest.builder()
                .transactionId(transactionId)
                .chargedAmount(new BigDecimal("12.82"))
                .chargedCurrency("USD")
                .chargedAmountMinor(1282L)
                .metadata(Map.of("transaction_id", transactionId))
                .build();
    }

    private static WebhookEventEntity inboxRow(String eventId) {
        return WebhookEventEntity.builder()
                .gatewayCode(GatewayCode.CARD)
                .eventId(eventId)
                .payloadHash("hash")
                .verified(true)
                .receivedAt(Instant.now())
                .build();
    }
}
