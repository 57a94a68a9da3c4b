package com.quotepay.payments.api;

import com.quotepay.payments.core.PaymentOrchestrator;
import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.domain.PaymentCreationOutcome;
import com.quotepay.payments.domain.PaymentCreationRequest;
import com.quotepay.payments.domain.PaymentState;
import com.quotepay.payments.domain.PaymentStatus;
import com.quotepay.payments.ledger.TransactionLedger;
import com.quotepay.payments.persistence.entity.PaymentTransactionEntity;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for PaymentController using MockMvc.
 */
@WebMvcTest(controllers = PaymentController.class)
class PaymentControllerTest {

    private static final String BODY = """
            {
              "quoteIds": ["Q1"],
              "gateway": "regional-hash-a",
              "successUrl": "https://shop.test/ok",
              "cancelUrl": "https://shop.test/cancel"
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PaymentOrchestrator orchestrator;

    @MockitoBean
    private TransactionLedger ledger;

    @Test
    void createReturnsFormForHashGateway() throws Exception {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("key", "mkey");
        form.put("txnid", "RHA_1_ABC");
        when(orchestrator.createPayment(any())).thenReturn(PaymentCreationOutcome.builder()
                .success(true)
                .transactionId("RHA_1_ABC")
                .gatewayCode(GatewayCode.REGIONAL_HASH_A)
                .paymentState(PaymentState.DB_RECORDED)
                .redirectUrl("https://test.gateway-a.example/_payment")
                .formMethod("POST")
                .formData(form)
                .chargedAmount(new BigDecimal("1064.06"))
                .chargedCurrency("INR")
                .trackable(true)
                .build());

        mockMvc.perform(post("/api/v1/payments/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Authorization", "Bearer jwt-1")
                        .header("X-Forwarded-For", "203.0.113.7, 10.0.0.1")
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.transactionId").value("RHA_1_ABC"))
                .andExpect(jsonPath("$.gateway").value("regional-hash-a"))
                .andExpect(jsonPath("$.paymentState").value("db_recorded"))
                .andExpect(jsonPath("$.method").value("POST"))
                .andExpect(jsonPath("$.formData.txnid").value("RHA_1_ABC"))
                .andExpect(jsonPath("$.currency").value("INR"))
                .andExpect(jsonPath("$.clientSecret").doesNotExist());

        ArgumentCaptor<PaymentCreationRequest> captor = ArgumentCaptor.forClass(PaymentCreationRequest.class);
        verify(orchestrator).createPayment(captor.capture());
        assertThat(captor.getValue().getBearerToken()).isEqualTo("jwt-1");
        assertThat(captor.getValue().getClientIp()).isEqualTo("203.0.113.7");
        assertThat(captor.getValue().getQuoteIds()).containsExactly("Q1");
    }

    @Test
    void guestHeaderTakesPrecedenceOverBodyToken() throws Exception {
        when(orchestrator.createPayment(any())).thenReturn(PaymentCreationOutcome.builder()
                .success(true).transactionId("BNK_1_ABC").gatewayCode(GatewayCode.BANK_TRANSFER)
                .paymentState(PaymentState.DB_RECORDED).build());

        mockMvc.perform(post("/api/v1/payments/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Guest-Session-Token", "guest-header")
                        .content("""
                                {"quoteIds": ["Q1"], "gateway": "bank-transfer", "guestSessionToken": "guest-body"}
                                """))
                .andExpect(status().isOk());

        ArgumentCaptor<PaymentCreationRequest> captor = ArgumentCaptor.forClass(PaymentCreationRequest.class);
        verify(orchestrator).createPayment(captor.capture());
        assertThat(captor.getValue().getGuestSessionToken()).isEqualTo("guest-header");
        assertThat(captor.getValue().getBearerToken()).isNull();
    }

    @Test
    void gatewayFailureIsOkWithSuccessFalse() throws Exception {
        when(orchestrator.createPayment(any())).thenReturn(PaymentCreationOutcome.builder()
                .success(false)
                .transactionId("CRD_1_ABC")
                .gatewayCode(GatewayCode.CARD)
                .paymentState(PaymentState.FAILED)
                .error("Payment could not be started. Please try again or choose another method.")
                .build());

        mockMvc.perform(post("/api/v1/payments/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Authorization", "Bearer jwt-1")
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.paymentState").value("failed"))
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void missingQuoteIdsIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/payments/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"quoteIds": [], "gateway": "card"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.quoteIds").exists());

        verify(orchestrator, never()).createPayment(any());
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/payments/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"));
    }

    @Test
    void foreignQuoteIsForbidden() throws Exception {
        when(orchestrator.createPayment(any()))
                .thenThrow(new PaymentAuthorizationException(ErrorKind.FORBIDDEN, "Quote Q1 belongs to user-2"));

        mockMvc.perform(post("/api/v1/payments/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Authorization", "Bearer jwt-1")
                        .content(BODY))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("FORBIDDEN"))
                .andExpect(jsonPath("$.message").value("You are not allowed to pay for these quotes"));
    }

    @Test
    void paidQuoteIsConflict() throws Exception {
        when(orchestrator.createPayment(any()))
                .thenThrow(new PaymentValidationException(ErrorKind.QUOTE_NOT_PAYABLE, "Quote Q1 is paid"));

        mockMvc.perform(post("/api/v1/payments/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Authorization", "Bearer jwt-1")
                        .content(BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("QUOTE_NOT_PAYABLE"));
    }

    @Test
    void getReturnsLedgerState() throws Exception {
        PaymentTransactionEntity entity = PaymentTransactionEntity.builder()
                .transactionId("CRD_1_ABC")
                .gatewayCode(GatewayCode.CARD)
                .quoteIds(List.of("Q1"))
                .status(PaymentStatus.PENDING)
                .paymentState(PaymentState.ORPHANED)
                .gatewayTransactionId("pi_123")
                .amountMajor(new BigDecimal("12.82"))
                .currency("USD")
                .build();
        entity.mergeMetadata(Map.of(PaymentTransactionEntity.META_LAST_COMPLETED_STEP, "external_created"));
        when(ledger.find("CRD_1_ABC")).thenReturn(Optional.of(entity));

        mockMvc.perform(get("/api/v1/payments/CRD_1_ABC"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paymentState").value("orphaned"))
                .andExpect(jsonPath("$.gatewayTransactionId").value("pi_123"))
                .andExpect(jsonPath("$.lastCompletedStep").value("external_created"));
    }

    @Test
    void getUnknownIsNotFound() throws Exception {
        when(ledger.find("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/payments/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("TRANSACTION_NOT_FOUND"));
    }

    @Test
    void orphanedListIsPaged() throws Exception {
        when(ledger.findOrphaned(any(Pageable.class))).thenReturn(new PageImpl<>(List.of()));

        mockMvc.perform(get("/api/v1/payments/orphaned").param("size", "500"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());

        ArgumentCaptor<Pageable> captor = ArgumentCaptor.forClass(Pageable.class);
        verify(ledger).findOrphaned(captor.capture());
        assertThat(captor.getValue().getPageSize()).isEqualTo(100);
    }
}
