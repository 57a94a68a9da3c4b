package com.quotepay.payments.api;

import com.quotepay.payments.domain.CallbackOutcome;
import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.ledger.TransactionLedger;
import com.quotepay.payments.persistence.entity.PaymentTransactionEntity;
import com.quotepay.payments.webhook.InboundCallback;
import com.quotepay.payments.webhook.WebhookDisposition;
import com.quotepay.payments.webhook.WebhookIngestionService;
import com.quotepay.payments.webhook.WebhookReceipt;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = WebhookController.class)
@TestPropertySource(properties = {
        "payment.frontend.success-url=https://shop.test/payment/success",
        "payment.frontend.failure-url=https://shop.test/payment/failure"
})
class WebhookControllerTest {

    private static final String EVENT = "{\"id\":\"evt_1\",\"type\":\"payment_intent.succeeded\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private WebhookIngestionService ingestionService;

    @MockitoBean
    private TransactionLedger ledger;

    @Test
    void processedWebhookIsOk() throws Exception {
        when(ingestionService.receive(eq(GatewayCode.CARD), any())).thenReturn(receipt(WebhookDisposition.PROCESSED, true));

        mockMvc.perform(post("/api/v1/webhooks/card")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Stripe-Signature", "t=1,v1=abc")
                        .content(EVENT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PROCESSED"));

        ArgumentCaptor<InboundCallback> captor = ArgumentCaptor.forClass(InboundCallback.class);
        verify(ingestionService).receive(eq(GatewayCode.CARD), captor.capture());
        assertThat(captor.getValue().getRawBody()).isEqualTo(EVENT);
        assertThat(captor.getValue().header("stripe-signature")).isEqualTo("t=1,v1=abc");
    }

    @Test
    void duplicateWebhookIsOk() throws Exception {
        when(ingestionService.receive(eq(GatewayCode.CARD), any())).thenReturn(receipt(WebhookDisposition.DUPLICATE, true));

        mockMvc.perform(post("/api/v1/webhooks/card").contentType(MediaType.APPLICATION_JSON).content(EVENT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DUPLICATE"));
    }

    @Test
    void unverifiedWebhookIsAcknowledgedAfterRecording() throws Exception {
        when(ingestionService.receive(eq(GatewayCode.CARD), any())).thenReturn(receipt(WebhookDisposition.UNVERIFIED, false));

        mockMvc.perform(post("/api/v1/webhooks/card").contentType(MediaType.APPLICATION_JSON).content(EVENT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UNVERIFIED"));
    }

    @Test
    void deferredWebhookIsAcknowledgedAfterRecording() throws Exception {
        when(ingestionService.receive(eq(GatewayCode.CARD), any())).thenReturn(receipt(WebhookDisposition.DEFERRED, true));

        mockMvc.perform(post("/api/v1/webhooks/card").contentType(MediaType.APPLICATION_JSON).content(EVENT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEFERRED"));
    }

    @Test
    void unknownGatewayIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/webhooks/paypal").contentType(MediaType.APPLICATION_JSON).content(EVENT))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("UNSUPPORTED_GATEWAY"));

        verify(ingestionService, never()).receive(any(), any());
    }

    @Test
    void formWebhookPassesParams() throws Exception {
        when(ingestionService.receive(eq(GatewayCode.REGIONAL_HASH_A), any()))
                .thenReturn(receipt(WebhookDisposition.PROCESSED, true));

        mockMvc.perform(post("/api/v1/webhooks/regional-hash-a")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("txnid", "RHA_1_ABC")
                        .param("status", "success"))
                .andExpect(status().isOk());

        ArgumentCaptor<InboundCallback> captor = ArgumentCaptor.forClass(InboundCallback.class);
        verify(ingestionService).receive(eq(GatewayCode.REGIONAL_HASH_A), captor.capture());
        assertThat(captor.getValue().getParams()).containsEntry("txnid", "RHA_1_ABC").containsEntry("status", "success");
    }

    @Test
    void browserReturnRedirectsToCheckoutSuccessUrl() throws Exception {
        when(ingestionService.receive(eq(GatewayCode.REGIONAL_HASH_A), any())).thenReturn(WebhookReceipt.builder()
                .gatewayCode(GatewayCode.REGIONAL_HASH_A)
                .eventId("RHA_1_ABC_success")
                .transactionId("RHA_1_ABC")
                .outcome(CallbackOutcome.SUCCEEDED)
                .verified(true)
                .disposition(WebhookDisposition.DUPLICATE)
                .build());
        when(ledger.find("RHA_1_ABC")).thenReturn(Optional.of(transaction()));

        mockMvc.perform(post("/api/v1/payments/return/regional-hash-a")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("txnid", "RHA_1_ABC")
                        .param("status", "success"))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl("https://shop.test/ok?transactionId=RHA_1_ABC&status=success"));
    }

    @Test
    void failedBrowserReturnRedirectsToCancelUrl() throws Exception {
        when(ingestionService.receive(eq(GatewayCode.REGIONAL_HASH_A), any())).thenReturn(WebhookReceipt.builder()
                .gatewayCode(GatewayCode.REGIONAL_HASH_A)
                .transactionId("RHA_1_ABC")
                .outcome(CallbackOutcome.FAILED)
                .verified(true)
                .disposition(WebhookDisposition.PROCESSED)
                .build());
        when(ledger.find("RHA_1_ABC")).thenReturn(Optional.of(transaction()));

        mockMvc.perform(post("/api/v1/payments/return/regional-hash-a")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("txnid", "RHA_1_ABC")
                        .param("status", "failure"))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl("https://shop.test/cancel?transactionId=RHA_1_ABC&status=failure"));
    }

    @Test
    void unverifiedSuccessReturnIsPendingOnDefaultPage() throws Exception {
        when(ingestionService.receive(eq(GatewayCode.REGIONAL_HASH_A), any())).thenReturn(WebhookReceipt.builder()
                .gatewayCode(GatewayCode.REGIONAL_HASH_A)
                .transactionId("RHA_unknown")
                .outcome(CallbackOutcome.SUCCEEDED)
                .verified(false)
                .disposition(WebhookDisposition.UNVERIFIED)
                .build());
        when(ledger.find("RHA_unknown")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/payments/return/regional-hash-a")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("txnid", "RHA_unknown")
                        .param("status", "success"))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl("https://shop.test/payment/success?status=pending"));
    }

    private static WebhookReceipt receipt(WebhookDisposition disposition, boolean verified) {
        return WebhookReceipt.builder()
                .gatewayCode(GatewayCode.CARD)
                .eventId("evt_1")
                .transactionId("CRD_1_ABC")
                .outcome(CallbackOutcome.SUCCEEDED)
                .verified(verified)
                .disposition(disposition)
                .build();
    }

    private static PaymentTransactionEntity transaction() {
        PaymentTransactionEntity entity = PaymentTransactionEntity.builder()
                .transactionId("RHA_1_ABC")
                .gatewayCode(GatewayCode.REGIONAL_HASH_A)
                .quoteIds(List.of("Q1"))
                .build();
        entity.mergeMetadata(Map.of(
                PaymentTransactionEntity.META_SUCCESS_URL, "https://shop.test/ok",
                PaymentTransactionEntity.META_CANCEL_URL, "https://shop.test/cancel"));
        return entity;
    }
}
