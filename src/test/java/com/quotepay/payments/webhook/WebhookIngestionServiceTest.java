package com.quotepay.payments.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quotepay.payments.api.ErrorKind;
import com.quotepay.payments.api.PaymentValidationException;
import com.quotepay.payments.api.SignatureVerificationException;
import com.quotepay.payments.compliance.PaymentAuditLogger;
import com.quotepay.payments.config.PaymentGatewayProperties.GatewaySettings;
import com.quotepay.payments.core.crypto.TimestampedSignature;
import com.quotepay.payments.domain.CallbackOutcome;
import com.quotepay.payments.domain.CallbackResult;
import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.domain.PaymentState;
import com.quotepay.payments.integration.GatewayConfigurationStore;
import com.quotepay.payments.integration.QuoteStore;
import com.quotepay.payments.ledger.CallbackApplication;
import com.quotepay.payments.ledger.TransactionLedger;
import com.quotepay.payments.persistence.entity.PaymentTransactionEntity;
import com.quotepay.payments.persistence.entity.WebhookEventEntity;
import com.quotepay.payments.persistence.repository.WebhookEventRepository;
import com.quotepay.payments.persistence.service.WebhookEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebhookIngestionServiceTest {

	private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

	@Mock
	private GatewayCallbackHandler cardHandler;
	@Mock
	private GatewayConfigurationStore configurationStore;
	@Mock
	private WebhookEventStore eventStore;
	@Mock
	private WebhookReconciler reconciler;
	@Mock
	private PaymentAuditLogger auditLogger;
	@Mock
	private WebhookEventRepository eventRepository;
	@Mock
	private TransactionLedger ledger;
	@Mock
	private QuoteStore quoteStore;

	private WebhookIngestionService service;
	private GatewaySettings settings;
	private InboundCallback callback;
	private CallbackResult parsed;

	@BeforeEach
	void setUp() {
		lenient().when(cardHandler.getGatewayCode()).thenReturn(GatewayCode.CARD);
		service = new WebhookIngestionService(List.of(cardHandler), configurationStore, eventStore, reconciler,
				auditLogger, Clock.fixed(NOW, ZoneOffset.UTC));
		service.init();

		settings = new GatewaySettings();
		settings.setWebhookSecret("whsec_test");
		callback = InboundCallback.builder().rawBody("{\"id\":\"evt_1\"}").build();
		parsed = CallbackResult.builder()
				.gatewayCode(GatewayCode.CARD)
				.eventId("evt_1")
				.eventType("payment_intent.succeeded")
				.outcome(CallbackOutcome.SUCCEEDED)
				.transactionId("CRD_1_ABC")
				.quoteIds(List.of("Q1"))
				.build();
		lenient().when(cardHandler.parse(callback)).thenReturn(parsed);
		lenient().when(configurationStore.findSettings(GatewayCode.CARD)).thenReturn(Optional.of(settings));
	}

	@Test
	void verifiedCallbackIsRecordedThenReconciled() {
		when(eventStore.register(eq(parsed), anyString(), eq("{\"id\":\"evt_1\"}"), eq(true), isNull()))
				.thenReturn(new WebhookEventStore.Registration(7L, false, false));
		when(reconciler.reconcile(7L, parsed)).thenReturn(WebhookDisposition.PROCESSED);

		WebhookReceipt receipt = service.receive(GatewayCode.CARD, callback);

		assertThat(receipt.getDisposition()).isEqualTo(WebhookDisposition.PROCESSED);
		assertThat(receipt.isVerified()).isTrue();
		assertThat(receipt.getEventId()).isEqualTo("evt_1");
		verify(cardHandler).verify(callback, settings, NOW);
		verify(auditLogger).logCallback(parsed, true, "PROCESSED");
	}

	@Test
	void badSignatureIsRecordedButNeverApplied() {
		doThrow(new SignatureVerificationException("Signature mismatch"))
				.when(cardHandler).verify(callback, settings, NOW);
		when(eventStore.register(eq(parsed), anyString(), anyString(), eq(false), eq("Signature mismatch")))
				.thenReturn(new WebhookEventStore.Registration(8L, false, false));

		WebhookReceipt receipt = service.receive(GatewayCode.CARD, callback);

		assertThat(receipt.getDisposition()).isEqualTo(WebhookDisposition.UNVERIFIED);
		assertThat(receipt.isVerified()).isFalse();
		verify(reconciler, never()).reconcile(any(), any());
	}

	@Test
	void unconfiguredGatewayCannotVerify() {
		when(configurationStore.findSettings(GatewayCode.CARD)).thenReturn(Optional.empty());
		when(eventStore.register(eq(parsed), anyString(), anyString(), eq(false),
				eq(WebhookIngestionService.ERROR_NOT_CONFIGURED)))
				.thenReturn(new WebhookEventStore.Registration(9L, false, false));

		WebhookReceipt receipt = service.receive(GatewayCode.CARD, callback);

		assertThat(receipt.getDisposition()).isEqualTo(WebhookDisposition.UNVERIFIED);
		verify(cardHandler, never()).verify(any(), any(), any());
		verify(reconciler, never()).reconcile(any(), any());
	}

	@Test
	void redeliveryOfProcessedEventIsDuplicate() {
		when(eventStore.register(eq(parsed), anyString(), anyString(), anyBoolean(), any()))
				.thenReturn(new WebhookEventStore.Registration(7L, true, false));

		WebhookReceipt receipt = service.receive(GatewayCode.CARD, callback);

		assertThat(receipt.getDisposition()).isEqualTo(WebhookDisposition.DUPLICATE);
		verify(reconciler, never()).reconcile(any(), any());
	}

	@Test
	void concurrentDeliveryIsDuplicate() {
		when(eventStore.register(eq(parsed), anyString(), anyString(), anyBoolean(), any()))
				.thenReturn(new WebhookEventStore.Registration(null, false, true));

		assertThat(service.receive(GatewayCode.CARD, callback).getDisposition())
				.isEqualTo(WebhookDisposition.DUPLICATE);
		verify(reconciler, never()).reconcile(any(), any());
	}

	@Test
	void processingFailureLeavesEventOpen() {
		when(eventStore.register(eq(parsed), anyString(), anyString(), eq(true), isNull()))
				.thenReturn(new WebhookEventStore.Registration(7L, false, false));
		when(reconciler.reconcile(7L, parsed)).thenThrow(new IllegalStateException("database unavailable"));

		WebhookReceipt receipt = service.receive(GatewayCode.CARD, callback);

		assertThat(receipt.getDisposition()).isEqualTo(WebhookDisposition.DEFERRED);
		verify(eventStore).recordProcessingFailure(7L, "database unavailable");
	}

	@Test
	void unparseablePayloadIsRecordedAndClosed() {
		InboundCallback garbage = InboundCallback.builder().rawBody("not json").build();
		when(cardHandler.parse(garbage)).thenThrow(new CallbackParseException("Callback body is not JSON"));

		WebhookReceipt receipt = service.receive(GatewayCode.CARD, garbage);

		assertThat(receipt.getDisposition()).isEqualTo(WebhookDisposition.PROCESSED_WITH_ERROR);
		verify(eventStore).registerUnparseable(eq(GatewayCode.CARD), anyString(), eq("not json"),
				eq("Callback body is not JSON"));
		verify(eventStore, never()).register(any(), any(), any(), anyBoolean(), any());
	}

	@Test
	void forgedCardEventIsStoredUnverifiedAndLeavesLedgerAlone() {
		WebhookIngestionService wired = wiredService();
		String body = cardEvent("evt_forged", "payment_intent.succeeded");
		InboundCallback forged = InboundCallback.builder()
				.rawBody(body)
				.header("Stripe-Signature", "t=1772359200,v1=" + "0".repeat(64))
				.build();
		when(eventRepository.saveAndFlush(any(WebhookEventEntity.class))).thenAnswer(inv -> {
			WebhookEventEntity entity = inv.getArgument(0);
			entity.setId(21L);
			return entity;
		});

		WebhookReceipt receipt = wired.receive(GatewayCode.CARD, forged);

		assertThat(receipt.getDisposition()).isEqualTo(WebhookDisposition.UNVERIFIED);
		assertThat(receipt.isVerified()).isFalse();
		ArgumentCaptor<WebhookEventEntity> stored = ArgumentCaptor.forClass(WebhookEventEntity.class);
		verify(eventRepository).saveAndFlush(stored.capture());
		assertThat(stored.getValue().isVerified()).isFalse();
		assertThat(stored.getValue().getVerificationError()).isEqualTo("Signature mismatch");
		assertThat(stored.getValue().getEventId()).isEqualTo("evt_forged");
		assertThat(stored.getValue().getProcessedAt()).isNull();
		verify(ledger, never()).completeFromCallback(any(), any(), any());
		verify(ledger, never()).failFromCallback(any(), any(), any());
		verify(quoteStore, never()).markPaid(any(), any(), any());
	}

	@Test
	void signedCardEventReachesLedgerThroughFullPath() {
		WebhookIngestionService wired = wiredService();
		String body = cardEvent("evt_good", "payment_intent.succeeded");
		InboundCallback signed = InboundCallback.builder()
				.rawBody(body)
				.header("Stripe-Signature", TimestampedSignature.header("whsec_test", NOW.getEpochSecond(), body))
				.build();
		AtomicReference<WebhookEventEntity> stored = new AtomicReference<>();
		when(eventRepository.saveAndFlush(any(WebhookEventEntity.class))).thenAnswer(inv -> {
			WebhookEventEntity entity = inv.getArgument(0);
			entity.setId(22L);
			stored.set(entity);
			return entity;
		});
		when(eventRepository.findForUpdate(22L)).thenAnswer(inv -> Optional.ofNullable(stored.get()));
		when(ledger.find("CRD_1700000000000_ABCDEF")).thenReturn(Optional.of(PaymentTransactionEntity.builder()
				.transactionId("CRD_1700000000000_ABCDEF")
				.gatewayCode(GatewayCode.CARD)
				.quoteIds(List.of("Q1"))
				.paymentState(PaymentState.DB_RECORDED)
				.build()));
		when(ledger.completeFromCallback("CRD_1700000000000_ABCDEF", "pi_123", "evt_good"))
				.thenReturn(CallbackApplication.APPLIED);
		when(quoteStore.markPaid(List.of("Q1"), "CRD_1700000000000_ABCDEF", GatewayCode.CARD)).thenReturn(1);

		WebhookReceipt receipt = wired.receive(GatewayCode.CARD, signed);

		assertThat(receipt.getDisposition()).isEqualTo(WebhookDisposition.PROCESSED);
		assertThat(stored.get().isVerified()).isTrue();
		assertThat(stored.get().getProcessedAt()).isEqualTo(NOW);
		assertThat(stored.get().getTransactionId()).isEqualTo("CRD_1700000000000_ABCDEF");
	}

	private WebhookIngestionService wiredService() {
		Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
		WebhookIngestionService wired = new WebhookIngestionService(
				List.of(new CardCallbackHandler(new ObjectMapper())),
				configurationStore,
				new WebhookEventStore(eventRepository, clock),
				new WebhookReconciler(eventRepository, ledger, quoteStore, clock),
				auditLogger,
				clock);
		wired.init();
		return wired;
	}

	private static String cardEvent(String eventId, String type) {
		return "{\"id\":\"" + eventId + "\",\"type\":\"" + type + "\",\"data\":{\"object\":{"
				+ "\"id\":\"pi_123\",\"status\":\"succeeded\",\"amount\":1282,\"currency\":\"usd\","
				+ "\"metadata\":{\"transaction_id\":\"CRD_1700000000000_ABCDEF\",\"order_reference\":\"Order_Q1\"}}}}";
	}

	@Test
	void manualGatewayHasNoCallbacks() {
		assertThatThrownBy(() -> service.receive(GatewayCode.BANK_TRANSFER, callback))
				.isInstanceOf(PaymentValidationException.class)
				.hasFieldOrPropertyWithValue("kind", ErrorKind.UNSUPPORTED_GATEWAY);
	}
}
