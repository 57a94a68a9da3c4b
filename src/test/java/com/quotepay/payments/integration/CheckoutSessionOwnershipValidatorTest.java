package com.quotepay.payments.integration;

import com.quotepay.payments.domain.AuthorizationVerdict;
import com.quotepay.payments.domain.GuestSessionStatus;
import com.quotepay.payments.persistence.entity.GuestCheckoutSessionEntity;
import com.quotepay.payments.persistence.repository.GuestCheckoutSessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CheckoutSessionOwnershipValidatorTest {

	private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

	@Mock
	private AccessTokenVerifier accessTokenVerifier;
	@Mock
	private GuestCheckoutSessionRepository guestSessionRepository;

	private CheckoutSessionOwnershipValidator validator;

	@BeforeEach
	void setUp() {
		validator = new CheckoutSessionOwnershipValidator(accessTokenVerifier, guestSessionRepository,
				Clock.fixed(NOW, ZoneOffset.UTC));
	}

	@Test
	void validBearerTokenWinsOverGuestToken() {
		when(accessTokenVerifier.resolveUserId("jwt")).thenReturn(Optional.of("user-1"));

		AuthorizationVerdict verdict = validator.validate("jwt", "guest-1", List.of("Q1"));

		assertThat(verdict.getKind()).isEqualTo(AuthorizationVerdict.Kind.AUTHENTICATED_USER);
		assertThat(verdict.getUserId()).isEqualTo("user-1");
		verify(guestSessionRepository, never()).findById(any());
	}

	@Test
	void invalidBearerWithoutGuestTokenIsRejected() {
		when(accessTokenVerifier.resolveUserId("expired-jwt")).thenReturn(Optional.empty());

		AuthorizationVerdict verdict = validator.validate("expired-jwt", null, List.of("Q1"));

		assertThat(verdict.isRejected()).isTrue();
		assertThat(verdict.getReason()).isEqualTo("invalid_bearer_token");
	}

	@Test
	void invalidBearerFallsBackToGuestSession() {
		when(accessTokenVerifier.resolveUserId("expired-jwt")).thenReturn(Optional.empty());
		when(guestSessionRepository.findById("guest-1")).thenReturn(Optional.of(session(GuestSessionStatus.ACTIVE, NOW.plusSeconds(600))));

		AuthorizationVerdict verdict = validator.validate("expired-jwt", "guest-1", List.of("Q1"));

		assertThat(verdict.isGuest()).isTrue();
		assertThat(verdict.getBoundQuoteId()).isEqualTo("Q1");
		assertThat(verdict.callerKey()).isEqualTo("guest:guest-1");
	}

	@Test
	void unknownGuestSessionIsRejected() {
		when(guestSessionRepository.findById("guest-x")).thenReturn(Optional.empty());

		assertThat(validator.validate(null, "guest-x", List.of("Q1")).getReason()).isEqualTo("unknown_guest_session");
	}

	@Test
	void completedGuestSessionIsRejected() {
		when(guestSessionRepository.findById("guest-1")).thenReturn(Optional.of(session(GuestSessionStatus.COMPLETED, NOW.plusSeconds(600))));

		assertThat(validator.validate(null, "guest-1", List.of("Q1")).getReason()).isEqualTo("guest_session_completed");
	}

	@Test
	void expiredGuestSessionIsRejected() {
		when(guestSessionRepository.findById("guest-1")).thenReturn(Optional.of(session(GuestSessionStatus.ACTIVE, NOW.minusSeconds(1))));

		assertThat(validator.validate(null, "guest-1", List.of("Q1")).getReason()).isEqualTo("guest_session_expired");
	}

	@Test
	void noCredentialsIsRejected() {
		AuthorizationVerdict verdict = validator.validate(" ", "", List.of("Q1"));

		assertThat(verdict.getReason()).isEqualTo("missing_credentials");
		verify(accessTokenVerifier, never()).resolveUserId(any());
	}

	private static GuestCheckoutSessionEntity session(GuestSessionStatus status, Instant expiresAt) {
		return GuestCheckoutSessionEntity.builder()
				.sessionToken("guest-1")
				.quoteId("Q1")
				.status(status)
				.expiresAt(expiresAt)
				.build();
	}
}
