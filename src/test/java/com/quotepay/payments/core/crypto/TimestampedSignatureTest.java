package com.quotepay.payments.core.crypto;

import com.quotepay.payments.api.SignatureVerificationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimestampedSignatureTest {

	private static final String SECRET = "whsec_test";
	private static final String BODY = "{\"id\":\"evt_1\"}";
	private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
	private static final Duration TOLERANCE = Duration.ofMinutes(5);

	@Test
	void acceptsFreshSignature() {
		String header = TimestampedSignature.header(SECRET, NOW.getEpochSecond() - 30, BODY);

		assertThatCode(() -> TimestampedSignature.verify(header, SECRET, BODY, NOW, TOLERANCE))
				.doesNotThrowAnyException();
	}

	@Test
	void acceptsAnyMatchingV1AmongSeveral() {
		long t = NOW.getEpochSecond();
		String valid = TimestampedSignature.header(SECRET, t, BODY);
		String header = "t=" + t + ",v1=deadbeef," + valid.substring(valid.indexOf("v1="));

		assertThatCode(() -> TimestampedSignature.verify(header, SECRET, BODY, NOW, TOLERANCE))
				.doesNotThrowAnyException();
	}

	@Test
	void rejectsStaleTimestamp() {
		String header = TimestampedSignature.header(SECRET, NOW.getEpochSecond() - 301, BODY);

		assertThatThrownBy(() -> TimestampedSignature.verify(header, SECRET, BODY, NOW, TOLERANCE))
				.isInstanceOf(SignatureVerificationException.class)
				.hasMessageContaining("tolerance");
	}

	@Test
	void rejectsTamperedBody() {
		String header = TimestampedSignature.header(SECRET, NOW.getEpochSecond(), BODY);

		assertThatThrownBy(() -> TimestampedSignature.verify(header, SECRET, "{\"id\":\"evt_2\"}", NOW, TOLERANCE))
				.isInstanceOf(SignatureVerificationException.class)
				.hasMessage("Signature mismatch");
	}

	@Test
	void rejectsMissingOrMalformedHeader() {
		assertThatThrownBy(() -> TimestampedSignature.verify(null, SECRET, BODY, NOW, TOLERANCE))
				.isInstanceOf(SignatureVerificationException.class);
		assertThatThrownBy(() -> TimestampedSignature.verify("v1=abc", SECRET, BODY, NOW, TOLERANCE))
				.isInstanceOf(SignatureVerificationException.class)
				.hasMessage("Signature header malformed");
		assertThatThrownBy(() -> TimestampedSignature.verify("t=soon,v1=abc", SECRET, BODY, NOW, TOLERANCE))
				.isInstanceOf(SignatureVerificationException.class);
	}
}
