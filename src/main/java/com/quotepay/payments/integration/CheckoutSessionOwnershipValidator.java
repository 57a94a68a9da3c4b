package com.quotepay.payments.integration;

import com.quotepay.payments.compliance.PiiMasker;
import com.quotepay.payments.domain.AuthorizationVerdict;
import com.quotepay.payments.domain.GuestSessionStatus;
import com.quotepay.payments.persistence.entity.GuestCheckoutSessionEntity;
import com.quotepay.payments.persistence.repository.GuestCheckoutSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Bearer token first; a guest session token is only consulted when no
 * valid bearer token was presented.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CheckoutSessionOwnershipValidator implements SessionOwnershipValidator {

    private final AccessTokenVerifier accessTokenVerifier;
    private final GuestCheckoutSessionRepository guestSessionRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public AuthorizationVerdict validate(String bearerToken, String guestSessionToken, List<String> quoteIds) {
        if (hasText(bearerToken)) {
            Optional<String> userId = accessTokenVerifier.resolveUserId(bearerToken);
            if (userId.isPresent()) {
                return AuthorizationVerdict.authenticated(userId.get());
            }
            if (!hasText(guestSessionToken)) {
                return AuthorizationVerdict.rejected("invalid_bearer_token");
            }
        }
        if (hasText(guestSessionToken)) {
            return validateGuest(guestSessionToken);
        }
        return AuthorizationVerdict.rejected("missing_credentials");
    }

    private AuthorizationVerdict validateGuest(String token) {
        Optional<GuestCheckoutSessionEntity> session = guestSessionRepository.findById(token);
        if (session.isEmpty()) {
            log.info("Unknown guest session: token={}", PiiMasker.maskToken(token));
            return AuthorizationVerdict.rejected("unknown_guest_session");
        }
        GuestCheckoutSessionEntity s = session.get();
        if (s.getStatus() != GuestSessionStatus.ACTIVE) {
            return AuthorizationVerdict.rejected("guest_session_" + s.getStatus().name().toLowerCase());
        }
        if (s.getExpiresAt().isBefore(clock.instant())) {
            return AuthorizationVerdict.rejected("guest_session_expired");
        }
        return AuthorizationVerdict.guest(token, s.getQuoteId());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
