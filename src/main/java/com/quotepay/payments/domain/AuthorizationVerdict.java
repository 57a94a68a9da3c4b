package com.quotepay.payments.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Who is paying: an authenticated user, a guest session bound to a single
 * quote, or nobody we accept.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuthorizationVerdict {

    public enum Kind {
        AUTHENTICATED_USER,
        GUEST_SESSION,
        REJECTED
    }

    Kind kind;
    String userId;
    String guestSessionToken;
    String boundQuoteId;
    String reason;

    public static AuthorizationVerdict authenticated(String userId) {
        return new AuthorizationVerdict(Kind.AUTHENTICATED_USER, userId, null, null, null);
    }

    public static AuthorizationVerdict guest(String guestSessionToken, String boundQuoteId) {
        return new AuthorizationVerdict(Kind.GUEST_SESSION, null, guestSessionToken, boundQuoteId, null);
    }

    public static AuthorizationVerdict rejected(String reason) {
        return new AuthorizationVerdict(Kind.REJECTED, null, null, null, reason);
    }

    public boolean isRejected() {
        return kind == Kind.REJECTED;
    }

    public boolean isGuest() {
        return kind == Kind.GUEST_SESSION;
    }

    /** Identity the rate limiter counts against. */
    public String callerKey() {
        return kind == Kind.AUTHENTICATED_USER ? "user:" + userId : "guest:" + guestSessionToken;
    }
}
