package com.quotepay.payments.integration;

import java.util.Optional;

/**
 * Resolves a bearer access token to a user id; empty when the token is not valid.
 */
public interface AccessTokenVerifier {

    Optional<String> resolveUserId(String accessToken);
}
