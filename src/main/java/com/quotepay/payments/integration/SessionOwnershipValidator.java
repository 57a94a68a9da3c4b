package com.quotepay.payments.integration;

import com.quotepay.payments.domain.AuthorizationVerdict;

import java.util.List;

/**
 * Decides who is paying from the caller's credentials. Ownership of the
 * individual quotes is checked by the orchestrator against the verdict.
 */
public interface SessionOwnershipValidator {

    AuthorizationVerdict validate(String bearerToken, String guestSessionToken, List<String> quoteIds);
}
