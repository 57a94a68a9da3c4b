package com.quotepay.payments.domain;

import jakarta.validation.constraints.Email;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Payer contact details. Supplied by checkout or taken from the quote.
 */
@Value
@Builder
@Jacksonized
public class CustomerInfo {

    String name;

    @Email
    String email;

    String phone;

    /** First word of the name, or {@code fallback} when no name is known. */
    public String firstNameOr(String fallback) {
        if (name == null || name.isBlank()) {
            return fallback;
        }
        return name.trim().split("\\s+")[0];
    }
}
