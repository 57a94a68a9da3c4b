package com.quotepay.payments.api;

import com.quotepay.payments.domain.CustomerInfo;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Request body for creating a payment for one or more quotes.
 */
@Data
public class CreatePaymentRequestDto {

    @NotEmpty(message = "quoteIds is required")
    @Size(max = 50)
    private List<@NotBlank String> quoteIds;

    /** Gateway code, e.g. {@code card}, {@code regional-hash-a}, {@code bank-transfer}. */
    @NotBlank(message = "gateway is required")
    private String gateway;

    private String successUrl;
    private String cancelUrl;

    /** Optional; must equal the quote total when given. */
    @DecimalMin(value = "0.01")
    private BigDecimal amount;

    @Size(min = 3, max = 3)
    private String currency;

    @Valid
    private CustomerInfo customerInfo;

    private Map<String, String> metadata;

    /** Alternative to the {@code X-Guest-Session-Token} header. */
    private String guestSessionToken;
}
