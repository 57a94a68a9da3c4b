package com.quotepay.payments.api;

import com.quotepay.payments.core.PaymentOrchestrator;
import com.quotepay.payments.domain.PaymentCreationOutcome;
import com.quotepay.payments.domain.PaymentCreationRequest;
import com.quotepay.payments.ledger.TransactionLedger;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API for creating payments and reading ledger state.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Create payments for quotes and query payment attempts")
public class PaymentController {

    static final String GUEST_SESSION_HEADER = "X-Guest-Session-Token";
    private static final String BEARER_PREFIX = "Bearer ";
    private static final int MAX_PAGE_SIZE = 100;

    private final PaymentOrchestrator orchestrator;
    private final TransactionLedger ledger;

    @PostMapping("/create")
    @Operation(
            summary = "Create payment",
            description = "Creates a payment for one or more quotes through the chosen gateway. Authenticate with a bearer "
                    + "token, or with a guest session token (header " + GUEST_SESSION_HEADER + " or body field) for exactly "
                    + "the quote the session is bound to. The response carries a form to post (hash gateways), a client "
                    + "secret (card) or a redirect URL (hosted wallet). On gateway failure returns 200 with success=false "
                    + "and a generic error; the attempt stays in the ledger as failed or orphaned.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment created, or gateway failure with success=false.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PaymentCreationResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed. Body: { \"error\": \"VALIDATION_FAILED\"|\"INVALID_CURRENCY\"|\"UNSUPPORTED_GATEWAY\"|\"AMOUNT_TOO_SMALL\", ... }"),
            @ApiResponse(responseCode = "401", description = "No valid bearer token or guest session."),
            @ApiResponse(responseCode = "403", description = "Quotes not owned by the caller, or outside the guest session binding."),
            @ApiResponse(responseCode = "404", description = "Quotes not found."),
            @ApiResponse(responseCode = "409", description = "A quote is not in a payable status (e.g. already paid)."),
            @ApiResponse(responseCode = "429", description = "Too many payment attempts for this gateway."),
            @ApiResponse(responseCode = "500", description = "Gateway not configured or ledger unavailable.")
    })
    public ResponseEntity<PaymentCreationResponseDto> create(
            @Valid @RequestBody CreatePaymentRequestDto dto,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestHeader(value = GUEST_SESSION_HEADER, required = false) String guestSessionHeader,
            HttpServletRequest httpRequest) {
        String guestToken = guestSessionHeader != null && !guestSessionHeader.isBlank()
                ? guestSessionHeader
                : dto.getGuestSessionToken();
        PaymentCreationRequest request = PaymentCreationRequest.builder()
                .quoteIds(dto.getQuoteIds())
                .gateway(dto.getGateway())
                .successUrl(dto.getSuccessUrl())
                .cancelUrl(dto.getCancelUrl())
                .amount(dto.getAmount())
                .currency(dto.getCurrency())
                .customerInfo(dto.getCustomerInfo())
                .metadata(dto.getMetadata())
                .bearerToken(bearerToken(authorization))
                .guestSessionToken(guestToken)
                .clientIp(httpRequest != null ? getClientIp(httpRequest) : null)
                .build();

        PaymentCreationOutcome outcome = orchestrator.createPayment(request);
        log.debug("Payment creation finished: transactionId={}, success={}, paymentState={}",
                outcome.getTransactionId(), outcome.isSuccess(), outcome.getPaymentState());
        return ResponseEntity.ok(PaymentCreationResponseDto.from(outcome));
    }

    @GetMapping("/{transactionId}")
    @Operation(summary = "Get payment attempt", description = "Ledger state of one attempt: business status, payment state, gateway reference and compensation step.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = TransactionStatusDto.class))),
            @ApiResponse(responseCode = "404", description = "No attempt with this transaction id.")
    })
    public ResponseEntity<TransactionStatusDto> get(@PathVariable String transactionId) {
        return ledger.find(transactionId)
                .map(TransactionStatusDto::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new PaymentException(ErrorKind.TRANSACTION_NOT_FOUND,
                        "Payment not found: " + transactionId));
    }

    @GetMapping("/orphaned")
    @Operation(summary = "List orphaned attempts", description = "Attempts whose gateway side may have succeeded without local bookkeeping, newest first. For manual reconciliation.")
    public ResponseEntity<List<TransactionStatusDto>> orphaned(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE));
        List<TransactionStatusDto> body = ledger.findOrphaned(pageable).getContent().stream()
                .map(TransactionStatusDto::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(body);
    }

    private static String bearerToken(String authorization) {
        if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private static String getClientIp(HttpServletRequest request) {
        String xff = request.getHeader("X-Forwarded-For");
        if (xff != null && !xff.isBlank()) {
            return xff.split(",")[0].trim();
        }
        String xri = request.getHeader("X-Real-IP");
        if (xri != null && !xri.isBlank()) return xri.trim();
        return request.getRemoteAddr();
    }
}
