package com.quotepay.payments.core;

import com.quotepay.payments.api.ErrorKind;
import com.quotepay.payments.api.GatewayException;
import com.quotepay.payments.api.PaymentAuthorizationException;
import com.quotepay.payments.api.PaymentException;
import com.quotepay.payments.api.PaymentValidationException;
import com.quotepay.payments.compliance.PaymentAuditLogger;
import com.quotepay.payments.core.currency.CurrencyNormalizer;
import com.quotepay.payments.domain.AuthorizationVerdict;
import com.quotepay.payments.domain.CompensationStep;
import com.quotepay.payments.domain.CustomerInfo;
import com.quotepay.payments.domain.ErrorContext;
import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.domain.NormalizedPaymentRequest;
import com.quotepay.payments.domain.PaymentCreationOutcome;
import com.quotepay.payments.domain.PaymentCreationRequest;
import com.quotepay.payments.domain.PaymentCreationResult;
import com.quotepay.payments.domain.PaymentState;
import com.quotepay.payments.domain.QuoteSnapshot;
import com.quotepay.payments.domain.gateway.GatewayRequest;
import com.quotepay.payments.integration.QuoteStore;
import com.quotepay.payments.integration.SessionOwnershipValidator;
import com.quotepay.payments.ledger.TransactionLedger;
import com.quotepay.payments.persistence.entity.PaymentTransactionEntity;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point for creating a payment. Validates and authorizes the request,
 * resolves the amount from the quotes, then drives the ledger around the
 * adapter call:
 * <ol>
 *   <li>prepare (no side effects; errors leave no row)</li>
 *   <li>open the ledger row in {@code pending}</li>
 *   <li>submit through the adapter's circuit breaker</li>
 *   <li>{@code external_created}, then {@code db_recorded}</li>
 * </ol>
 * Failures after the row exists are classified into {@code failed} or
 * {@code orphaned} and answered with a generic message. Charge creation is
 * never retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentOrchestrator {

    public static final String GENERIC_FAILURE_MESSAGE =
            "Payment could not be created. Please try again or choose another payment method.";
    static final String DEFAULT_CURRENCY = "USD";

    private final List<GatewayAdapter> adapters;
    private final SessionOwnershipValidator sessionValidator;
    private final QuoteStore quoteStore;
    private final CurrencyNormalizer currencyNormalizer;
    private final TransactionLedger ledger;
    private final TransactionIdGenerator transactionIdGenerator;
    private final GatewayRateLimiter rateLimiter;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final PaymentAuditLogger auditLogger;

    private Map<GatewayCode, GatewayAdapter> adapterByCode;

    @jakarta.annotation.PostConstruct
    void init() {
        adapterByCode = new EnumMap<>(GatewayCode.class);
        for (GatewayAdapter adapter : adapters) {
            GatewayAdapter previous = adapterByCode.putIfAbsent(adapter.getGatewayCode(), adapter);
            if (previous != null) {
                log.warn("Duplicate adapter for gateway {}: keeping {}, ignoring {}",
                        adapter.getGatewayCode(), previous.getAdapterName(), adapter.getAdapterName());
            }
        }
        log.info("Registered gateway adapters: {}", adapterByCode.keySet());
    }

    public PaymentCreationOutcome createPayment(PaymentCreationRequest request) {
        List<String> quoteIds = validateQuoteIds(request.getQuoteIds());
        GatewayCode gatewayCode = GatewayCode.fromCode(request.getGateway())
                .orElseThrow(() -> new PaymentValidationException(ErrorKind.UNSUPPORTED_GATEWAY,
                        "Unsupported gateway: " + request.getGateway()));
        GatewayAdapter adapter = getAdapter(gatewayCode)
                .orElseThrow(() -> new PaymentValidationException(ErrorKind.UNSUPPORTED_GATEWAY,
                        "No adapter registered for gateway: " + gatewayCode.getCode()));
        if (request.getAmount() != null && request.getAmount().signum() <= 0) {
            throw new PaymentValidationException("Amount must be positive");
        }

        AuthorizationVerdict verdict = sessionValidator.validate(
                request.getBearerToken(), request.getGuestSessionToken(), quoteIds);
        if (verdict.isRejected()) {
            log.warn("Payment creation rejected: gateway={}, reason={}", gatewayCode.getCode(), verdict.getReason());
            throw new PaymentAuthorizationException(ErrorKind.UNAUTHORIZED, "Rejected caller: " + verdict.getReason());
        }
        if (verdict.isGuest() && (quoteIds.size() != 1 || !quoteIds.get(0).equals(verdict.getBoundQuoteId()))) {
            log.warn("Guest session used for quotes outside its binding: boundQuoteId={}, requested={}",
                    verdict.getBoundQuoteId(), quoteIds);
            throw new PaymentAuthorizationException(ErrorKind.FORBIDDEN,
                    "Guest session may only pay for quote " + verdict.getBoundQuoteId());
        }

        rateLimiter.checkAllowed(gatewayCode, verdict.callerKey());
        if (request.getClientIp() != null) {
            rateLimiter.checkAllowed(gatewayCode, "ip:" + request.getClientIp());
        }

        List<QuoteSnapshot> quotes = loadOwnedQuotes(quoteIds, verdict);
        for (QuoteSnapshot quote : quotes) {
            if (quote.getStatus() == null || !quote.getStatus().acceptsPayment()) {
                throw new PaymentValidationException(ErrorKind.QUOTE_NOT_PAYABLE,
                        "Quote " + quote.getId() + " is not payable in status " + quote.getStatus());
            }
        }

        String currency = resolveCurrency(request, quotes);
        BigDecimal amount = resolveAmount(request, quotes, currency);

        NormalizedPaymentRequest normalized = NormalizedPaymentRequest.builder()
                .transactionId(transactionIdGenerator.next(gatewayCode))
                .gatewayCode(gatewayCode)
                .quoteIds(quoteIds)
                .amount(amount)
                .currency(currency)
                .amountMinor(currencyNormalizer.toMinorUnits(amount, currency))
                .customer(resolveCustomer(request.getCustomerInfo(), quotes.get(0)))
                .description(describe(quotes))
                .successUrl(request.getSuccessUrl())
                .cancelUrl(request.getCancelUrl())
                .userId(verdict.getUserId())
                .guestSessionToken(verdict.getGuestSessionToken())
                .metadata(request.getMetadata() == null ? Map.of() : request.getMetadata())
                .build();

        PaymentCreationOutcome outcome = execute(adapter, normalized);
        auditLogger.logOutcome(outcome);
        return outcome;
    }

    public Optional<GatewayAdapter> getAdapter(GatewayCode gatewayCode) {
        return Optional.ofNullable(adapterByCode.get(gatewayCode));
    }

    private PaymentCreationOutcome execute(GatewayAdapter adapter, NormalizedPaymentRequest request) {
        String transactionId = request.getTransactionId();
        GatewayRequest gatewayRequest = adapter.prepare(request);
        ledger.open(request, gatewayRequest);
        auditLogger.logRequest(request);

        if (!adapter.hasGatewayLeg()) {
            try {
                PaymentTransactionEntity recorded = ledger.recordWithoutGatewayLeg(transactionId);
                return success(request, gatewayRequest, PaymentCreationResult.builder().success(true).build(),
                        recorded.getPaymentState(), false);
            } catch (RuntimeException e) {
                log.error("Recording manual payment failed: transactionId={}", transactionId, e);
                return failure(request, markFailed(transactionId, ErrorContext.UNKNOWN_ERROR, e.getMessage()));
            }
        }

        PaymentCreationResult result;
        try {
            result = circuitBreakerFor(adapter).executeSupplier(() -> adapter.submit(gatewayRequest));
        } catch (CallNotPermittedException e) {
            log.warn("Circuit open, gateway not called: transactionId={}, adapter={}", transactionId, adapter.getAdapterName());
            return failure(request, markFailed(transactionId, ErrorContext.CIRCUIT_OPEN, e.getMessage()));
        } catch (GatewayException e) {
            if (e.isExternalEffectPossible()) {
                log.error("Gateway outcome unknown: transactionId={}, gateway={}, error={}",
                        transactionId, request.getGatewayCode().getCode(), e.getMessage());
                return failure(request, markOrphaned(transactionId, CompensationStep.INITIAL_INSERT,
                        ErrorContext.EXTERNAL_CALL_INDETERMINATE, null, e.getMessage()));
            }
            log.warn("Gateway rejected payment: transactionId={}, gateway={}, error={}",
                    transactionId, request.getGatewayCode().getCode(), e.getMessage());
            return failure(request, markFailed(transactionId, ErrorContext.EXTERNAL_API_ERROR, e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Unexpected error during gateway call: transactionId={}", transactionId, e);
            return failure(request, markOrphaned(transactionId, CompensationStep.INITIAL_INSERT,
                    ErrorContext.UNKNOWN_ERROR, null, e.getMessage()));
        }

        if (result == null || !result.isSuccess()) {
            String error = result == null ? "no result" : result.getError();
            log.warn("Gateway returned unsuccessful result: transactionId={}, error={}", transactionId, error);
            return failure(request, markFailed(transactionId, ErrorContext.EXTERNAL_API_ERROR, error));
        }
        String gatewayTransactionId = result.getGatewayTransactionId();
        if (gatewayTransactionId == null) {
            return failure(request, markOrphaned(transactionId, CompensationStep.INITIAL_INSERT,
                    ErrorContext.UNKNOWN_ERROR, null, "Gateway success without reference"));
        }

        try {
            ledger.markExternalCreated(transactionId, gatewayTransactionId, result.getGatewayResponse());
        } catch (RuntimeException e) {
            return afterBookkeepingFailure(request, gatewayRequest, result, CompensationStep.INITIAL_INSERT, e);
        }

        try {
            Map<String, Object> audit = new LinkedHashMap<>();
            audit.put("charged_amount", gatewayRequest.getChargedAmount().toPlainString());
            audit.put("charged_currency", gatewayRequest.getChargedCurrency());
            audit.put("adapter", adapter.getAdapterName());
            PaymentTransactionEntity recorded = ledger.markRecorded(transactionId, audit);
            return success(request, gatewayRequest, result, recorded.getPaymentState(), true);
        } catch (RuntimeException e) {
            return afterBookkeepingFailure(request, gatewayRequest, result, CompensationStep.EXTERNAL_CREATED, e);
        }
    }

    /**
     * The gateway accepted but a ledger write failed. A callback may have
     * settled the row in the meantime, so its current state decides the
     * answer; only a row nobody settled is orphaned.
     */
    private PaymentCreationOutcome afterBookkeepingFailure(NormalizedPaymentRequest request, GatewayRequest gatewayRequest,
                                                           PaymentCreationResult result, CompensationStep lastCompletedStep,
                                                           RuntimeException cause) {
        String transactionId = request.getTransactionId();
        String gatewayTransactionId = result.getGatewayTransactionId();
        PaymentState settledState = currentState(transactionId);
        if (settledState == PaymentState.FAILED) {
            log.warn("Ledger row failed by callback while gateway call was in flight: transactionId={}, "
                    + "gatewayTransactionId={}", transactionId, gatewayTransactionId);
            keepGatewayReference(transactionId, gatewayTransactionId);
            return failure(request, PaymentState.FAILED);
        }
        if (settledState == PaymentState.DB_RECORDED) {
            log.info("Ledger row recorded by callback while gateway call was in flight: transactionId={}, "
                    + "gatewayTransactionId={}", transactionId, gatewayTransactionId);
            return success(request, gatewayRequest, result, PaymentState.DB_RECORDED, true);
        }
        log.error("Bookkeeping failed after gateway success: transactionId={}, gatewayTransactionId={}",
                transactionId, gatewayTransactionId, cause);
        return failure(request, markOrphaned(transactionId, lastCompletedStep,
                ErrorContext.DATABASE_ERROR_AFTER_EXTERNAL_SUCCESS, gatewayTransactionId, cause.getMessage()));
    }

    private PaymentState currentState(String transactionId) {
        try {
            return ledger.find(transactionId).map(PaymentTransactionEntity::getPaymentState).orElse(null);
        } catch (RuntimeException e) {
            log.error("Could not re-read ledger row: transactionId={}", transactionId, e);
            return null;
        }
    }

    private void keepGatewayReference(String transactionId, String gatewayTransactionId) {
        try {
            ledger.attachGatewayReference(transactionId, gatewayTransactionId);
        } catch (RuntimeException e) {
            log.error("Could not store gateway reference, reconcile manually: transactionId={}, gatewayTransactionId={}",
                    transactionId, gatewayTransactionId, e);
        }
    }

    private CircuitBreaker circuitBreakerFor(GatewayAdapter adapter) {
        return circuitBreakerRegistry.circuitBreaker(adapter.getAdapterName(), () -> CircuitBreakerConfig
                .from(circuitBreakerRegistry.getDefaultConfig())
                .recordException(new IndeterminateGatewayFailure())
                .build());
    }

    private PaymentState markFailed(String transactionId, ErrorContext errorContext, String message) {
        try {
            return ledger.markFailed(transactionId, errorContext, message).getPaymentState();
        } catch (RuntimeException e) {
            log.error("Could not mark ledger row failed: transactionId={}, errorContext={}",
                    transactionId, errorContext.getCode(), e);
            return PaymentState.FAILED;
        }
    }

    private PaymentState markOrphaned(String transactionId, CompensationStep lastCompletedStep,
                                      ErrorContext errorContext, String gatewayTransactionId, String message) {
        try {
            return ledger.markOrphaned(transactionId, lastCompletedStep, errorContext, gatewayTransactionId, message)
                    .getPaymentState();
        } catch (RuntimeException e) {
            log.error("Could not mark ledger row orphaned, reconcile manually: transactionId={}, gatewayTransactionId={}, "
                    + "errorContext={}", transactionId, gatewayTransactionId, errorContext.getCode(), e);
            return PaymentState.ORPHANED;
        }
    }

    private static List<String> validateQuoteIds(List<String> quoteIds) {
        if (quoteIds == null || quoteIds.isEmpty()) {
            throw new PaymentValidationException("At least one quote id is required");
        }
        LinkedHashSet<String> distinct = new LinkedHashSet<>();
        for (String id : quoteIds) {
            if (id == null || id.isBlank()) {
                throw new PaymentValidationException("Quote ids must not be blank");
            }
            distinct.add(id.trim());
        }
        return new ArrayList<>(distinct);
    }

    private List<QuoteSnapshot> loadOwnedQuotes(List<String> quoteIds, AuthorizationVerdict verdict) {
        List<QuoteSnapshot> quotes = quoteStore.findAll(quoteIds);
        if (quotes.isEmpty()) {
            throw new PaymentException(ErrorKind.QUOTE_NOT_FOUND, "No quotes found for " + quoteIds);
        }
        if (quotes.size() != quoteIds.size()) {
            log.warn("Some requested quotes do not exist: requested={}, found={}", quoteIds.size(), quotes.size());
            throw new PaymentAuthorizationException(ErrorKind.FORBIDDEN, "Not all quotes are accessible");
        }
        if (!verdict.isGuest()) {
            for (QuoteSnapshot quote : quotes) {
                if (!Objects.equals(quote.getOwnerId(), verdict.getUserId())) {
                    log.warn("Ownership mismatch: quoteId={}", quote.getId());
                    throw new PaymentAuthorizationException(ErrorKind.FORBIDDEN,
                            "Quote " + quote.getId() + " is not owned by the caller");
                }
            }
        }
        return quotes;
    }

    private String resolveCurrency(PaymentCreationRequest request, List<QuoteSnapshot> quotes) {
        List<String> quoteCurrencies = quotes.stream()
                .map(QuoteSnapshot::getCurrency)
                .filter(Objects::nonNull)
                .map(currencyNormalizer::normalizeCode)
                .distinct()
                .collect(Collectors.toList());
        if (quoteCurrencies.size() > 1) {
            throw new PaymentValidationException(ErrorKind.INVALID_CURRENCY,
                    "Quotes have different currencies: " + quoteCurrencies);
        }
        String quoteCurrency = quoteCurrencies.isEmpty() ? null : quoteCurrencies.get(0);
        if (request.getCurrency() != null) {
            String requested = currencyNormalizer.normalizeCode(request.getCurrency());
            if (quoteCurrency != null && !quoteCurrency.equals(requested)) {
                throw new PaymentValidationException(ErrorKind.INVALID_CURRENCY,
                        "Currency " + requested + " does not match quote currency " + quoteCurrency);
            }
            return requested;
        }
        return quoteCurrency != null ? quoteCurrency : DEFAULT_CURRENCY;
    }

    /**
     * The quote total wins; an explicit amount is only accepted when it
     * agrees with it, or when the quotes carry no total.
     */
    private BigDecimal resolveAmount(PaymentCreationRequest request, List<QuoteSnapshot> quotes, String currency) {
        boolean allPriced = quotes.stream().allMatch(q -> q.getFinalTotal() != null);
        BigDecimal quoteTotal = allPriced
                ? quotes.stream().map(QuoteSnapshot::getFinalTotal).reduce(BigDecimal.ZERO, BigDecimal::add)
                : null;
        BigDecimal amount;
        if (request.getAmount() != null) {
            amount = currencyNormalizer.roundToCurrency(request.getAmount(), currency);
            if (quoteTotal != null && amount.compareTo(currencyNormalizer.roundToCurrency(quoteTotal, currency)) != 0) {
                throw new PaymentValidationException("Amount " + amount + " does not match quote total " + quoteTotal);
            }
        } else if (quoteTotal != null) {
            amount = currencyNormalizer.roundToCurrency(quoteTotal, currency);
        } else {
            throw new PaymentValidationException("Amount is required when quotes have no total");
        }
        if (amount.signum() <= 0) {
            throw new PaymentValidationException(ErrorKind.AMOUNT_TOO_SMALL, "Amount must be positive: " + amount);
        }
        return amount;
    }

    private static CustomerInfo resolveCustomer(CustomerInfo supplied, QuoteSnapshot primary) {
        if (supplied != null && supplied.getEmail() != null) {
            return supplied;
        }
        return CustomerInfo.builder()
                .name(supplied != null && supplied.getName() != null ? supplied.getName() : primary.getCustomerName())
                .email(primary.getCustomerEmail())
                .phone(supplied != null && supplied.getPhone() != null ? supplied.getPhone() : primary.getCustomerPhone())
                .build();
    }

    private static String describe(List<QuoteSnapshot> quotes) {
        String ids = quotes.stream().map(QuoteSnapshot::getId).collect(Collectors.joining(", "));
        String summaries = quotes.stream()
                .map(QuoteSnapshot::getProductSummary)
                .filter(s -> s != null && !s.isBlank())
                .collect(Collectors.joining(", "));
        return summaries.isEmpty() ? "Order: " + ids : "Order: " + summaries + " (" + ids + ")";
    }

    private static PaymentCreationOutcome success(NormalizedPaymentRequest request, GatewayRequest gatewayRequest,
                                                  PaymentCreationResult result, PaymentState state, boolean trackable) {
        boolean hasForm = result.getFormData() != null && !result.getFormData().isEmpty();
        return PaymentCreationOutcome.builder()
                .success(true)
                .transactionId(request.getTransactionId())
                .gatewayCode(request.getGatewayCode())
                .paymentState(state)
                .redirectUrl(result.getRedirectUrl())
                .formMethod(hasForm ? "POST" : null)
                .formData(hasForm ? result.getFormData() : null)
                .clientSecret(result.getClientSecret())
                .chargedAmount(gatewayRequest.getChargedAmount())
                .chargedCurrency(gatewayRequest.getChargedCurrency())
                .trackable(trackable)
                .build();
    }

    private static PaymentCreationOutcome failure(NormalizedPaymentRequest request, PaymentState state) {
        return PaymentCreationOutcome.builder()
                .success(false)
                .transactionId(request.getTransactionId())
                .gatewayCode(request.getGatewayCode())
                .paymentState(state)
                .trackable(true)
                .error(GENERIC_FAILURE_MESSAGE)
                .build();
    }
}
