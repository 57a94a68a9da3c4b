package com.quotepay.payments.api;

import com.quotepay.payments.domain.CallbackOutcome;
import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.ledger.TransactionLedger;
import com.quotepay.payments.persistence.entity.PaymentTransactionEntity;
import com.quotepay.payments.webhook.InboundCallback;
import com.quotepay.payments.webhook.WebhookIngestionService;
import com.quotepay.payments.webhook.WebhookReceipt;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;
import java.util.Optional;

/**
 * Gateway callbacks: server-to-server webhooks and the browser return of the
 * hash gateways. Every callback that reaches the ingestion service is
 * recorded first and answered 200, whatever its disposition; the body names
 * the disposition. Only a request this service cannot route gets a 4xx.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Webhooks", description = "Gateway callbacks")
public class WebhookController {

    static final String STATUS_SUCCESS = "success";
    static final String STATUS_FAILURE = "failure";
    static final String STATUS_PENDING = "pending";

    private final WebhookIngestionService ingestionService;
    private final TransactionLedger ledger;
    private final String frontendSuccessUrl;
    private final String frontendFailureUrl;

    public WebhookController(WebhookIngestionService ingestionService,
                             TransactionLedger ledger,
                             @Value("${payment.frontend.success-url:http://localhost:3000/payment/success}") String frontendSuccessUrl,
                             @Value("${payment.frontend.failure-url:http://localhost:3000/payment/failure}") String frontendFailureUrl) {
        this.ingestionService = ingestionService;
        this.ledger = ledger;
        this.frontendSuccessUrl = frontendSuccessUrl;
        this.frontendFailureUrl = frontendFailureUrl;
    }

    @PostMapping(value = "/webhooks/{gateway}", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    @Operation(summary = "Receive form webhook", description = "Server-to-server callback of the hash gateways.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Recorded. Body: { \"status\": PROCESSED|PROCESSED_WITH_ERROR|DUPLICATE|UNVERIFIED|IGNORED|DEFERRED }"),
            @ApiResponse(responseCode = "400", description = "Unknown gateway.")
    })
    public ResponseEntity<Map<String, String>> receiveForm(
            @PathVariable String gateway,
            @RequestParam Map<String, String> params,
            @RequestHeader HttpHeaders headers) {
        InboundCallback callback = InboundCallback.builder()
                .rawBody(InboundCallback.canonicalForm(params))
                .headers(headers.toSingleValueMap())
                .params(params)
                .build();
        return respond(ingestionService.receive(resolve(gateway), callback));
    }

    @PostMapping(value = "/webhooks/{gateway}", consumes = {MediaType.APPLICATION_JSON_VALUE, MediaType.TEXT_PLAIN_VALUE})
    @Operation(summary = "Receive JSON webhook", description = "Signed event callback of the card processor and the hosted wallet. "
            + "The raw body is verified against the timestamped signature header.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Recorded. Body: { \"status\": PROCESSED|PROCESSED_WITH_ERROR|DUPLICATE|UNVERIFIED|IGNORED|DEFERRED }"),
            @ApiResponse(responseCode = "400", description = "Unknown gateway.")
    })
    public ResponseEntity<Map<String, String>> receiveJson(
            @PathVariable String gateway,
            @RequestBody String body,
            @RequestHeader HttpHeaders headers) {
        InboundCallback callback = InboundCallback.builder()
                .rawBody(body)
                .headers(headers.toSingleValueMap())
                .build();
        return respond(ingestionService.receive(resolve(gateway), callback));
    }

    @PostMapping(value = "/payments/return/{gateway}", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    @Operation(summary = "Browser return", description = "The hash gateways post the outcome form through the customer's browser. "
            + "It is recorded and reconciled like a webhook, then the browser is redirected to the checkout result page.")
    @ApiResponse(responseCode = "302", description = "Redirect to the success or failure page with transactionId and status.")
    public ResponseEntity<Void> browserReturn(
            @PathVariable String gateway,
            @RequestParam Map<String, String> params,
            @RequestHeader HttpHeaders headers) {
        InboundCallback callback = InboundCallback.builder()
                .rawBody(InboundCallback.canonicalForm(params))
                .headers(headers.toSingleValueMap())
                .params(params)
                .build();
        WebhookReceipt receipt = ingestionService.receive(resolve(gateway), callback);

        String status = returnStatus(receipt);
        Optional<PaymentTransactionEntity> transaction = receipt.getTransactionId() == null
                ? Optional.empty()
                : ledger.find(receipt.getTransactionId()).filter(t -> t.getGatewayCode() == receipt.getGatewayCode());
        String target = STATUS_FAILURE.equals(status)
                ? transaction.map(t -> t.metadataValue(PaymentTransactionEntity.META_CANCEL_URL)).orElse(null)
                : transaction.map(t -> t.metadataValue(PaymentTransactionEntity.META_SUCCESS_URL)).orElse(null);
        if (target == null || target.isBlank()) {
            target = STATUS_FAILURE.equals(status) ? frontendFailureUrl : frontendSuccessUrl;
        }
        URI location = UriComponentsBuilder.fromUriString(target)
                .queryParamIfPresent("transactionId", transaction.map(PaymentTransactionEntity::getTransactionId))
                .queryParam("status", status)
                .build()
                .encode()
                .toUri();
        log.info("Browser return: gateway={}, transactionId={}, status={}, disposition={}",
                gateway, receipt.getTransactionId(), status, receipt.getDisposition());
        return ResponseEntity.status(HttpStatus.FOUND).location(location).build();
    }

    private static GatewayCode resolve(String gateway) {
        return GatewayCode.fromCode(gateway)
                .orElseThrow(() -> new PaymentValidationException(ErrorKind.UNSUPPORTED_GATEWAY, "Unknown gateway: " + gateway));
    }

    private static String returnStatus(WebhookReceipt receipt) {
        if (receipt.getOutcome() == CallbackOutcome.FAILED || receipt.getOutcome() == null) {
            return STATUS_FAILURE;
        }
        if (receipt.getOutcome() == CallbackOutcome.SUCCEEDED && receipt.isVerified()) {
            return STATUS_SUCCESS;
        }
        return STATUS_PENDING;
    }

    private static ResponseEntity<Map<String, String>> respond(WebhookReceipt receipt) {
        return ResponseEntity.ok(Map.of("status", receipt.getDisposition().name()));
    }
}
