package com.quotepay.payments;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the quote payment service. Enables:
 * <ul>
 *   <li>Gateway adapters for card, regional hash, hosted wallet and offline methods</li>
 *   <li>Write-ahead transaction ledger with failed/orphaned compensation states</li>
 *   <li>Verified, idempotent webhook reconciliation against ledger and quotes</li>
 *   <li>Lifecycle events on Kafka; REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
public class QuotePaymentsApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuotePaymentsApplication.class, args);
    }
}
