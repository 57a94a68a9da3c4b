package com.quotepay.payments.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * HTTP client and clock shared by gateway adapters and the token verifier.
 * Timeouts bound every synchronous gateway call.
 */
@Configuration
@EnableConfigurationProperties(PaymentGatewayProperties.class)
public class GatewayClientConfig {

    @Bean
    public RestTemplate gatewayRestTemplate(
            @Value("${payment.http.connect-timeout-ms:5000}") int connectTimeoutMs,
            @Value("${payment.http.read-timeout-ms:15000}") int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
