package com.quotepay.payments.adapters;

import com.quotepay.payments.config.PaymentGatewayProperties.GatewaySettings;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.function.Supplier;

/**
 * OAuth access tokens for the hosted wallet. Tokens are cached in Redis until
 * shortly before they expire; a Redis outage only costs an extra login.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WalletAccessTokenProvider {

    static final String LOGIN_PATH = "/api/v1/authentication/login";
    static final String KEY_PREFIX = "payment:wallet:token:";
    static final String RETRY_INSTANCE = "gateway-auth";
    static final Duration EXPIRY_MARGIN = Duration.ofSeconds(60);
    static final Duration DEFAULT_TTL = Duration.ofMinutes(15);
    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE = new ParameterizedTypeReference<>() {};

    private final StringRedisTemplate redisTemplate;
    private final RetryRegistry retryRegistry;
    private final Clock clock;
    private final RestTemplate gatewayRestTemplate;

    /**
     * Returns a cached token or logs in for a new one.
     *
     * @throws WalletAuthenticationException if login fails after retries
     */
    public String accessToken(GatewaySettings settings) {
        String key = KEY_PREFIX + settings.getClientId();
        try {
            String cached = redisTemplate.opsForValue().get(key);
            if (cached != null && !cached.isBlank()) {
                return cached;
            }
        } catch (RuntimeException e) {
            log.warn("Wallet token cache read failed, logging in: {}", e.getMessage());
        }

        Retry retry = retryRegistry.retry(RETRY_INSTANCE);
        Supplier<Map<String, Object>> withRetry = Retry.decorateSupplier(retry, () -> login(settings));
        Map<String, Object> body;
        try {
            body = withRetry.get();
        } catch (RestClientException e) {
            throw new WalletAuthenticationException("Wallet login failed: " + e.getMessage(), e);
        }

        Object token = body == null ? null : body.get("token");
        if (token == null || token.toString().isBlank()) {
            throw new WalletAuthenticationException("Wallet login response without token");
        }
        Duration ttl = ttlFor(body.get("expires_at"));
        try {
            redisTemplate.opsForValue().set(key, token.toString(), ttl);
        } catch (RuntimeException e) {
            log.warn("Wallet token cache write failed: {}", e.getMessage());
        }
        log.info("Wallet access token obtained: clientId={}, ttlSeconds={}", settings.getClientId(), ttl.getSeconds());
        return token.toString();
    }

    /** Drops a token the wallet has rejected. */
    public void evict(GatewaySettings settings) {
        try {
            redisTemplate.delete(KEY_PREFIX + settings.getClientId());
        } catch (RuntimeException e) {
            log.warn("Wallet token cache eviction failed: {}", e.getMessage());
        }
    }

    private Map<String, Object> login(GatewaySettings settings) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HostedWalletAdapter.CLIENT_ID_HEADER, settings.getClientId());
        headers.set(HostedWalletAdapter.API_KEY_HEADER, settings.getSecretKey());
        ResponseEntity<Map<String, Object>> response = gatewayRestTemplate.exchange(
                settings.resolveBaseUrl() + LOGIN_PATH, HttpMethod.POST, new HttpEntity<>(Map.of(), headers), MAP_TYPE);
        return response.getBody();
    }

    Duration ttlFor(Object expiresAt) {
        if (expiresAt == null) {
            return DEFAULT_TTL;
        }
        try {
            Instant expiry = OffsetDateTime.parse(expiresAt.toString()).toInstant();
            Duration ttl = Duration.between(clock.instant(), expiry).minus(EXPIRY_MARGIN);
            return ttl.compareTo(Duration.ofSeconds(1)) < 0 ? Duration.ofSeconds(1) : ttl;
        } catch (DateTimeParseException e) {
            log.debug("Unparseable wallet token expiry '{}', using default TTL", expiresAt);
            return DEFAULT_TTL;
        }
    }
}
