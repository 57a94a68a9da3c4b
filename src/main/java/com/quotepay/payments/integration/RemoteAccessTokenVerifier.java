package com.quotepay.payments.integration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;
import java.util.Optional;

/**
 * Asks the identity provider's user-info endpoint who owns a bearer token.
 */
@Slf4j
@Component
public class RemoteAccessTokenVerifier implements AccessTokenVerifier {

    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE = new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final String userInfoUrl;

    public RemoteAccessTokenVerifier(RestTemplate gatewayRestTemplate,
                                     @Value("${payment.auth.user-info-url:}") String userInfoUrl) {
        this.restTemplate = gatewayRestTemplate;
        this.userInfoUrl = userInfoUrl;
    }

    @Override
    public Optional<String> resolveUserId(String accessToken) {
        if (userInfoUrl == null || userInfoUrl.isBlank()) {
            log.warn("payment.auth.user-info-url is not configured; bearer tokens cannot be verified");
            return Optional.empty();
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        try {
            ResponseEntity<Map<String, Object>> response =
                    restTemplate.exchange(userInfoUrl, HttpMethod.GET, new HttpEntity<>(headers), MAP_TYPE);
            Map<String, Object> body = response.getBody();
            if (body == null) {
                return Optional.empty();
            }
            Object id = body.containsKey("id") ? body.get("id") : body.get("sub");
            return Optional.ofNullable(id).map(Object::toString).filter(s -> !s.isBlank());
        } catch (HttpClientErrorException e) {
            log.info("Bearer token rejected by identity provider: status={}", e.getStatusCode().value());
            return Optional.empty();
        } catch (RestClientException e) {
            log.error("Identity provider unreachable while verifying bearer token", e);
            return Optional.empty();
        }
    }
}
