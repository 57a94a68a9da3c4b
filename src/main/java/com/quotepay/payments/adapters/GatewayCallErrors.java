package com.quotepay.payments.adapters;

import com.quotepay.payments.api.GatewayException;
import com.quotepay.payments.compliance.PiiMasker;
import com.quotepay.payments.domain.GatewayCode;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Maps REST client failures onto {@link GatewayException}: a 4xx is a
 * definitive rejection, anything else (5xx, timeout, I/O) leaves the
 * gateway-side outcome unknown.
 */
final class GatewayCallErrors {

    private static final int MAX_BODY_IN_MESSAGE = 300;

    private GatewayCallErrors() {}

    static GatewayException translate(GatewayCode gatewayCode, String operation, RestClientException e) {
        if (e instanceof HttpClientErrorException) {
            HttpClientErrorException clientError = (HttpClientErrorException) e;
            return GatewayException.rejected(gatewayCode,
                    operation + " rejected: status=" + clientError.getStatusCode().value()
                            + ", body=" + PiiMasker.truncate(clientError.getResponseBodyAsString(), MAX_BODY_IN_MESSAGE), e);
        }
        if (e instanceof HttpServerErrorException) {
            RestClientResponseException serverError = (RestClientResponseException) e;
            return GatewayException.indeterminate(gatewayCode,
                    operation + " failed with server error: status=" + serverError.getStatusCode().value(), e);
        }
        return GatewayException.indeterminate(gatewayCode, operation + " failed: " + e.getMessage(), e);
    }

    static String stringValue(Object value) {
        return value == null ? null : value.toString();
    }
}
