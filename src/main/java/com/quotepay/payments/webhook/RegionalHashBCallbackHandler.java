package com.quotepay.payments.webhook;

import com.quotepay.payments.domain.GatewayCode;
import org.springframework.stereotype.Component;

@Component
public class RegionalHashBCallbackHandler extends HashGatewayCallbackHandler {

    @Override
    public GatewayCode getGatewayCode() {
        return GatewayCode.REGIONAL_HASH_B;
    }
}
