package com.quotepay.payments.webhook;

import com.quotepay.payments.domain.CallbackOutcome;
import com.quotepay.payments.domain.GatewayCode;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WebhookReceipt {

    GatewayCode gatewayCode;
    String eventId;
    String transactionId;
    CallbackOutcome outcome;
    boolean verified;
    WebhookDisposition disposition;
}
