package com.quotepay.payments.core.crypto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Fields that enter a hash-gateway signature. Shared by the outbound form
 * and the inbound callback so both sides hash the same values.
 */
@Value
@Builder
public class HashFields {

    String key;
    String txnid;
    String amount;
    String productInfo;
    String firstName;
    String email;

    /** udf1..udf5; missing entries hash as empty. */
    List<String> userFields;

    public String userField(int index) {
        if (userFields == null || index < 1 || index > userFields.size()) {
            return "";
        }
        String value = userFields.get(index - 1);
        return value == null ? "" : value;
    }
}
