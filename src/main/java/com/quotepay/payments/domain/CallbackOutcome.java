package com.quotepay.payments.domain;

public enum CallbackOutcome {
    SUCCEEDED,
    FAILED,
    PENDING,
    IGNORED
}
