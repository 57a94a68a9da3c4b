package com.quotepay.payments.domain;

public enum GuestSessionStatus {
    ACTIVE,
    COMPLETED,
    EXPIRED
}
