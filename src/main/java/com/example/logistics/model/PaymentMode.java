package com.example.logistics.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PaymentMode {
    COD("COD"),
    PREPAID("prepaid");

    private final String value;

    PaymentMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
