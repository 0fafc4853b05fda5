package com.example.logistics.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EntitySet(
    String pickupLocation,
    String dropLocation,
    Double weightKg,
    Integer packages,
    String pickupTime,
    boolean fragile,
    PaymentMode paymentMode,
    String phoneNumber
) {

    public static EntitySet empty() {
        return new EntitySet(null, null, null, null, null, false, null, null);
    }
}
