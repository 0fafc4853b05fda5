package com.example.logistics.model;

import java.util.function.Function;

public enum EntityField {
    PICKUP_LOCATION("pickup_location", "pickup location", EntitySet::pickupLocation),
    DROP_LOCATION("drop_location", "delivery location", EntitySet::dropLocation),
    WEIGHT_KG("weight_kg", "package weight (in kg)", EntitySet::weightKg),
    PACKAGES("packages", "number of packages", EntitySet::packages),
    PICKUP_TIME("pickup_time", "preferred pickup time", EntitySet::pickupTime),
    FRAGILE("fragile", "fragile handling", EntitySet::fragile),
    PAYMENT_MODE("payment_mode", "payment mode", EntitySet::paymentMode),
    PHONE_NUMBER("phone_number", "contact number", EntitySet::phoneNumber);

    private final String key;
    private final String label;
    private final Function<EntitySet, Object> accessor;

    EntityField(String key, String label, Function<EntitySet, Object> accessor) {
        this.key = key;
        this.label = label;
        this.accessor = accessor;
    }

    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    public Object valueIn(EntitySet entities) {
        return accessor.apply(entities);
    }

    // Null and blank strings count as absent; booleans never do.
    public boolean isAbsentIn(EntitySet entities) {
        Object value = valueIn(entities);
        if (value == null) return true;
        return value instanceof String s && s.isBlank();
    }
}
