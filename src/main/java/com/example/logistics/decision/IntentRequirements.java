package com.example.logistics.decision;

import static com.example.logistics.model.EntityField.DROP_LOCATION;
import static com.example.logistics.model.EntityField.PACKAGES;
import static com.example.logistics.model.EntityField.PAYMENT_MODE;
import static com.example.logistics.model.EntityField.PHONE_NUMBER;
import static com.example.logistics.model.EntityField.PICKUP_LOCATION;
import static com.example.logistics.model.EntityField.PICKUP_TIME;
import static com.example.logistics.model.EntityField.WEIGHT_KG;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.example.logistics.model.EntityField;
import com.example.logistics.model.Intent;

public final class IntentRequirements {

    public record Requirement(List<EntityField> required, List<EntityField> optional) {

        static Requirement of(List<EntityField> required, List<EntityField> optional) {
            return new Requirement(List.copyOf(required), List.copyOf(optional));
        }
    }

    public static final List<EntityField> BOOKING_RECOMMENDED = List.of(PICKUP_TIME, PHONE_NUMBER);

    private static final Map<Intent, Requirement> TABLE;
    static {
        var table = new EnumMap<Intent, Requirement>(Intent.class);
        table.put(Intent.CHECK_RATE, Requirement.of(
            List.of(PICKUP_LOCATION, DROP_LOCATION, WEIGHT_KG), List.of(PACKAGES)));
        table.put(Intent.CHECK_SERVICEABILITY, Requirement.of(
            List.of(DROP_LOCATION), List.of(PICKUP_LOCATION)));
        table.put(Intent.BOOK_PICKUP, Requirement.of(
            List.of(PICKUP_LOCATION, DROP_LOCATION, PACKAGES),
            List.of(PICKUP_TIME, WEIGHT_KG, PHONE_NUMBER, PAYMENT_MODE)));
        table.put(Intent.TRACK_ORDER, Requirement.of(List.of(), List.of(PHONE_NUMBER)));
        table.put(Intent.CANCEL_ORDER, Requirement.of(List.of(), List.of()));
        table.put(Intent.RESCHEDULE_PICKUP, Requirement.of(List.of(), List.of(PICKUP_TIME, PICKUP_LOCATION)));
        table.put(Intent.RAISE_COMPLAINT, Requirement.of(List.of(), List.of(PHONE_NUMBER)));
        table.put(Intent.CONNECT_TO_AGENT, Requirement.of(List.of(), List.of()));
        table.put(Intent.PAYMENT_QUERY, Requirement.of(List.of(), List.of()));
        table.put(Intent.DOCUMENT_UPLOAD_QUERY, Requirement.of(List.of(), List.of()));
        TABLE = Collections.unmodifiableMap(table);
    }

    private IntentRequirements() {}

    public static Optional<Requirement> forIntent(Intent intent) {
        return Optional.ofNullable(TABLE.get(intent));
    }

    public static Map<Intent, Requirement> all() {
        return TABLE;
    }
}
