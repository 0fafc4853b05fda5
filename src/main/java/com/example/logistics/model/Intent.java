package com.example.logistics.model;

import java.util.Optional;

public enum Intent {
    CHECK_RATE,
    CHECK_SERVICEABILITY,
    BOOK_PICKUP,
    TRACK_ORDER,
    CANCEL_ORDER,
    RESCHEDULE_PICKUP,
    RAISE_COMPLAINT,
    CONNECT_TO_AGENT,
    PAYMENT_QUERY,
    DOCUMENT_UPLOAD_QUERY;

    public static Optional<Intent> fromLabel(String label) {
        if (label == null || label.isBlank()) return Optional.empty();
        try {
            return Optional.of(Intent.valueOf(label.strip()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
