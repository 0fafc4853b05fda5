package com.example.logistics.model;

public record IntentResult(
    Intent intent,
    double confidence
) {

    public static IntentResult of(Intent intent, double probability) {
        return new IntentResult(intent, Math.round(probability * 100.0) / 100.0);
    }
}
