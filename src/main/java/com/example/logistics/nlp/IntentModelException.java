package com.example.logistics.nlp;

public class IntentModelException extends RuntimeException {

    public IntentModelException(String message) {
        super(message);
    }

    public IntentModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
