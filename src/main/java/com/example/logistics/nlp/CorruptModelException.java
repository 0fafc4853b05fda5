package com.example.logistics.nlp;

public class CorruptModelException extends IntentModelException {

    public CorruptModelException(String message) {
        super(message);
    }

    public CorruptModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
