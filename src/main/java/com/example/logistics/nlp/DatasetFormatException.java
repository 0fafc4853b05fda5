package com.example.logistics.nlp;

public class DatasetFormatException extends IntentModelException {

    public DatasetFormatException(String message) {
        super(message);
    }

    public DatasetFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
