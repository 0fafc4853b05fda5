package com.example.logistics.nlp;

public class NotTrainedException extends IntentModelException {

    public NotTrainedException() {
        super("Intent model not trained or loaded");
    }
}
