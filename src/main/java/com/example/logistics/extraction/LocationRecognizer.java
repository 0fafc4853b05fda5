package com.example.logistics.extraction;

import java.util.List;

@FunctionalInterface
public interface LocationRecognizer {

    record RecognizedSpan(String text, String type) {}

    List<RecognizedSpan> recognize(String text);

    static LocationRecognizer none() {
        return text -> List.of();
    }
}
