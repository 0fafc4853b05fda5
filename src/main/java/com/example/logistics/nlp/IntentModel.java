package com.example.logistics.nlp;

import java.util.List;

import com.example.logistics.model.Intent;
import com.example.logistics.model.IntentResult;

public final class IntentModel {

    private final FeatureSpace features;
    private final LogisticClassifier classifier;

    public IntentModel(FeatureSpace features, LogisticClassifier classifier) {
        this.features = features;
        this.classifier = classifier;
    }

    public IntentResult predict(String text) {
        return predictNormalized(TextNormalizer.normalize(text));
    }

    IntentResult predictNormalized(String normalizedText) {
        double[] p = probabilities(normalizedText);
        int best = 0;
        for (int k = 1; k < p.length; k++) {
            if (p[k] > p[best]) best = k;
        }
        return IntentResult.of(classifier.labels().get(best), p[best]);
    }

    double[] probabilities(String normalizedText) {
        return classifier.probabilities(features.transform(normalizedText), features.terms());
    }

    public FeatureSpace features() {
        return features;
    }

    public LogisticClassifier classifier() {
        return classifier;
    }

    public List<Intent> labels() {
        return classifier.labels();
    }
}
