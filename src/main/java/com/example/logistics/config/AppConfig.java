package com.example.logistics.config;

import java.nio.file.Path;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.example.logistics.nlp.TrainingOptions;

@ConfigurationProperties(prefix = "app.nlp")
public record AppConfig(
    String modelPath,
    String locationModelPath,
    Integer maxFeatures,
    Double testFraction,
    Long seed,
    Integer maxIterations,
    Double regularization
) {

    public static final String DEFAULT_MODEL_PATH = "models/intent-model.json";
    public static final String DEFAULT_LOCATION_MODEL_PATH = "models/en-ner-location.bin";

    public AppConfig {
        if (modelPath == null || modelPath.isBlank()) modelPath = DEFAULT_MODEL_PATH;
        if (locationModelPath == null || locationModelPath.isBlank()) locationModelPath = DEFAULT_LOCATION_MODEL_PATH;
        if (maxFeatures == null || maxFeatures <= 0) maxFeatures = TrainingOptions.DEFAULT_MAX_FEATURES;
        if (testFraction == null || testFraction <= 0) testFraction = TrainingOptions.DEFAULT_TEST_FRACTION;
        if (seed == null) seed = TrainingOptions.DEFAULT_SEED;
        if (maxIterations == null || maxIterations <= 0) maxIterations = TrainingOptions.DEFAULT_MAX_ITERATIONS;
        if (regularization == null || regularization <= 0) regularization = TrainingOptions.DEFAULT_REGULARIZATION;
    }

    public static AppConfig defaults() {
        return new AppConfig(null, null, null, null, null, null, null);
    }

    public static AppConfig withModelPath(Path modelPath) {
        return new AppConfig(modelPath.toString(), null, null, null, null, null, null);
    }

    public TrainingOptions trainingOptions() {
        return new TrainingOptions(maxFeatures, testFraction, seed, maxIterations, regularization);
    }
}
