package com.example.logistics.nlp;

public record TrainingOptions(
    int maxFeatures,
    double testFraction,
    long seed,
    int maxIterations,
    double regularization
) {

    public static final int DEFAULT_MAX_FEATURES = 500;
    public static final double DEFAULT_TEST_FRACTION = 0.2;
    public static final long DEFAULT_SEED = 42L;
    public static final int DEFAULT_MAX_ITERATIONS = 1000;
    public static final double DEFAULT_REGULARIZATION = 1.0;

    public TrainingOptions {
        if (maxFeatures <= 0) throw new IllegalArgumentException("maxFeatures must be positive");
        if (testFraction <= 0.0 || testFraction >= 1.0) {
            throw new IllegalArgumentException("testFraction must be in (0, 1)");
        }
        if (maxIterations <= 0) throw new IllegalArgumentException("maxIterations must be positive");
        if (regularization <= 0.0) throw new IllegalArgumentException("regularization must be positive");
    }

    public static TrainingOptions defaults() {
        return new TrainingOptions(DEFAULT_MAX_FEATURES, DEFAULT_TEST_FRACTION, DEFAULT_SEED,
            DEFAULT_MAX_ITERATIONS, DEFAULT_REGULARIZATION);
    }
}
