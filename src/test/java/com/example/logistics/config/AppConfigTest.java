package com.example.logistics.config;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;

import com.example.logistics.nlp.TrainingOptions;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @Test
    void unsetPropertiesFallBackToDefaults() {
        AppConfig config = AppConfig.defaults();

        assertEquals("models/intent-model.json", config.modelPath());
        assertEquals("models/en-ner-location.bin", config.locationModelPath());
        assertEquals(TrainingOptions.defaults(), config.trainingOptions());
    }

    @Test
    void nonPositiveValuesAreReplaced() {
        AppConfig config = new AppConfig(" ", null, 0, -1.0, 7L, -5, -2.0);

        assertEquals(AppConfig.DEFAULT_MODEL_PATH, config.modelPath());
        assertEquals(500, config.maxFeatures());
        assertEquals(0.2, config.testFraction());
        assertEquals(7L, config.seed());
        assertEquals(1000, config.maxIterations());
        assertEquals(1.0, config.regularization());
    }

    @Test
    void modelPathOverride() {
        AppConfig config = AppConfig.withModelPath(Path.of("/tmp/m.json"));

        assertEquals(Path.of("/tmp/m.json").toString(), config.modelPath());
        assertEquals(500, config.trainingOptions().maxFeatures());
    }

    @Test
    void trainingOptionsRejectOutOfRangeFraction() {
        assertThrows(IllegalArgumentException.class,
            () -> new AppConfig(null, null, null, 1.5, null, null, null).trainingOptions());
    }
}
