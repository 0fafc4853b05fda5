package com.example.logistics.config;

import java.nio.file.Path;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.logistics.extraction.LocationRecognizer;
import com.example.logistics.extraction.OpenNlpLocationRecognizer;

@Configuration
public class NlpConfig {

    @Bean
    LocationRecognizer locationRecognizer(AppConfig config) {
        return OpenNlpLocationRecognizer.fromPath(Path.of(config.locationModelPath()));
    }
}
