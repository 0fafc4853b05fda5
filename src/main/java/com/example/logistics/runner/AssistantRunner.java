package com.example.logistics.runner;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.example.logistics.config.AppConfig;
import com.example.logistics.model.PipelineResult;
import com.example.logistics.model.TrainingReport;
import com.example.logistics.nlp.IntentClassifier;
import com.example.logistics.pipeline.LogisticsPipeline;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

@Component
public class AssistantRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AssistantRunner.class);

    private final IntentClassifier intentClassifier;
    private final LogisticsPipeline pipeline;
    private final AppConfig config;
    private final ObjectMapper mapper;

    public AssistantRunner(IntentClassifier intentClassifier, LogisticsPipeline pipeline,
                           AppConfig config, ObjectMapper mapper) {
        this.intentClassifier = intentClassifier;
        this.pipeline = pipeline;
        this.config = config;
        this.mapper = mapper;
    }

    @Override
    public void run(ApplicationArguments args) throws JsonProcessingException {
        List<String> train = args.getOptionValues("train");
        if (train != null && !train.isEmpty()) {
            Path dataset = Path.of(train.get(0));
            log.info("Training intent model from {}", dataset);
            TrainingReport report = intentClassifier.trainAndSave(dataset);
            log.info("Training accuracy {} on {} held-out examples; model written to {}",
                String.format("%.2f%%", report.accuracy() * 100), report.testSize(), config.modelPath());
        }

        List<String> queries = args.getOptionValues("query");
        if (queries == null) {
            return;
        }
        for (String query : queries) {
            PipelineResult result = pipeline.process(query);
            log.info("Result:\n{}", mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        }
    }
}
