package com.example.logistics.nlp;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.logistics.config.AppConfig;
import com.example.logistics.model.IntentResult;
import com.example.logistics.model.TrainingExample;
import com.example.logistics.model.TrainingReport;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.annotation.PostConstruct;

@Component
public class IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(IntentClassifier.class);

    private final AppConfig config;
    private final IntentModelStore store;
    private final IntentTrainer trainer;
    private final DatasetReader datasetReader;
    private final AtomicReference<IntentModel> current = new AtomicReference<>();
    private final ReentrantLock trainingLock = new ReentrantLock();
    private final Tracer tracer;

    public IntentClassifier(AppConfig config, IntentModelStore store) {
        this.config = config;
        this.store = store;
        this.trainer = new IntentTrainer();
        this.datasetReader = new DatasetReader();
        this.tracer = GlobalOpenTelemetry.getTracer("logistics-assistant");
    }

    @PostConstruct
    void init() {
        Path modelPath = Path.of(config.modelPath());
        try {
            if (load(modelPath)) {
                log.info("Intent classifier ready");
            } else {
                log.warn("Intent classifier has no model yet; train one with --train=<dataset.csv>");
            }
        } catch (CorruptModelException e) {
            log.error("Intent model at {} is corrupt, classifier stays untrained: {}", modelPath, e.getMessage());
        }
    }

    public IntentResult classify(String text) {
        Span span = tracer.spanBuilder("classify_intent")
            .setAttribute("logistics.stage", "classify")
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            IntentModel model = current.get();
            if (model == null) {
                throw new NotTrainedException();
            }
            IntentResult result = model.predict(text);

            span.setAttribute("logistics.intent", result.intent().name());
            span.setAttribute("logistics.confidence", result.confidence());
            log.debug("Classified intent: {} (confidence={})", result.intent(), result.confidence());
            return result;

        } catch (IntentModelException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;

        } finally {
            span.end();
        }
    }

    public TrainingReport train(List<TrainingExample> examples) {
        trainingLock.lock();
        try {
            IntentTrainer.Outcome outcome = fit(examples);
            current.set(outcome.model());
            return outcome.report();
        } finally {
            trainingLock.unlock();
        }
    }

    public TrainingReport train(Path dataset) {
        return train(datasetReader.read(dataset));
    }

    // The new model is installed only once it is on disk.
    public TrainingReport trainAndSave(Path dataset) {
        trainingLock.lock();
        try {
            IntentTrainer.Outcome outcome = fit(datasetReader.read(dataset));
            store.save(outcome.model(), Path.of(config.modelPath()));
            current.set(outcome.model());
            return outcome.report();
        } finally {
            trainingLock.unlock();
        }
    }

    // Returns false if nothing is stored at path; the current model is left as it was.
    public boolean load(Path path) {
        Optional<IntentModel> loaded = store.load(path);
        loaded.ifPresent(current::set);
        return loaded.isPresent();
    }

    public void save(Path path) {
        IntentModel model = current.get();
        if (model == null) {
            throw new NotTrainedException();
        }
        store.save(model, path);
    }

    private IntentTrainer.Outcome fit(List<TrainingExample> examples) {
        Span span = tracer.spanBuilder("train_intent_model")
            .setAttribute("logistics.stage", "train")
            .setAttribute("logistics.examples", (long) examples.size())
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            IntentTrainer.Outcome outcome = trainer.fit(examples, config.trainingOptions());

            span.setAttribute("logistics.accuracy", outcome.report().accuracy());
            log.info("Classification report:\n{}", outcome.report().format());
            return outcome;

        } catch (IntentModelException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            log.error("Intent model training failed: {}", e.getMessage());
            throw e;

        } finally {
            span.end();
        }
    }

    public boolean isReady() {
        return current.get() != null;
    }

    public Optional<IntentModel> currentModel() {
        return Optional.ofNullable(current.get());
    }
}
