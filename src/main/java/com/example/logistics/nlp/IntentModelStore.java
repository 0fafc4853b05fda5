package com.example.logistics.nlp;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

@Component
public class IntentModelStore {

    private static final Logger log = LoggerFactory.getLogger(IntentModelStore.class);
    static final int FORMAT_VERSION = 2;

    private final ObjectMapper mapper = new ObjectMapper();

    // classifier holds the OpenNLP binary QN model, base64 encoded by Jackson
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ModelSnapshot(
        int format,
        List<String> terms,
        double[] idf,
        byte[] classifier
    ) {}

    public byte[] toBytes(IntentModel model) {
        var snapshot = new ModelSnapshot(
            FORMAT_VERSION,
            model.features().terms(),
            model.features().idf(),
            model.classifier().toBytes());
        try {
            return mapper.writeValueAsBytes(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize intent model", e);
        }
    }

    public IntentModel fromBytes(byte[] blob) {
        if (blob == null || blob.length == 0) {
            throw new CorruptModelException("Model blob is empty");
        }

        ModelSnapshot snapshot;
        try {
            snapshot = mapper.readValue(blob, ModelSnapshot.class);
        } catch (IOException e) {
            throw new CorruptModelException("Model blob is not a valid model document: " + e.getMessage(), e);
        }
        if (snapshot == null) {
            throw new CorruptModelException("Model blob is empty");
        }
        return toModel(snapshot);
    }

    public void save(IntentModel model, Path path) {
        byte[] blob = toBytes(model);
        Path tmp = null;
        try {
            Path parent = path.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            tmp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
            Files.write(tmp, blob);
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Intent model saved to {} ({} bytes)", path, blob.length);
        } catch (IOException e) {
            UncheckedIOException failure = new UncheckedIOException("Failed to save intent model to " + path, e);
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }

    // A missing file is not an error; the caller decides what to report.
    public Optional<IntentModel> load(Path path) {
        if (!Files.exists(path)) {
            log.warn("No intent model at {}", path);
            return Optional.empty();
        }
        byte[] blob;
        try {
            blob = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new CorruptModelException("Unreadable intent model at " + path, e);
        }
        IntentModel model = fromBytes(blob);
        log.info("Intent model loaded from {} (classes={}, features={})",
            path, model.labels().size(), model.features().size());
        return Optional.of(model);
    }

    private IntentModel toModel(ModelSnapshot s) {
        if (s.format() != FORMAT_VERSION) {
            throw new CorruptModelException("Unsupported model format " + s.format());
        }
        if (s.terms() == null || s.idf() == null || s.classifier() == null || s.classifier().length == 0) {
            throw new CorruptModelException("Model is missing vocabulary or classifier parameters");
        }
        if (new HashSet<>(s.terms()).size() != s.terms().size() || s.terms().contains(null)) {
            throw new CorruptModelException("Model vocabulary has duplicate or null terms");
        }
        if (s.idf().length != s.terms().size()) {
            throw new CorruptModelException(
                "Vocabulary has " + s.terms().size() + " terms but " + s.idf().length + " idf weights");
        }
        for (double v : s.idf()) {
            if (!Double.isFinite(v)) {
                throw new CorruptModelException("Model idf contains a non-finite value");
            }
        }

        LogisticClassifier classifier;
        try {
            classifier = LogisticClassifier.fromBytes(s.classifier());
        } catch (IOException | RuntimeException e) {
            throw new CorruptModelException("Model classifier is unreadable: " + e.getMessage(), e);
        }
        return new IntentModel(FeatureSpace.restore(s.terms(), s.idf()), classifier);
    }
}
