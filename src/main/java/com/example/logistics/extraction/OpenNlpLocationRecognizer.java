package com.example.logistics.extraction;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import opennlp.tools.namefind.NameFinderME;
import opennlp.tools.namefind.TokenNameFinderModel;
import opennlp.tools.tokenize.SimpleTokenizer;
import opennlp.tools.util.Span;

public class OpenNlpLocationRecognizer implements LocationRecognizer {

    private static final Logger log = LoggerFactory.getLogger(OpenNlpLocationRecognizer.class);
    static final Set<String> LOCATION_TYPES = Set.of("location", "gpe", "loc");

    private final TokenNameFinderModel model;

    public OpenNlpLocationRecognizer(TokenNameFinderModel model) {
        this.model = model;
    }

    public static OpenNlpLocationRecognizer fromPath(Path modelPath) {
        if (!Files.exists(modelPath)) {
            log.warn("Location model not found at {}, using gazetteer matching only", modelPath);
            return new OpenNlpLocationRecognizer(null);
        }
        try (InputStream in = Files.newInputStream(modelPath)) {
            TokenNameFinderModel model = new TokenNameFinderModel(in);
            log.info("OpenNLP location model loaded from {}", modelPath);
            return new OpenNlpLocationRecognizer(model);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load location model {}, using gazetteer matching only: {}", modelPath, e.toString());
            return new OpenNlpLocationRecognizer(null);
        }
    }

    public boolean isEnabled() {
        return model != null;
    }

    @Override
    public List<RecognizedSpan> recognize(String text) {
        if (model == null || text == null || text.isBlank()) return List.of();

        Span[] tokenSpans = SimpleTokenizer.INSTANCE.tokenizePos(text);
        String[] tokens = Span.spansToStrings(tokenSpans, text);

        // NameFinderME keeps per-document state, so one per call
        NameFinderME finder = new NameFinderME(model);
        Span[] names = finder.find(tokens);

        List<RecognizedSpan> found = new ArrayList<>(names.length);
        for (Span name : names) {
            String type = name.getType() == null ? "" : name.getType().toLowerCase(Locale.ROOT);
            if (!LOCATION_TYPES.contains(type)) continue;
            int start = tokenSpans[name.getStart()].getStart();
            int end = tokenSpans[name.getEnd() - 1].getEnd();
            found.add(new RecognizedSpan(text.substring(start, end), type));
        }
        return found;
    }
}
