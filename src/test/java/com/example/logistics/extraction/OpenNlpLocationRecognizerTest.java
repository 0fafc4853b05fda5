package com.example.logistics.extraction;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.example.logistics.extraction.LocationRecognizer.RecognizedSpan;
import com.example.logistics.model.EntitySet;

import opennlp.tools.namefind.BioCodec;
import opennlp.tools.namefind.NameFinderME;
import opennlp.tools.namefind.NameSampleDataStream;
import opennlp.tools.namefind.TokenNameFinderFactory;
import opennlp.tools.namefind.TokenNameFinderModel;
import opennlp.tools.util.ObjectStream;
import opennlp.tools.util.ObjectStreamUtils;
import opennlp.tools.util.TrainingParameters;

import static org.junit.jupiter.api.Assertions.*;

class OpenNlpLocationRecognizerTest {

    private static final List<String> PLACES = List.of(
        "Nashik", "Lonavala", "Satara", "Kolhapur", "Nagpur", "Indore", "Jaipur", "Surat", "Vadodara", "Mysore");
    private static final List<String> PEOPLE = List.of("Ramesh", "Sunita", "Arjun", "Meera");

    private static TokenNameFinderModel locationModel;

    @TempDir
    Path tempDir;

    // Small in-memory name finder: pickup/drop sentences over places, plus person names it must ignore
    @BeforeAll
    static void trainLocationModel() throws Exception {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < PLACES.size(); i++) {
            String from = PLACES.get(i);
            String to = PLACES.get((i + 1) % PLACES.size());
            String person = PEOPLE.get(i % PEOPLE.size());
            lines.add("pickup from <START:location> " + from + " <END> , send it to <START:location> " + to + " <END> today .");
            lines.add("parcel from <START:location> " + from + " <END> to <START:location> " + to + " <END> please .");
            lines.add("deliver to <START:location> " + to + " <END> tomorrow .");
            lines.add("ask <START:person> " + person + " <END> to collect it from <START:location> " + from + " <END> .");
            lines.add("call <START:person> " + person + " <END> about the order .");
        }
        List<String> corpus = new ArrayList<>();
        for (int round = 0; round < 3; round++) {
            corpus.addAll(lines);
        }

        TrainingParameters params = TrainingParameters.defaultParams();
        params.put(TrainingParameters.ITERATIONS_PARAM, 100);
        params.put(TrainingParameters.CUTOFF_PARAM, 1);

        try (ObjectStream<String> text = ObjectStreamUtils.createObjectStream(corpus);
             NameSampleDataStream samples = new NameSampleDataStream(text)) {
            locationModel = NameFinderME.train("en", null, samples, params,
                new TokenNameFinderFactory(null, Collections.emptyMap(), new BioCodec()));
        }
    }

    @Test
    void missingModelDisablesRecognition() {
        OpenNlpLocationRecognizer recognizer = OpenNlpLocationRecognizer.fromPath(tempDir.resolve("absent.bin"));

        assertFalse(recognizer.isEnabled());
        assertTrue(recognizer.recognize("pickup from Lonavala to Pune").isEmpty());
    }

    @Test
    void unreadableModelDisablesRecognition() throws Exception {
        Path model = tempDir.resolve("broken.bin");
        Files.writeString(model, "not a model");

        OpenNlpLocationRecognizer recognizer = OpenNlpLocationRecognizer.fromPath(model);

        assertFalse(recognizer.isEnabled());
    }

    @Test
    void disabledRecognizerFeedsGazetteerOnlyExtraction() {
        EntityExtractor extractor = new EntityExtractor(new OpenNlpLocationRecognizer(null));

        assertEquals("Andheri", extractor.extract("Andheri se Powai").pickupLocation());
    }

    @Test
    void loadedModelReturnsLocationSpansInTextOrder() {
        OpenNlpLocationRecognizer recognizer = new OpenNlpLocationRecognizer(locationModel);

        List<RecognizedSpan> spans = recognizer.recognize("pickup from Nashik, send it to Lonavala today.");

        assertTrue(recognizer.isEnabled());
        assertEquals(List.of(new RecognizedSpan("Nashik", "location"), new RecognizedSpan("Lonavala", "location")),
            spans);
    }

    @Test
    void personNamesAreNotLocations() {
        OpenNlpLocationRecognizer recognizer = new OpenNlpLocationRecognizer(locationModel);

        List<RecognizedSpan> spans = recognizer.recognize("ask Ramesh to collect it from Satara.");

        assertEquals(List.of(new RecognizedSpan("Satara", "location")), spans);
    }

    @Test
    void recognizedPlacesOutsideGazetteerBecomePickupAndDrop() {
        EntityExtractor extractor = new EntityExtractor(new OpenNlpLocationRecognizer(locationModel));

        EntitySet entities = extractor.extract("pickup from Nashik, send it to Lonavala today.");

        assertEquals("Nashik", entities.pickupLocation());
        assertEquals("Lonavala", entities.dropLocation());
    }
}
