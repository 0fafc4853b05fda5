package com.example.logistics.nlp;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.example.logistics.model.Intent;
import com.example.logistics.model.TrainingExample;

import static org.junit.jupiter.api.Assertions.*;

class DatasetReaderTest {

    private final DatasetReader reader = new DatasetReader();

    private static InputStream csv(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void readsFixtureWithTenExamplesPerIntent() throws Exception {
        List<TrainingExample> examples;
        try (InputStream in = getClass().getResourceAsStream("/intents.csv")) {
            examples = reader.read(in);
        }

        assertEquals(100, examples.size());
        Map<Intent, Long> perIntent = examples.stream()
            .collect(Collectors.groupingBy(TrainingExample::intent, Collectors.counting()));
        assertEquals(10, perIntent.size());
        perIntent.values().forEach(count -> assertEquals(10L, count));
        assertEquals(new TrainingExample("Bhai price batao Mumbai to Delhi 5kg", Intent.CHECK_RATE), examples.get(0));
    }

    @Test
    void ignoresExtraColumnsAndQuotedCommas() {
        List<TrainingExample> examples = reader.read(csv(
            "id,text,intent\n"
                + "1,\"rate batao, Pune to Delhi\",CHECK_RATE\n"
                + "2,track karo,TRACK_ORDER\n"));

        assertEquals(List.of(
            new TrainingExample("rate batao, Pune to Delhi", Intent.CHECK_RATE),
            new TrainingExample("track karo", Intent.TRACK_ORDER)), examples);
    }

    @Test
    void skipsRowsWithBlankText() {
        List<TrainingExample> examples = reader.read(csv(
            "text,intent\n"
                + ",CHECK_RATE\n"
                + "   ,TRACK_ORDER\n"
                + "cancel karo,CANCEL_ORDER\n"));

        assertEquals(1, examples.size());
        assertEquals(Intent.CANCEL_ORDER, examples.get(0).intent());
    }

    @Test
    void rejectsMissingIntentColumn() {
        var e = assertThrows(DatasetFormatException.class,
            () -> reader.read(csv("text,label\ntrack karo,TRACK_ORDER\n")));
        assertEquals("Dataset is missing required column 'intent'", e.getMessage());
    }

    @Test
    void rejectsUnknownIntentWithLineNumber() {
        var e = assertThrows(DatasetFormatException.class,
            () -> reader.read(csv("text,intent\ntrack karo,TRACK_ORDER\nhello,GREETING\n")));
        assertEquals("Unknown intent 'GREETING' on line 3", e.getMessage());
    }

    @Test
    void rejectsHeaderOnlyDataset() {
        var e = assertThrows(DatasetFormatException.class, () -> reader.read(csv("text,intent\n")));
        assertEquals("Dataset contains no examples", e.getMessage());
    }

    @Test
    void missingFileIsADatasetError(@TempDir Path tempDir) {
        Path missing = tempDir.resolve("missing.csv");

        var e = assertThrows(DatasetFormatException.class, () -> reader.read(missing));
        assertTrue(e.getMessage().startsWith("Dataset not found"));
    }

    @Test
    void labelsAreMatchedExactly() {
        Function<String, InputStream> withLabel = label -> csv("text,intent\ntrack karo," + label + "\n");

        assertThrows(DatasetFormatException.class, () -> reader.read(withLabel.apply("track_order")));
        assertEquals(1, reader.read(withLabel.apply("TRACK_ORDER")).size());
    }
}
