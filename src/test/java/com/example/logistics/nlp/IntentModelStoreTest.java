package com.example.logistics.nlp;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import com.example.logistics.model.Intent;
import com.example.logistics.model.TrainingExample;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import opennlp.tools.ml.maxent.io.BinaryQNModelWriter;
import opennlp.tools.ml.maxent.quasinewton.QNModel;
import opennlp.tools.ml.model.Context;

import static org.junit.jupiter.api.Assertions.*;

class IntentModelStoreTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private final IntentModelStore store = new IntentModelStore();
    private IntentModel model;

    @BeforeEach
    void setUp() {
        List<TrainingExample> examples = List.of(
            new TrainingExample("track my order", Intent.TRACK_ORDER),
            new TrainingExample("track the parcel", Intent.TRACK_ORDER),
            new TrainingExample("track shipment now", Intent.TRACK_ORDER),
            new TrainingExample("cancel my order", Intent.CANCEL_ORDER),
            new TrainingExample("cancel the parcel", Intent.CANCEL_ORDER),
            new TrainingExample("cancel shipment now", Intent.CANCEL_ORDER));
        model = new IntentTrainer().fit(examples, TrainingOptions.defaults()).model();
    }

    @Test
    void savedModelPredictsIdentically() {
        Path path = tempDir.resolve("nested/dir/model.json");
        store.save(model, path);

        IntentModel restored = store.load(path).orElseThrow();

        assertEquals(model.labels(), restored.labels());
        assertEquals(model.features().terms(), restored.features().terms());
        for (String query : List.of("track karo", "cancel it", "something else")) {
            assertEquals(model.predict(query), restored.predict(query), query);
        }
        assertEquals(Intent.CANCEL_ORDER, restored.predict("please CANCEL").intent());
    }

    @Test
    void saveReplacesExistingFile() throws Exception {
        Path path = tempDir.resolve("model.json");
        Files.writeString(path, "old");

        store.save(model, path);

        assertTrue(store.load(path).isPresent());
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of(path), files.toList());
        }
    }

    @Test
    void failedSaveLeavesNoTempFile() throws Exception {
        Path path = tempDir.resolve("model.json");
        Files.createDirectories(path);
        Files.writeString(path.resolve("occupied"), "x");

        assertThrows(UncheckedIOException.class, () -> store.save(model, path));
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of(path), files.toList());
        }
    }

    @Test
    void missingFileLoadsNothing() {
        assertEquals(Optional.empty(), store.load(tempDir.resolve("absent.json")));
    }

    @Test
    void emptyFileIsCorrupt() throws Exception {
        Path path = tempDir.resolve("empty.json");
        Files.write(path, new byte[0]);

        assertThrows(CorruptModelException.class, () -> store.load(path));
    }

    @Test
    void garbageIsCorrupt() {
        assertThrows(CorruptModelException.class,
            () -> store.fromBytes("not a model".getBytes(StandardCharsets.UTF_8)));
    }

    static Stream<Arguments> tamperedSnapshots() {
        return Stream.of(
            Arguments.of("format", (Consumer<ObjectNode>) n -> n.put("format", 1)),
            Arguments.of("short idf", (Consumer<ObjectNode>) n -> ((ArrayNode) n.get("idf")).remove(0)),
            Arguments.of("duplicate term", (Consumer<ObjectNode>) n -> ((ArrayNode) n.get("terms")).set(1, TextNode.valueOf(n.get("terms").get(0).asText()))),
            Arguments.of("missing terms", (Consumer<ObjectNode>) n -> n.remove("terms")),
            Arguments.of("missing classifier", (Consumer<ObjectNode>) n -> n.remove("classifier")),
            Arguments.of("truncated classifier", (Consumer<ObjectNode>) n -> n.put("classifier", new byte[] {0, 2, 'Q', 'N'})),
            Arguments.of("unknown outcome", (Consumer<ObjectNode>) n -> n.put("classifier", greetingClassifier()))
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("tamperedSnapshots")
    void rejectsInconsistentSnapshot(String description, Consumer<ObjectNode> tamper) throws Exception {
        ObjectNode snapshot = (ObjectNode) MAPPER.readTree(store.toBytes(model));
        tamper.accept(snapshot);

        assertThrows(CorruptModelException.class, () -> store.fromBytes(MAPPER.writeValueAsBytes(snapshot)));
    }

    private static byte[] greetingClassifier() {
        QNModel qn = new QNModel(
            new Context[] {new Context(new int[] {0, 1}, new double[] {0.1, -0.1})},
            new String[] {LogisticClassifier.BIAS},
            new String[] {"GREETING", "TRACK_ORDER"});
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            new BinaryQNModelWriter(qn, new DataOutputStream(out)).persist();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }
}
