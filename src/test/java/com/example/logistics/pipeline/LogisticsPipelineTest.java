package com.example.logistics.pipeline;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import com.example.logistics.config.AppConfig;
import com.example.logistics.decision.ActionDecider;
import com.example.logistics.extraction.EntityExtractor;
import com.example.logistics.extraction.LocationRecognizer;
import com.example.logistics.filter.PiiFilter;
import com.example.logistics.model.ActionDirective;
import com.example.logistics.model.EntitySet;
import com.example.logistics.model.Intent;
import com.example.logistics.model.IntentResult;
import com.example.logistics.model.PipelineResult;
import com.example.logistics.nlp.IntentClassifier;
import com.example.logistics.nlp.IntentModelStore;
import com.example.logistics.telemetry.AssistantMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import static org.junit.jupiter.api.Assertions.*;

class LogisticsPipelineTest {

    @TempDir
    Path tempDir;

    private IntentClassifier classifier;
    private LogisticsPipeline pipeline;

    @BeforeEach
    void setUp() {
        classifier = new IntentClassifier(
            AppConfig.withModelPath(tempDir.resolve("intent-model.json")), new IntentModelStore());
        pipeline = new LogisticsPipeline(
            classifier,
            new EntityExtractor(LocationRecognizer.none()),
            new ActionDecider(),
            new PiiFilter(),
            new AssistantMetrics());
    }

    private void train() throws Exception {
        classifier.train(Path.of(LogisticsPipelineTest.class.getResource("/intents.csv").toURI()));
    }

    @Test
    void untrainedModelDegradesToModelUnavailable() {
        PipelineResult result = pipeline.process("Pickup karna hai Andheri se Powai, 2 boxes hai");

        assertNull(result.intent());
        assertEquals(ActionDirective.MODEL_UNAVAILABLE, result.nextAction().nextAction());
        assertEquals(new EntitySet("Andheri", "Powai", null, 2, null, false, null, null), result.entities());
    }

    @Test
    void classifiesExtractsAndDecides() throws Exception {
        train();

        PipelineResult result = pipeline.process("  complaint register karo, call 9876543210  ");

        assertEquals("complaint register karo, call 9876543210", result.query());
        assertEquals(Intent.RAISE_COMPLAINT, result.intent().intent());
        assertEquals("9876543210", result.entities().phoneNumber());
        assertEquals(ActionDirective.CREATE_TICKET, result.nextAction().nextAction());
        assertEquals("9876543210", result.nextAction().details().get("contact"));
    }

    @Test
    void bookingWithoutTimeOrPhoneOffersOptionalFields() {
        PipelineResult result = pipeline.process("Pickup karna hai Andheri se Powai, 2 boxes hai");
        assertEquals(new EntitySet("Andheri", "Powai", null, 2, null, false, null, null), result.entities());

        ActionDirective directive = pipeline.decide(IntentResult.of(Intent.BOOK_PICKUP, 0.9), result.entities());

        assertEquals(ActionDirective.ASK_OPTIONAL_FIELDS, directive.nextAction());
        assertEquals(Boolean.TRUE, directive.canProceed());
        assertEquals(List.of("pickup_time", "phone_number"), directive.optionalFields());
    }

    @Test
    void missingFieldsAreAskedFor() throws Exception {
        train();

        PipelineResult result = pipeline.process("serviceable hai kya");

        assertEquals(Intent.CHECK_SERVICEABILITY, result.intent().intent());
        assertEquals(ActionDirective.ASK_MISSING_FIELDS, result.nextAction().nextAction());
        assertEquals(List.of("drop_location"), result.nextAction().missingFields());
    }

    @Test
    void resultSerializesWithNextActionKey() throws Exception {
        train();

        JsonNode json = new ObjectMapper().valueToTree(pipeline.process("upload document"));

        assertEquals("DOCUMENT_UPLOAD_QUERY", json.get("intent").get("intent").asText());
        assertEquals("PROVIDE_UPLOAD_LINK", json.get("next_action").get("next_action").asText());
        assertFalse(json.get("entities").get("fragile").asBoolean());
        assertTrue(json.get("entities").has("pickup_location"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "\t\n"})
    void blankQueryIsRejected(String query) {
        var e = assertThrows(IllegalArgumentException.class, () -> pipeline.process(query));
        assertEquals("Query text cannot be empty", e.getMessage());
    }
}
