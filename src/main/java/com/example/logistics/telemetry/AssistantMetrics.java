package com.example.logistics.telemetry;

import org.springframework.stereotype.Component;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

@Component
public class AssistantMetrics {

    private final DoubleHistogram intentConfidence;
    private final LongCounter directiveCount;
    private final LongCounter entityExtracted;
    private final LongCounter modelUnavailable;

    public AssistantMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter("logistics-assistant");

        this.intentConfidence = meter.histogramBuilder("logistics.intent.confidence")
            .setDescription("Posterior probability of the predicted intent")
            .build();

        this.directiveCount = meter.counterBuilder("logistics.directive.count")
            .setDescription("Number of directives issued, by next action")
            .build();

        this.entityExtracted = meter.counterBuilder("logistics.entity.extracted")
            .setDescription("Number of entity fields filled by extraction")
            .build();

        this.modelUnavailable = meter.counterBuilder("logistics.model.unavailable")
            .setDescription("Requests served without a usable intent model")
            .build();
    }

    public void recordIntent(String intent, double confidence) {
        intentConfidence.record(confidence, Attributes.of(
            AttributeKey.stringKey("logistics.intent"), intent
        ));
    }

    public void recordDirective(String nextAction, String intent) {
        directiveCount.add(1, Attributes.of(
            AttributeKey.stringKey("logistics.next_action"), nextAction,
            AttributeKey.stringKey("logistics.intent"), intent
        ));
    }

    public void recordEntity(String field) {
        entityExtracted.add(1, Attributes.of(
            AttributeKey.stringKey("logistics.entity_field"), field
        ));
    }

    public void recordModelUnavailable(String reason) {
        modelUnavailable.add(1, Attributes.of(
            AttributeKey.stringKey("logistics.reason"), reason
        ));
    }
}
