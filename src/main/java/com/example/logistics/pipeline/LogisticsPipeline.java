package com.example.logistics.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.logistics.decision.ActionDecider;
import com.example.logistics.extraction.EntityExtractor;
import com.example.logistics.filter.PiiFilter;
import com.example.logistics.model.ActionDirective;
import com.example.logistics.model.EntityField;
import com.example.logistics.model.EntitySet;
import com.example.logistics.model.IntentResult;
import com.example.logistics.model.PipelineResult;
import com.example.logistics.nlp.IntentClassifier;
import com.example.logistics.nlp.IntentModelException;
import com.example.logistics.telemetry.AssistantMetrics;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

@Component
public class LogisticsPipeline {

    private static final Logger log = LoggerFactory.getLogger(LogisticsPipeline.class);

    private final IntentClassifier intentClassifier;
    private final EntityExtractor entityExtractor;
    private final ActionDecider actionDecider;
    private final PiiFilter piiFilter;
    private final AssistantMetrics metrics;
    private final Tracer tracer;

    public LogisticsPipeline(
        IntentClassifier intentClassifier,
        EntityExtractor entityExtractor,
        ActionDecider actionDecider,
        PiiFilter piiFilter,
        AssistantMetrics metrics
    ) {
        this.intentClassifier = intentClassifier;
        this.entityExtractor = entityExtractor;
        this.actionDecider = actionDecider;
        this.piiFilter = piiFilter;
        this.metrics = metrics;
        this.tracer = GlobalOpenTelemetry.getTracer("logistics-assistant");
    }

    public PipelineResult process(String text) {
        String query = text == null ? "" : text.strip();
        if (query.isEmpty()) {
            throw new IllegalArgumentException("Query text cannot be empty");
        }

        Span span = tracer.spanBuilder("logistics_request")
            .setAttribute("logistics.query_length", (long) query.length())
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            // 1. Classify intent; an unusable model degrades the directive, not the request
            IntentResult intent = null;
            try {
                intent = intentClassifier.classify(query);
                metrics.recordIntent(intent.intent().name(), intent.confidence());
            } catch (IntentModelException e) {
                log.warn("Intent model unavailable, skipping classification: {}", e.getMessage());
                metrics.recordModelUnavailable(e.getClass().getSimpleName());
                span.setAttribute("logistics.model_unavailable", true);
            }

            // 2. Extract entities
            EntitySet entities = entityExtractor.extract(query);
            for (EntityField field : EntityField.values()) {
                if (field != EntityField.FRAGILE && !field.isAbsentIn(entities)) {
                    metrics.recordEntity(field.key());
                }
            }
            if (entities.fragile()) {
                metrics.recordEntity(EntityField.FRAGILE.key());
            }

            // 3. Decide next action
            ActionDirective directive = intent != null
                ? actionDecider.decide(intent, entities)
                : ActionDirective.modelUnavailable();

            String intentName = intent != null ? intent.intent().name() : "none";
            metrics.recordDirective(directive.nextAction(), intentName);
            span.setAttribute("logistics.intent", intentName);
            span.setAttribute("logistics.next_action", directive.nextAction());

            log.info("Pipeline complete: query=\"{}\" intent={} confidence={} next_action={}",
                piiFilter.preview(query), intentName,
                intent != null ? intent.confidence() : 0.0, directive.nextAction());

            return new PipelineResult(query, intent, entities, directive);

        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            log.error("Pipeline failed for query \"{}\": {}", piiFilter.preview(query), e.getMessage());
            throw e;

        } finally {
            span.end();
        }
    }
}
