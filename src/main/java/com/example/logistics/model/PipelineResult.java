package com.example.logistics.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PipelineResult(
    String query,
    IntentResult intent,
    EntitySet entities,
    @JsonProperty("next_action") ActionDirective nextAction
) {}
