package com.stemtutor.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /v1/explain-step.
 */
public record ExplainStepRequest(
    @JsonProperty("step_text") String stepText,
    String context,
    String topic
) {}
