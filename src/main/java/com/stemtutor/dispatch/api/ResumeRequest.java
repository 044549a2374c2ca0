package com.stemtutor.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /v1/resume.
 */
public record ResumeRequest(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("selected_topic") String selectedTopic
) {}
