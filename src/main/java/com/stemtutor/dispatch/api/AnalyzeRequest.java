package com.stemtutor.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /v1/analyze.
 *
 * @param type      "text" or "image"
 * @param content   the problem text, or the image as base64 (a {@code data:} URI prefix is accepted)
 * @param identity  rate-limit subject; nullable, a random identity is used when absent
 * @param sessionId session to (re)start; nullable, one is generated when absent
 */
public record AnalyzeRequest(
    String type,
    String content,
    String identity,
    @JsonProperty("session_id") String sessionId
) {}
