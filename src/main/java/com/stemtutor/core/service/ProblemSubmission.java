package com.stemtutor.core.service;

import com.stemtutor.core.model.InputKind;

/**
 * A problem submitted for analysis. {@code sessionId} may be null, in which case one is generated.
 */
public record ProblemSubmission(
        String sessionId,
        String identity,
        InputKind inputKind,
        String payload
) {}
