package com.stemtutor.core.model;

import java.io.Serializable;

/**
 * Plain-language explanation of a single solution step.
 */
public record StepExplanation(
        String explanation,
        String topic
) implements Serializable {}
