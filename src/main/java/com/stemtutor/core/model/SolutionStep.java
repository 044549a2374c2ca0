package com.stemtutor.core.model;

import java.io.Serializable;

/**
 * One step of a worked solution. {@code expression} holds LaTeX, or an empty string.
 */
public record SolutionStep(
        int index,
        String title,
        String explanation,
        String expression
) implements Serializable {}
