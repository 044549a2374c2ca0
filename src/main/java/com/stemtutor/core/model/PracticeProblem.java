package com.stemtutor.core.model;

import java.io.Serializable;

/**
 * A practice exercise in markdown, with an optional hint.
 */
public record PracticeProblem(
        String markdown,
        String hint
) implements Serializable {}
