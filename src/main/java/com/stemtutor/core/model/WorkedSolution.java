package com.stemtutor.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Complete step-by-step solution produced by the solution model.
 */
public record WorkedSolution(
        String problemRestatement,
        List<SolutionStep> steps,
        String finalAnswer,
        List<String> keyConcepts
) implements Serializable {

    public WorkedSolution {
        steps = steps != null ? List.copyOf(steps) : List.of();
        keyConcepts = keyConcepts != null ? List.copyOf(keyConcepts) : List.of();
    }
}
