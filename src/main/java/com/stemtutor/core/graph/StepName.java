package com.stemtutor.core.graph;

import java.util.Arrays;

/**
 * Identifiers of the steps in the tutoring graph.
 */
public enum StepName {
    DISPATCH_INPUT("dispatch_input"),
    TEXT_CLASSIFIER("text_classifier"),
    VISION_CLASSIFIER("vision_classifier"),
    EVALUATE_CONFIDENCE("evaluate_confidence"),
    CLARIFICATION("clarification"),
    DISAMBIGUATION("disambiguation"),
    TEACHING_ARCHITECT("teaching_architect"),
    STEP_SOLVER("step_solver"),
    PARALLEL_TEACHING("parallel_teaching"),
    ASSEMBLER("assembler");

    private final String id;

    StepName(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static StepName fromId(String id) {
        return Arrays.stream(values())
                .filter(s -> s.id.equals(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown step: " + id));
    }
}
