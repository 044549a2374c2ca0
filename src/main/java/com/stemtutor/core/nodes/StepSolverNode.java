package com.stemtutor.core.nodes;

import com.stemtutor.core.collaborators.SolutionGenerator;
import com.stemtutor.core.graph.StepName;
import com.stemtutor.core.state.TutorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Produces the step-by-step worked solution and the final answer.
 */
@Component
public class StepSolverNode {

    private static final Logger log = LoggerFactory.getLogger(StepSolverNode.class);

    private final SolutionGenerator generator;

    public StepSolverNode(SolutionGenerator generator) {
        this.generator = generator;
    }

    public Map<String, Object> apply(TutorState state) {
        var result = generator.solve(state.lessonTopic(), state.problemText());
        var solution = result.value();
        log.info("Solved in {} steps", solution.steps().size());

        var concepts = new LinkedHashSet<>(state.keyConcepts());
        concepts.addAll(solution.keyConcepts());

        var delta = new HashMap<String, Object>();
        delta.put("solutionSteps", solution.steps());
        delta.put("workedSolution", solution.finalAnswer() != null ? solution.finalAnswer() : "");
        delta.put("keyConcepts", List.copyOf(concepts));
        if (result.degraded()) {
            delta.put("degradedSteps", state.degradedStepsWith(StepName.STEP_SOLVER.id()));
        }
        return delta;
    }
}
