package com.stemtutor.core.collaborators;

import com.stemtutor.core.llm.LlmService;
import com.stemtutor.core.model.SolutionStep;
import com.stemtutor.core.model.WorkedSolution;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Solves the problem step by step and states the final answer.
 */
@Component
public class SolutionGenerator {

    static final String COLLABORATOR = "step_solver";

    private static final String SYSTEM_PROMPT = """
            You are an expert STEM tutor solving a problem step by step for a student.

            Requirements:
            1. Restate the problem clearly in one sentence (problemRestatement)
            2. Break the solution into 3-6 steps, numbered from 1 in index
            3. Give each step a short title and a clear explanation
            4. Put math in expression using LaTeX with $ delimiters, or an empty string
            5. Give the finalAnswer with units where applicable
            6. List 2-4 keyConcepts used
            Escape every LaTeX backslash in JSON strings, for example "\\\\frac{1}{2}".

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final CollaboratorInvoker invoker;

    public SolutionGenerator(LlmService llmService, CollaboratorInvoker invoker) {
        this.llmService = llmService;
        this.invoker = invoker;
    }

    public CollaboratorResult<WorkedSolution> solve(String topic, String problem) {
        String userPrompt = "Topic: " + topic + "\nProblem: " + problem + "\n\nSolve this problem step by step.";
        return invoker.invoke(COLLABORATOR,
                () -> llmService.structuredCall(SYSTEM_PROMPT, userPrompt, WorkedSolution.class),
                SolutionGenerator::fallback);
    }

    static WorkedSolution fallback() {
        return new WorkedSolution(
                "",
                List.of(new SolutionStep(1, "Error", "Failed to generate solution", "")),
                "Solution generation failed",
                List.of());
    }
}
