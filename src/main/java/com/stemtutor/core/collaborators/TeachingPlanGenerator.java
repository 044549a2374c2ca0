package com.stemtutor.core.collaborators;

import com.stemtutor.core.llm.LlmService;
import com.stemtutor.core.model.TeachingPlan;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Produces an HTML teaching plan that explains the approach without solving the problem.
 */
@Component
public class TeachingPlanGenerator {

    static final String COLLABORATOR = "teaching_plan";

    private static final int PROBLEM_EXCERPT = 200;

    private static final String SYSTEM_PROMPT = """
            You are an expert STEM teacher creating a step-by-step teaching plan.
            Adapt your approach to the subject:
            - Math: formulas, equations, algebraic steps
            - Physics: units, laws, free-body diagrams
            - Chemistry: chemical equations, stoichiometry, periodic trends
            - Biology: processes, systems, classifications
            - Computer Science: algorithms, data structures, logic

            Requirements for htmlContent:
            1. Use <h3> for section headers
            2. Write 3-5 major steps in an <ol> list
            3. Wrap important concepts in <span class='step-trigger'>keyword</span>
            4. Explain the approach only; do not solve the problem yet
            5. Use only <p>, <ol>, <li>, <h3> and <span> tags
            List the wrapped concepts in keywords.

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final CollaboratorInvoker invoker;

    public TeachingPlanGenerator(LlmService llmService, CollaboratorInvoker invoker) {
        this.llmService = llmService;
        this.invoker = invoker;
    }

    public CollaboratorResult<TeachingPlan> generate(String topic, String problem) {
        String userPrompt = "Topic: " + topic + "\nProblem: " + excerpt(problem) + "\n\nCreate the teaching plan.";
        return invoker.invoke(COLLABORATOR,
                () -> llmService.structuredCall(SYSTEM_PROMPT, userPrompt, TeachingPlan.class),
                () -> fallback(topic));
    }

    static TeachingPlan fallback(String topic) {
        return new TeachingPlan("<p>Step-by-step approach for " + topic + "</p>", List.of());
    }

    private static String excerpt(String problem) {
        return problem.length() <= PROBLEM_EXCERPT ? problem : problem.substring(0, PROBLEM_EXCERPT);
    }
}
