package com.stemtutor.core.collaborators;

import com.stemtutor.core.llm.LlmService;
import com.stemtutor.core.model.PracticeProblem;
import org.springframework.stereotype.Component;

/**
 * Writes one practice problem on the same topic, at the same difficulty.
 */
@Component
public class PracticeGenerator {

    static final String COLLABORATOR = "practice";

    private static final String SYSTEM_PROMPT = """
            You are a STEM tutor writing one practice problem for a student who just studied an example.
            The new problem must exercise the same topic at the same difficulty, with different numbers or context.
            Write it in markdown under a "## Try it yourself!" heading. Do not include the solution.
            Give a one-sentence hint in hint.

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final CollaboratorInvoker invoker;

    public PracticeGenerator(LlmService llmService, CollaboratorInvoker invoker) {
        this.llmService = llmService;
        this.invoker = invoker;
    }

    public CollaboratorResult<PracticeProblem> generate(String topic, String problem) {
        String userPrompt = "Topic: " + topic + "\nExample problem: " + problem;
        return invoker.invoke(COLLABORATOR,
                () -> llmService.structuredCall(SYSTEM_PROMPT, userPrompt, PracticeProblem.class),
                () -> fallback(topic));
    }

    public static PracticeProblem fallback(String topic) {
        return new PracticeProblem(
                "## Try it yourself!\n\nWrite and solve a problem of your own on " + topic
                        + ", changing the numbers from the example.",
                "Follow the same steps as the worked solution.");
    }
}
