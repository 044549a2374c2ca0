package com.stemtutor.core.collaborators;

import com.stemtutor.core.llm.LlmService;
import com.stemtutor.core.model.StepExplanation;
import org.springframework.stereotype.Component;

/**
 * Explains a single solution step in more depth when the student asks about it.
 */
@Component
public class StepExplainer {

    static final String COLLABORATOR = "step_explainer";

    private static final String SYSTEM_PROMPT = """
            You are a patient STEM tutor. A student clicked on one step of a worked solution
            and wants to understand it better. Explain in 2-4 sentences why the step is taken
            and how it follows from the previous work. Use LaTeX with $ delimiters for math.
            Put the explanation in explanation and echo the topic in topic.
            Escape every LaTeX backslash in JSON strings, for example "\\\\frac{1}{2}".

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final CollaboratorInvoker invoker;

    public StepExplainer(LlmService llmService, CollaboratorInvoker invoker) {
        this.llmService = llmService;
        this.invoker = invoker;
    }

    public CollaboratorResult<StepExplanation> explain(String stepText, String context, String topic) {
        String userPrompt = "Topic: " + topic + "\nContext: " + context + "\nStep: " + stepText;
        return invoker.invoke(COLLABORATOR,
                () -> llmService.structuredCall(SYSTEM_PROMPT, userPrompt, StepExplanation.class),
                () -> new StepExplanation("Explanation for " + stepText, topic));
    }
}
