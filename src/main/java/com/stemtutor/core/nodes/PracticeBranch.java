package com.stemtutor.core.nodes;

import com.stemtutor.core.collaborators.PracticeGenerator;
import com.stemtutor.core.state.TutorState;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component
@Order(1)
public class PracticeBranch implements TeachingBranch {

    private final PracticeGenerator generator;

    public PracticeBranch(PracticeGenerator generator) {
        this.generator = generator;
    }

    @Override
    public String name() {
        return "practice";
    }

    @Override
    public Map<String, Object> apply(TutorState state) {
        var result = generator.generate(state.lessonTopic(), state.problemText());
        var delta = new HashMap<String, Object>();
        delta.put("practiceContent", render(result.value().markdown(), result.value().hint()));
        if (result.degraded()) {
            delta.put("degradedSteps", state.degradedStepsWith(name()));
        }
        return delta;
    }

    @Override
    public Map<String, Object> fallback(TutorState state) {
        var practice = PracticeGenerator.fallback(state.lessonTopic());
        return Map.of(
                "practiceContent", render(practice.markdown(), practice.hint()),
                "degradedSteps", state.degradedStepsWith(name()));
    }

    private static String render(String markdown, String hint) {
        if (hint == null || hint.isBlank()) {
            return markdown;
        }
        return markdown + "\n\n> Hint: " + hint;
    }
}
