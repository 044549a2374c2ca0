package com.stemtutor.core.nodes;

import com.stemtutor.core.collaborators.TeachingPlanGenerator;
import com.stemtutor.core.graph.StepName;
import com.stemtutor.core.state.TutorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Produces the teaching plan for the session topic.
 */
@Component
public class TeachingArchitectNode {

    private static final Logger log = LoggerFactory.getLogger(TeachingArchitectNode.class);

    private final TeachingPlanGenerator generator;

    public TeachingArchitectNode(TeachingPlanGenerator generator) {
        this.generator = generator;
    }

    public Map<String, Object> apply(TutorState state) {
        String topic = state.lessonTopic();
        log.info("Creating teaching plan for '{}'", topic);
        var result = generator.generate(topic, state.problemText());

        var delta = new HashMap<String, Object>();
        delta.put("teachingPlan", result.value().htmlContent());
        delta.put("keyConcepts", result.value().keywords());
        if (result.degraded()) {
            delta.put("degradedSteps", state.degradedStepsWith(StepName.TEACHING_ARCHITECT.id()));
        }
        return delta;
    }
}
