package com.stemtutor.core.nodes;

import com.stemtutor.core.collaborators.ReferenceMediaFinder;
import com.stemtutor.core.state.TutorState;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component
@Order(2)
public class ReferenceMediaBranch implements TeachingBranch {

    private final ReferenceMediaFinder finder;

    public ReferenceMediaBranch(ReferenceMediaFinder finder) {
        this.finder = finder;
    }

    @Override
    public String name() {
        return "reference_media";
    }

    @Override
    public Map<String, Object> apply(TutorState state) {
        var result = finder.find(state.lessonTopic());
        var delta = new HashMap<String, Object>();
        delta.put("referenceMediaUrl", result.value());
        if (result.degraded()) {
            delta.put("degradedSteps", state.degradedStepsWith(name()));
        }
        return delta;
    }

    @Override
    public Map<String, Object> fallback(TutorState state) {
        return Map.of(
                "referenceMediaUrl", ReferenceMediaFinder.searchUrl(state.lessonTopic()),
                "degradedSteps", state.degradedStepsWith(name()));
    }
}
