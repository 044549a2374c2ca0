package com.stemtutor.core.nodes;

import com.stemtutor.core.collaborators.TopicClassifier;
import com.stemtutor.core.model.SessionStatus;
import com.stemtutor.core.state.TutorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Halts the session with a list of candidate topics for the student to pick from.
 * The list is never empty: when the classifier offered no alternatives it is
 * seeded from the detected topic and the default candidates.
 */
@Component
public class DisambiguationNode {

    private static final Logger log = LoggerFactory.getLogger(DisambiguationNode.class);

    public Map<String, Object> apply(TutorState state) {
        List<String> candidates = candidatesFor(state);
        log.info("Halting session for topic selection among {}", candidates);

        var html = new StringBuilder("<p>Please select the topic:</p><ul>");
        for (String candidate : candidates) {
            String escaped = HtmlUtils.htmlEscape(candidate);
            html.append("<li data-topic='").append(escaped).append("'>").append(escaped).append("</li>");
        }
        html.append("</ul>");

        return Map.of(
                "candidates", candidates,
                "haltedAwaitingInput", true,
                "status", SessionStatus.HALTED_DISAMBIGUATE.name(),
                "finalOutput", html.toString()
        );
    }

    static List<String> candidatesFor(TutorState state) {
        if (!state.candidates().isEmpty()) {
            return state.candidates();
        }
        var seeded = new LinkedHashSet<String>();
        state.topic().ifPresent(seeded::add);
        seeded.addAll(TopicClassifier.DEFAULT_CANDIDATES);
        return List.copyOf(seeded);
    }
}
