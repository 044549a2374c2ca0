package com.stemtutor.core.nodes;

import com.stemtutor.core.model.SessionStatus;
import com.stemtutor.core.state.TutorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Entry step. Marks the session running; the outgoing edge picks the classifier,
 * or skips classification when a resume selection is present.
 */
@Component
public class DispatchInputNode {

    private static final Logger log = LoggerFactory.getLogger(DispatchInputNode.class);

    public Map<String, Object> apply(TutorState state) {
        if (state.resumeSelection().isPresent()) {
            log.info("Resuming with selected topic '{}'", state.resumeSelection().get());
        } else {
            log.info("Dispatching {} input ({} chars)", state.inputKind(), state.inputPayload().length());
        }
        return Map.of("status", SessionStatus.RUNNING.name());
    }
}
