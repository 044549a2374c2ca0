package com.stemtutor.core.nodes;

import com.stemtutor.core.model.SessionStatus;
import com.stemtutor.core.state.TutorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Halts the session and asks the student to describe the problem in more detail.
 */
@Component
public class ClarificationNode {

    private static final Logger log = LoggerFactory.getLogger(ClarificationNode.class);

    static final String PROMPT_HTML = "<p>Could you please provide more details?</p>";

    public Map<String, Object> apply(TutorState state) {
        log.info("Halting session for clarification (confidence {})", state.confidence());
        return Map.of(
                "haltedAwaitingInput", true,
                "status", SessionStatus.HALTED_CLARIFY.name(),
                "finalOutput", PROMPT_HTML
        );
    }
}
