package com.stemtutor.core.nodes;

import com.stemtutor.core.routing.RoutingProperties;
import com.stemtutor.core.state.TutorState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EvaluateConfidenceNodeTest {

    private final EvaluateConfidenceNode node = new EvaluateConfidenceNode(new RoutingProperties());

    @Test
    @DisplayName("Low confidence routes to clarification and clears the topic")
    void lowConfidence() {
        var delta = node.apply(new TutorState(Map.of("confidence", 0.2, "topic", "Math")));

        assertEquals("CLARIFY", delta.get("route"));
        assertEquals("", delta.get("topic"));
    }

    @Test
    @DisplayName("High confidence routes to teaching and keeps the topic")
    void highConfidence() {
        var delta = node.apply(new TutorState(Map.of("confidence", 1.0, "topic", "Math - Algebra")));

        assertEquals("TEACH", delta.get("route"));
        assertFalse(delta.containsKey("topic"));
    }

    @Test
    @DisplayName("An ambiguous high-confidence result routes to disambiguation")
    void ambiguous() {
        var delta = node.apply(new TutorState(Map.of("confidence", 0.9, "ambiguous", true)));

        assertEquals("DISAMBIGUATE", delta.get("route"));
    }
}
