package com.stemtutor.core.nodes;

import com.stemtutor.core.model.Route;
import com.stemtutor.core.routing.ConfidenceRouter;
import com.stemtutor.core.routing.RoutingProperties;
import com.stemtutor.core.state.TutorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Records the branch chosen by {@link ConfidenceRouter} and clears the topic
 * when confidence is under the low threshold.
 */
@Component
public class EvaluateConfidenceNode {

    private static final Logger log = LoggerFactory.getLogger(EvaluateConfidenceNode.class);

    private final RoutingProperties routing;

    public EvaluateConfidenceNode(RoutingProperties routing) {
        this.routing = routing;
    }

    public Map<String, Object> apply(TutorState state) {
        double confidence = state.confidence();
        Route route = ConfidenceRouter.route(confidence, state.ambiguous(), routing);
        log.info("Confidence {} (low {}, high {}, ambiguous {}) -> {}",
                confidence, routing.getLowThreshold(), routing.getHighThreshold(), state.ambiguous(), route);

        var delta = new HashMap<String, Object>();
        delta.put("route", route.name());
        if (confidence < routing.getLowThreshold()) {
            delta.put("topic", "");
        }
        return delta;
    }
}
