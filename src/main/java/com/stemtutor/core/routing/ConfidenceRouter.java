package com.stemtutor.core.routing;

import com.stemtutor.core.model.Route;

/**
 * Maps a classification confidence to the branch the session takes next.
 */
public final class ConfidenceRouter {

    private ConfidenceRouter() {}

    /**
     * Below {@code low} the problem is unclear and the user is asked for detail.
     * Between the thresholds, or whenever the classifier flagged ambiguity, the
     * user picks among candidate topics. Otherwise teaching proceeds.
     */
    public static Route route(double confidence, boolean ambiguous, double low, double high) {
        if (confidence < low) {
            return Route.CLARIFY;
        }
        if (confidence < high || ambiguous) {
            return Route.DISAMBIGUATE;
        }
        return Route.TEACH;
    }

    public static Route route(double confidence, boolean ambiguous, RoutingProperties properties) {
        return route(confidence, ambiguous, properties.getLowThreshold(), properties.getHighThreshold());
    }
}
