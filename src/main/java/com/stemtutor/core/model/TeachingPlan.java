package com.stemtutor.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * HTML teaching plan plus the key concepts it marks as clickable.
 */
public record TeachingPlan(
        String htmlContent,
        List<String> keywords
) implements Serializable {

    public TeachingPlan {
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
    }
}
