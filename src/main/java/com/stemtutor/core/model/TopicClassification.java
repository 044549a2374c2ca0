package com.stemtutor.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Structured topic classification returned by the classification model.
 * <p>
 * {@code problemText} is only filled for image input, where the model
 * transcribes the problem it read from the picture.
 */
public record TopicClassification(
        String subject,
        String category,
        String specificTopic,
        double confidence,
        boolean ambiguous,
        List<String> alternatives,
        String problemText
) implements Serializable {

    public TopicClassification {
        alternatives = alternatives != null ? List.copyOf(alternatives) : List.of();
    }

    public boolean hasSubject() {
        return subject != null && !subject.isBlank() && !"Unknown".equalsIgnoreCase(subject);
    }

    public boolean hasSpecificTopic() {
        return specificTopic != null && !specificTopic.isBlank() && !"Unknown".equalsIgnoreCase(specificTopic);
    }

    /**
     * Joins the non-blank parts as "Subject - Category - Specific".
     */
    public String fullTopic() {
        var parts = new ArrayList<String>();
        for (String part : new String[]{subject, category, specificTopic}) {
            if (part != null && !part.isBlank()) {
                parts.add(part.trim());
            }
        }
        return String.join(" - ", parts);
    }
}
