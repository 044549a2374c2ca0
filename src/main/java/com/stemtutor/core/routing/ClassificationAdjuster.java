package com.stemtutor.core.routing;

import com.stemtutor.core.model.TopicClassification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Corrects systematic under-confidence in model classifications before routing.
 * <p>
 * Two adjustments are applied in order: a named topic with confidence below
 * {@value #NAMED_TOPIC_FLOOR} is raised to {@value #NAMED_TOPIC_CONFIDENCE}, and
 * problem text carrying math notation is raised to full confidence. The topic
 * is then dropped when the subject is unknown or the adjusted confidence is
 * under the low threshold.
 */
public final class ClassificationAdjuster {

    private static final Logger log = LoggerFactory.getLogger(ClassificationAdjuster.class);

    static final double NAMED_TOPIC_FLOOR = 0.5;
    static final double NAMED_TOPIC_CONFIDENCE = 0.95;

    private static final Pattern MATH_NOTATION = Pattern.compile(
            "[+=÷×^∫√∑\\[\\]]"
            + "|\\d\\s*-\\s*\\d"
            + "|(?<=[\\d)\\s])x(?=[\\d(\\s])"
            + "|\\b(?:derivative|integral|equation)s?\\b",
            Pattern.CASE_INSENSITIVE);

    private ClassificationAdjuster() {}

    /**
     * Result of adjustment. {@code topic} is the empty string when unset.
     */
    public record Adjusted(String topic, double confidence, boolean ambiguous, List<String> candidates) {}

    public static Adjusted adjust(TopicClassification raw, String problemText, double lowThreshold) {
        double confidence = clamp(raw.confidence());

        if (raw.hasSpecificTopic() && confidence < NAMED_TOPIC_FLOOR) {
            log.info("Raising confidence {} for named topic '{}'", confidence, raw.specificTopic());
            confidence = NAMED_TOPIC_CONFIDENCE;
        }
        if (containsMathNotation(problemText) && confidence < 1.0) {
            log.info("Problem text carries math notation, raising confidence {} to 1.0", confidence);
            confidence = 1.0;
        }

        String topic = raw.hasSubject() && confidence >= lowThreshold ? raw.fullTopic() : "";
        return new Adjusted(topic, confidence, raw.ambiguous(), raw.alternatives());
    }

    public static boolean containsMathNotation(String text) {
        return text != null && MATH_NOTATION.matcher(text).find();
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
