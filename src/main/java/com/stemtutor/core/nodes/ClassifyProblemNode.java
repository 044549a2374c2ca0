package com.stemtutor.core.nodes;

import com.stemtutor.core.collaborators.CollaboratorResult;
import com.stemtutor.core.collaborators.TopicClassifier;
import com.stemtutor.core.graph.StepName;
import com.stemtutor.core.model.TopicClassification;
import com.stemtutor.core.routing.ClassificationAdjuster;
import com.stemtutor.core.routing.RoutingProperties;
import com.stemtutor.core.state.TutorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Classifies the problem topic. Backs both the text and the vision classifier steps.
 * <p>
 * For images the model also transcribes the problem, and that transcription
 * becomes the problem text for every later step.
 */
@Component
public class ClassifyProblemNode {

    private static final Logger log = LoggerFactory.getLogger(ClassifyProblemNode.class);

    /** Stands in for the problem when the image could not be transcribed. */
    static final String UNTRANSCRIBED_IMAGE_PROBLEM = "The problem shown in the uploaded image";

    private final TopicClassifier classifier;
    private final RoutingProperties routing;

    public ClassifyProblemNode(TopicClassifier classifier, RoutingProperties routing) {
        this.classifier = classifier;
        this.routing = routing;
    }

    public Map<String, Object> classifyText(TutorState state) {
        String problem = state.inputPayload();
        var result = classifier.classifyText(problem);
        return toDelta(state, result, problem, StepName.TEXT_CLASSIFIER);
    }

    public Map<String, Object> classifyImage(TutorState state) {
        var result = classifier.classifyImage(state.inputPayload());
        String problemText = result.value().problemText();
        if (problemText == null || problemText.isBlank()) {
            log.warn("Image could not be transcribed; teaching will continue from a placeholder problem");
            problemText = UNTRANSCRIBED_IMAGE_PROBLEM;
        }
        return toDelta(state, result, problemText, StepName.VISION_CLASSIFIER);
    }

    private Map<String, Object> toDelta(TutorState state, CollaboratorResult<TopicClassification> result,
                                        String problemText, StepName step) {
        var adjusted = ClassificationAdjuster.adjust(result.value(), problemText, routing.getLowThreshold());
        log.info("Classified as '{}' (confidence {}, ambiguous {})",
                adjusted.topic().isEmpty() ? "<none>" : adjusted.topic(),
                adjusted.confidence(), adjusted.ambiguous());

        var delta = new HashMap<String, Object>();
        delta.put("problemText", problemText);
        delta.put("topic", adjusted.topic());
        delta.put("confidence", adjusted.confidence());
        delta.put("ambiguous", adjusted.ambiguous());
        delta.put("candidates", adjusted.candidates());
        if (result.degraded()) {
            delta.put("degradedSteps", state.degradedStepsWith(step.id()));
        }
        return delta;
    }
}
