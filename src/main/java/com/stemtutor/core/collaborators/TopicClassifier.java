package com.stemtutor.core.collaborators;

import com.stemtutor.core.llm.LlmService;
import com.stemtutor.core.model.TopicClassification;
import org.springframework.stereotype.Component;
import org.springframework.util.MimeType;
import org.springframework.util.MimeTypeUtils;

import java.util.Base64;
import java.util.List;

/**
 * Classifies a problem into "Subject - Category - Specific" with a confidence score.
 */
@Component
public class TopicClassifier {

    static final String TEXT_COLLABORATOR = "topic_classifier";
    static final String VISION_COLLABORATOR = "vision_classifier";

    public static final List<String> DEFAULT_CANDIDATES =
            List.of("Math - Algebra", "Math - Calculus", "Physics - Mechanics");

    private static final String TEXT_PROMPT = """
            You are a STEM topic classifier for a tutoring service.
            Classify the student's problem into:
            - subject: "Math", "Physics", "Chemistry", "Biology", "Computer Science", or "Unknown"
            - category: the area within the subject, e.g. "Linear Algebra", "Calculus", "Mechanics", "Stoichiometry"
            - specificTopic: the concrete technique, e.g. "Cross Product", "Derivative - Power Rule", "Newton Second Law"
            - confidence: 0.0 to 1.0. Use 1.0 when the problem clearly belongs to one topic.
            - ambiguous: true only if the problem is genuinely unclear between several topics
            - alternatives: empty unless ambiguous; otherwise 2-3 alternative specific topics

            Examples:
            "Find the cross product of [1,2,3] and [4,5,6]" -> Math / Linear Algebra / Cross Product, confidence 1.0
            "Solve 2x + 5 = 13" -> Math / Algebra / Linear Equations, confidence 1.0
            "A 5kg block is pushed with 20N, find the acceleration" -> Physics / Mechanics / Newton Second Law, confidence 1.0
            "hello" -> Unknown / Unknown / Unknown, confidence 0.0, ambiguous true

            Respond with valid JSON matching the schema provided.
            """;

    private static final String VISION_PROMPT = """
            You are a STEM tutor reading a photo of a homework problem.
            First transcribe the problem exactly as written into problemText, using LaTeX for math.
            Escape every LaTeX backslash in JSON strings, for example "\\\\frac{1}{2}".
            Then classify it with subject, category, specificTopic, confidence (0.0 to 1.0),
            ambiguous and alternatives, as a STEM topic classifier would.
            Be specific with the topic. Use confidence 1.0 for clear STEM problems.
            If the image holds no readable problem, use subject "Unknown" and confidence 0.0.

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final CollaboratorInvoker invoker;

    public TopicClassifier(LlmService llmService, CollaboratorInvoker invoker) {
        this.llmService = llmService;
        this.invoker = invoker;
    }

    public CollaboratorResult<TopicClassification> classifyText(String problem) {
        return invoker.invoke(TEXT_COLLABORATOR,
                () -> llmService.structuredCall(TEXT_PROMPT, "Problem: " + problem, TopicClassification.class),
                TopicClassifier::textFallback);
    }

    public CollaboratorResult<TopicClassification> classifyImage(String base64Payload) {
        return invoker.invoke(VISION_COLLABORATOR,
                () -> {
                    var image = decodeImage(base64Payload);
                    return llmService.visionCall(VISION_PROMPT, "Read and classify this problem.",
                            image.mimeType(), image.bytes(), TopicClassification.class);
                },
                TopicClassifier::imageFallback);
    }

    static TopicClassification textFallback() {
        return new TopicClassification(null, null, null, 0.3, true, DEFAULT_CANDIDATES, "");
    }

    static TopicClassification imageFallback() {
        return new TopicClassification(null, null, null, 0.3, true, List.of(), "");
    }

    record ImageData(MimeType mimeType, byte[] bytes) {}

    /**
     * Decodes a base64 image, with or without a {@code data:} URI prefix, and
     * sniffs PNG, GIF and WebP signatures. Anything else is sent as JPEG.
     */
    static ImageData decodeImage(String payload) {
        String data = payload.trim();
        int comma = data.indexOf(',');
        if (data.startsWith("data:") && comma > 0) {
            data = data.substring(comma + 1);
        }
        byte[] bytes = Base64.getMimeDecoder().decode(data);
        return new ImageData(sniffMimeType(bytes), bytes);
    }

    private static MimeType sniffMimeType(byte[] bytes) {
        if (bytes.length >= 4 && (bytes[0] & 0xFF) == 0x89 && bytes[1] == 'P' && bytes[2] == 'N' && bytes[3] == 'G') {
            return MimeTypeUtils.IMAGE_PNG;
        }
        if (bytes.length >= 3 && bytes[0] == 'G' && bytes[1] == 'I' && bytes[2] == 'F') {
            return MimeTypeUtils.IMAGE_GIF;
        }
        if (bytes.length >= 12 && bytes[8] == 'W' && bytes[9] == 'E' && bytes[10] == 'B' && bytes[11] == 'P') {
            return MimeType.valueOf("image/webp");
        }
        return MimeTypeUtils.IMAGE_JPEG;
    }
}
