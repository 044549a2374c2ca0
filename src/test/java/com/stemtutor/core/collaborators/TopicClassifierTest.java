package com.stemtutor.core.collaborators;

import com.stemtutor.core.llm.LlmService;
import com.stemtutor.core.metrics.TutorMetrics;
import com.stemtutor.core.model.TopicClassification;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.util.MimeType;
import org.springframework.util.MimeTypeUtils;

import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TopicClassifierTest {

    private static final byte[] PNG_HEADER = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A};

    private LlmService llm;
    private TopicClassifier classifier;

    @BeforeEach
    void setUp() {
        llm = mock(LlmService.class);
        var props = new CollaboratorProperties();
        props.setMaxAttempts(1);
        props.setInitialBackoffMs(1);
        classifier = new TopicClassifier(llm, new CollaboratorInvoker(props, new TutorMetrics(new SimpleMeterRegistry())));
    }

    @Test
    @DisplayName("classifyText returns the model classification")
    void classifyText() {
        var expected = new TopicClassification("Math", "Algebra", "Linear Equations", 1.0, false, List.of(), "");
        when(llm.structuredCall(anyString(), contains("2x + 5 = 13"), eq(TopicClassification.class)))
                .thenReturn(expected);

        var result = classifier.classifyText("Solve 2x + 5 = 13");

        assertEquals(expected, result.value());
        assertFalse(result.degraded());
    }

    @Test
    @DisplayName("Text fallback is low-confidence, ambiguous and offers the default candidates")
    void textFallback() {
        when(llm.structuredCall(anyString(), anyString(), eq(TopicClassification.class)))
                .thenThrow(new IllegalStateException("boom"));

        var result = classifier.classifyText("anything");

        assertTrue(result.degraded());
        assertEquals(0.3, result.value().confidence());
        assertTrue(result.value().ambiguous());
        assertEquals(TopicClassifier.DEFAULT_CANDIDATES, result.value().alternatives());
    }

    @Test
    @DisplayName("classifyImage sends decoded bytes with the sniffed MIME type")
    void classifyImage() {
        var expected = new TopicClassification("Math", "Calculus", "Integrals", 1.0, false, List.of(), "\\int x dx");
        when(llm.visionCall(anyString(), anyString(), any(MimeType.class), any(byte[].class), eq(TopicClassification.class)))
                .thenReturn(expected);

        var result = classifier.classifyImage("data:image/png;base64," + Base64.getEncoder().encodeToString(PNG_HEADER));

        assertEquals(expected, result.value());
        verify(llm).visionCall(anyString(), anyString(), eq(MimeTypeUtils.IMAGE_PNG), eq(PNG_HEADER),
                eq(TopicClassification.class));
    }

    @Test
    @DisplayName("Undecodable image data degrades to the image fallback")
    void badImageDegrades() {
        var result = classifier.classifyImage("A");

        assertTrue(result.degraded());
        assertEquals(CollaboratorOutcome.DEGRADED_PERMANENT, result.outcome());
        assertEquals(0.3, result.value().confidence());
        assertTrue(result.value().alternatives().isEmpty());
    }

    @Test
    @DisplayName("Unknown signatures are sent as JPEG")
    void defaultsToJpeg() {
        var image = TopicClassifier.decodeImage(Base64.getEncoder().encodeToString(new byte[]{(byte) 0xFF, (byte) 0xD8, 1}));
        assertEquals(MimeTypeUtils.IMAGE_JPEG, image.mimeType());
    }
}
