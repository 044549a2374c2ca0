package com.stemtutor.core.llm;

import com.stemtutor.core.model.SolutionStep;
import com.stemtutor.core.model.TopicClassification;
import com.stemtutor.core.model.WorkedSolution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LenientJsonDecoderTest {

    private final LenientJsonDecoder decoder = new LenientJsonDecoder();

    // ── extraction ──────────────────────────────────────────────────

    @Test
    @DisplayName("Extracts JSON wrapped in prose and markdown fences")
    void extractsFromProse() {
        String text = """
                Sure! Here is the classification:
                ```json
                {"subject":"Math","category":"Algebra","specificTopic":"Linear Equations","confidence":1.0}
                ```
                Let me know if you need anything else.
                """;

        var result = decoder.decode(text, TopicClassification.class);

        assertTrue(result.isSuccess());
        assertEquals("Linear Equations", result.orElseThrow().specificTopic());
        assertEquals(1.0, result.orElseThrow().confidence());
    }

    @Test
    @DisplayName("Braces inside string literals do not end the object")
    void bracesInStrings() {
        assertEquals("{\"a\":\"}{\",\"b\":[1]}",
                LenientJsonDecoder.extractJson("x {\"a\":\"}{\",\"b\":[1]} trailing }"));
    }

    @Test
    @DisplayName("Unclosed or missing JSON yields null")
    void noJson() {
        assertNull(LenientJsonDecoder.extractJson("no json here"));
        assertNull(LenientJsonDecoder.extractJson("{\"a\": 1"));
    }

    // ── escape repair ───────────────────────────────────────────────

    @Test
    @DisplayName("Bare LaTeX backslashes are doubled")
    void repairsLatex() {
        String json = """
                {"problemRestatement":"Evaluate \\sqrt{16}","steps":[{"index":1,"title":"Root","explanation":"Take \\sqrt{x} twice","expression":"$\\cdot 2$"}],"finalAnswer":"4","keyConcepts":[]}
                """;

        var result = decoder.decode(json, WorkedSolution.class);

        WorkedSolution solution = result.orElseThrow();
        assertEquals("Evaluate \\sqrt{16}", solution.problemRestatement());
        SolutionStep step = solution.steps().get(0);
        assertEquals("Take \\sqrt{x} twice", step.explanation());
        assertEquals("$\\cdot 2$", step.expression());
    }

    @Test
    @DisplayName("Valid escapes are preserved")
    void keepsValidEscapes() {
        assertEquals("\"a\\nB\\\"c\\u00e9\"", LenientJsonDecoder.repairEscapes("\"a\\nB\\\"c\\u00e9\""));
        assertEquals("\\\\", LenientJsonDecoder.repairEscapes("\\\\"));
    }

    @Test
    @DisplayName("Valid escapes followed by words decode to control characters")
    void escapesBeforeWords() {
        String json = """
                {"html": "Step one\\nthen divide\\tboth sides"}
                """;

        var result = decoder.decode(json, Map.class);

        assertEquals("Step one\nthen divide\tboth sides", result.orElseThrow().get("html"));
        assertEquals("\"a\\nthen\"", LenientJsonDecoder.repairEscapes("\"a\\nthen\""));
    }

    // ── naming ──────────────────────────────────────────────────────

    @Test
    @DisplayName("Falls back to snake_case field names")
    void snakeCaseFallback() {
        String text = "{\"subject\":\"Physics\",\"category\":\"Mechanics\",\"specific_topic\":\"Friction\",\"confidence\":0.8}";

        var result = decoder.decode(text, TopicClassification.class);

        assertEquals("Friction", result.asOptional().map(TopicClassification::specificTopic).orElse(null));
    }

    // ── failures ────────────────────────────────────────────────────

    @Test
    @DisplayName("Blank text and garbage fail without throwing")
    void failures() {
        assertFalse(decoder.decode("", TopicClassification.class).isSuccess());
        assertFalse(decoder.decode("I cannot help with that.", TopicClassification.class).isSuccess());
    }

    @Test
    @DisplayName("orElseThrow on a failure raises LlmParseException")
    void orElseThrowRaises() {
        var result = decoder.decode("nothing", TopicClassification.class);
        assertThrows(LlmParseException.class, result::orElseThrow);
    }
}
