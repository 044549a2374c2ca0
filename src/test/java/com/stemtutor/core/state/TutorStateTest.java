package com.stemtutor.core.state;

import com.stemtutor.core.model.InputKind;
import com.stemtutor.core.model.Route;
import com.stemtutor.core.model.SessionStatus;
import com.stemtutor.core.model.SolutionStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TutorStateTest {

    @Nested
    @DisplayName("merge")
    class Merge {

        @Test
        @DisplayName("Keys in the delta replace current values, others are kept")
        void overridesNamedKeys() {
            var current = Map.<String, Object>of("topic", "Math", "confidence", 0.5, "identity", "u1");
            var merged = TutorState.merge(current, Map.of("topic", "Physics", "confidence", 1.0));

            assertEquals("Physics", merged.get("topic"));
            assertEquals(1.0, merged.get("confidence"));
            assertEquals("u1", merged.get("identity"));
        }

        @Test
        @DisplayName("Null values in the delta are ignored")
        void ignoresNulls() {
            var delta = new HashMap<String, Object>();
            delta.put("topic", null);
            var merged = TutorState.merge(Map.of("topic", "Math"), delta);

            assertEquals("Math", merged.get("topic"));
        }

        @Test
        @DisplayName("Neither input is modified")
        void inputsUntouched() {
            var current = new HashMap<String, Object>(Map.of("topic", "Math"));
            var delta = new HashMap<String, Object>(Map.of("topic", "Physics"));
            TutorState.merge(current, delta);

            assertEquals("Math", current.get("topic"));
            assertEquals(Map.of("topic", "Physics"), delta);
        }
    }

    @Nested
    @DisplayName("accessors")
    class Accessors {

        @Test
        @DisplayName("Empty state yields defaults")
        void defaults() {
            var state = new TutorState(Map.of());

            assertEquals("", state.sessionId());
            assertEquals(InputKind.TEXT, state.inputKind());
            assertTrue(state.topic().isEmpty());
            assertEquals(TutorState.GENERAL_TOPIC, state.lessonTopic());
            assertEquals(0.0, state.confidence());
            assertEquals(SessionStatus.RUNNING, state.status());
            assertTrue(state.route().isEmpty());
            assertTrue(state.finalOutput().isEmpty());
            assertTrue(state.candidates().isEmpty());
        }

        @Test
        @DisplayName("Text problem falls back to the payload when no transcription is stored")
        void problemTextFallsBackToPayload() {
            var text = new TutorState(Map.of("inputKind", "TEXT", "inputPayload", "Solve 2x = 4"));
            var image = new TutorState(Map.of("inputKind", "IMAGE", "inputPayload", "iVBORw0KGgo="));

            assertEquals("Solve 2x = 4", text.problemText());
            assertEquals("", image.problemText());
        }

        @Test
        @DisplayName("Blank topic and route read as absent")
        void blankValuesAbsent() {
            var state = new TutorState(Map.of("topic", " ", "route", "", "resumeSelection", ""));

            assertTrue(state.topic().isEmpty());
            assertTrue(state.route().isEmpty());
            assertTrue(state.resumeSelection().isEmpty());
        }

        @Test
        @DisplayName("Enum-valued fields are read by name")
        void enumsByName() {
            var state = new TutorState(Map.of("status", "HALTED_CLARIFY", "route", "TEACH"));

            assertEquals(SessionStatus.HALTED_CLARIFY, state.status());
            assertTrue(state.status().isHalted());
            assertEquals(Route.TEACH, state.route().orElseThrow());
        }

        @Test
        @DisplayName("Confidence stored as any number is read as double")
        void confidenceFromInteger() {
            assertEquals(1.0, new TutorState(Map.of("confidence", 1)).confidence());
        }

        @Test
        @DisplayName("Solution steps read back from maps after a JSON round trip")
        void solutionStepsFromMaps() {
            var state = new TutorState(Map.of("solutionSteps", List.of(
                    Map.of("index", 1, "title", "Set up", "explanation", "Write it down", "expression", "$x$"),
                    new SolutionStep(2, "Solve", "Divide", ""))));

            var steps = state.solutionSteps();
            assertEquals(2, steps.size());
            assertEquals(new SolutionStep(1, "Set up", "Write it down", "$x$"), steps.get(0));
            assertEquals("Solve", steps.get(1).title());
        }

        @Test
        @DisplayName("degradedStepsWith appends once")
        void degradedStepsWith() {
            var state = new TutorState(Map.of("degradedSteps", List.of("practice")));

            assertEquals(List.of("practice", "step_solver"), state.degradedStepsWith("step_solver"));
            assertEquals(List.of("practice"), state.degradedStepsWith("practice"));
        }
    }
}
