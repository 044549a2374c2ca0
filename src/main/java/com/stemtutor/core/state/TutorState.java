package com.stemtutor.core.state;

import com.stemtutor.core.model.InputKind;
import com.stemtutor.core.model.Route;
import com.stemtutor.core.model.SessionStatus;
import com.stemtutor.core.model.SolutionStep;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for a tutoring session.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors. Every channel
 * uses override semantics: a step's delta replaces the keys it names and leaves
 * the rest untouched. Enum values are stored by name, and records may come back
 * as plain maps after a round trip through the JDBC checkpoint store, so the
 * accessors accept both shapes.
 */
public class TutorState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Input ────────────────────────────────────────────────────
        Map.entry("sessionId",           Channels.base(() -> "")),
        Map.entry("identity",            Channels.base(() -> "")),
        Map.entry("inputKind",           Channels.base(() -> InputKind.TEXT.name())),
        Map.entry("inputPayload",        Channels.base(() -> "")),
        Map.entry("problemText",         Channels.base(() -> "")),

        // ── Classification ───────────────────────────────────────────
        Map.entry("topic",               Channels.base(() -> "")),
        Map.entry("confidence",          Channels.base(() -> 0.0)),
        Map.entry("ambiguous",           Channels.base(() -> false)),
        Map.entry("candidates",          Channels.base((Supplier<List<String>>) List::of)),

        // ── Teaching artifacts ───────────────────────────────────────
        Map.entry("teachingPlan",        Channels.base(() -> "")),
        Map.entry("keyConcepts",         Channels.base((Supplier<List<String>>) List::of)),
        Map.entry("solutionSteps",       Channels.base((Supplier<List<SolutionStep>>) List::of)),
        Map.entry("workedSolution",      Channels.base(() -> "")),
        Map.entry("practiceContent",     Channels.base(() -> "")),
        Map.entry("referenceMediaUrl",   Channels.base(() -> "")),

        // ── Outcome ──────────────────────────────────────────────────
        Map.entry("finalOutput",         Channels.base(() -> "")),
        Map.entry("haltedAwaitingInput", Channels.base(() -> false)),
        Map.entry("status",              Channels.base(() -> SessionStatus.RUNNING.name())),
        Map.entry("route",               Channels.base(() -> "")),
        Map.entry("resumeSelection",     Channels.base(() -> "")),
        Map.entry("degradedSteps",       Channels.base((Supplier<List<String>>) List::of))
    );

    public static final String GENERAL_TOPIC = "General STEM";

    public TutorState(Map<String, Object> initData) {
        super(initData);
    }

    /**
     * Field-wise merge of a partial update into a state map. Keys present in
     * {@code delta} replace the current value, absent keys are kept and
     * {@code null} values in the delta are ignored. Neither argument is modified.
     */
    public static Map<String, Object> merge(Map<String, Object> current, Map<String, Object> delta) {
        var merged = new HashMap<String, Object>(current);
        delta.forEach((key, value) -> {
            if (value != null) {
                merged.put(key, value);
            }
        });
        return merged;
    }

    // ── Input ────────────────────────────────────────────────────────

    public String sessionId() {
        return this.<String>value("sessionId").orElse("");
    }

    public String identity() {
        return this.<String>value("identity").orElse("");
    }

    public InputKind inputKind() {
        String raw = this.<String>value("inputKind").orElse(InputKind.TEXT.name());
        return InputKind.valueOf(raw);
    }

    public String inputPayload() {
        return this.<String>value("inputPayload").orElse("");
    }

    /**
     * The problem as text: the payload for text input, the transcription for image input.
     */
    public String problemText() {
        String text = this.<String>value("problemText").orElse("");
        if (text.isBlank() && inputKind() == InputKind.TEXT) {
            return inputPayload();
        }
        return text;
    }

    // ── Classification ───────────────────────────────────────────────

    public Optional<String> topic() {
        return this.<String>value("topic").filter(t -> !t.isBlank());
    }

    /**
     * Topic to teach: the classified topic, or a generic label when math
     * notation carried the session past routing without a named subject.
     */
    public String lessonTopic() {
        return topic().orElse(GENERAL_TOPIC);
    }

    public double confidence() {
        return this.<Object>value("confidence")
                .map(v -> v instanceof Number n ? n.doubleValue() : 0.0)
                .orElse(0.0);
    }

    public boolean ambiguous() {
        return this.<Boolean>value("ambiguous").orElse(false);
    }

    public List<String> candidates() {
        return stringList("candidates");
    }

    // ── Teaching artifacts ───────────────────────────────────────────

    public String teachingPlan() {
        return this.<String>value("teachingPlan").orElse("");
    }

    public List<String> keyConcepts() {
        return stringList("keyConcepts");
    }

    @SuppressWarnings("unchecked")
    public List<SolutionStep> solutionSteps() {
        Optional<Object> raw = value("solutionSteps");
        if (raw.isEmpty() || !(raw.get() instanceof List<?> list)) {
            return List.of();
        }
        var steps = new ArrayList<SolutionStep>();
        for (Object item : list) {
            if (item instanceof SolutionStep step) {
                steps.add(step);
            } else if (item instanceof Map<?, ?> m) {
                var map = (Map<String, Object>) m;
                steps.add(new SolutionStep(
                        map.get("index") instanceof Number n ? n.intValue() : steps.size() + 1,
                        (String) map.getOrDefault("title", ""),
                        (String) map.getOrDefault("explanation", ""),
                        (String) map.getOrDefault("expression", "")));
            }
        }
        return List.copyOf(steps);
    }

    public String workedSolution() {
        return this.<String>value("workedSolution").orElse("");
    }

    public String practiceContent() {
        return this.<String>value("practiceContent").orElse("");
    }

    public String referenceMediaUrl() {
        return this.<String>value("referenceMediaUrl").orElse("");
    }

    // ── Outcome ──────────────────────────────────────────────────────

    public Optional<String> finalOutput() {
        return this.<String>value("finalOutput").filter(o -> !o.isBlank());
    }

    public boolean haltedAwaitingInput() {
        return this.<Boolean>value("haltedAwaitingInput").orElse(false);
    }

    public SessionStatus status() {
        String raw = this.<String>value("status").orElse(SessionStatus.RUNNING.name());
        return SessionStatus.valueOf(raw);
    }

    public Optional<Route> route() {
        return this.<String>value("route")
                .filter(r -> !r.isBlank())
                .map(Route::valueOf);
    }

    public Optional<String> resumeSelection() {
        return this.<String>value("resumeSelection").filter(s -> !s.isBlank());
    }

    public List<String> degradedSteps() {
        return stringList("degradedSteps");
    }

    /**
     * Returns the degraded-step list with {@code stepName} added, for use in a delta.
     */
    public List<String> degradedStepsWith(String stepName) {
        var steps = new LinkedHashSet<>(degradedSteps());
        steps.add(stepName);
        return List.copyOf(steps);
    }

    @SuppressWarnings("unchecked")
    private List<String> stringList(String key) {
        return this.<Object>value(key)
                .map(v -> v instanceof List<?> l ? List.copyOf((List<String>) l) : List.<String>of())
                .orElse(List.of());
    }
}
