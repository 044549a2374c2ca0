package com.stemtutor.core.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.stemtutor.core.model.SessionStatus;
import com.stemtutor.core.model.SolutionStep;
import com.stemtutor.core.state.TutorState;

import java.util.List;

/**
 * Caller-facing view of a session after analyze, resume or lookup.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TutorResponse(
        @JsonProperty("session_id") String sessionId,
        String status,
        @JsonProperty("halted_awaiting_input") boolean haltedAwaitingInput,
        @JsonProperty("final_output") String finalOutput,
        List<String> candidates,
        String topic,
        Double confidence,
        List<SolutionStep> steps,
        @JsonProperty("final_answer") String finalAnswer,
        @JsonProperty("degraded_steps") List<String> degradedSteps
) {

    public static final String COMPLETED = "completed";
    public static final String REQUIRES_DISAMBIGUATION = "requiresDisambiguation";
    public static final String REQUIRES_CLARIFICATION = "requiresClarification";
    public static final String ERROR = "error";

    public static TutorResponse from(TutorState state) {
        SessionStatus status = state.status();
        boolean completed = status == SessionStatus.COMPLETED;
        return new TutorResponse(
                state.sessionId(),
                statusLabel(status),
                state.haltedAwaitingInput(),
                state.finalOutput().orElse(null),
                status == SessionStatus.HALTED_DISAMBIGUATE ? state.candidates() : null,
                state.topic().orElse(null),
                state.confidence(),
                completed ? state.solutionSteps() : null,
                completed && !state.workedSolution().isBlank() ? state.workedSolution() : null,
                state.degradedSteps().isEmpty() ? null : state.degradedSteps()
        );
    }

    public static TutorResponse error(String sessionId) {
        return new TutorResponse(sessionId, ERROR, false, null, null, null, null, null, null, null);
    }

    static String statusLabel(SessionStatus status) {
        return switch (status) {
            case COMPLETED -> COMPLETED;
            case HALTED_DISAMBIGUATE -> REQUIRES_DISAMBIGUATION;
            case HALTED_CLARIFY -> REQUIRES_CLARIFICATION;
            case RUNNING, FAILED -> ERROR;
        };
    }
}
