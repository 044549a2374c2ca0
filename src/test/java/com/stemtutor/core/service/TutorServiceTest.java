package com.stemtutor.core.service;

import com.stemtutor.core.collaborators.CollaboratorOutcome;
import com.stemtutor.core.collaborators.CollaboratorResult;
import com.stemtutor.core.collaborators.StepExplainer;
import com.stemtutor.core.engine.TutorEngine;
import com.stemtutor.core.model.InputKind;
import com.stemtutor.core.model.SessionSnapshot;
import com.stemtutor.core.model.SessionStatus;
import com.stemtutor.core.model.SolutionStep;
import com.stemtutor.core.model.StepExplanation;
import com.stemtutor.core.ratelimit.RateLimitDecision;
import com.stemtutor.core.ratelimit.RateLimitExceededException;
import com.stemtutor.core.ratelimit.Tier;
import com.stemtutor.core.ratelimit.TokenBucketRateLimiter;
import com.stemtutor.core.state.TutorState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class TutorServiceTest {

    private TutorEngine engine;
    private TokenBucketRateLimiter rateLimiter;
    private StepExplainer stepExplainer;
    private TutorService service;

    @BeforeEach
    void setUp() {
        engine = mock(TutorEngine.class);
        rateLimiter = mock(TokenBucketRateLimiter.class);
        stepExplainer = mock(StepExplainer.class);
        service = new TutorService(engine, rateLimiter, stepExplainer);
    }

    private static RateLimitDecision allowed() {
        return new RateLimitDecision(true, 4, 5, 0, Tier.FREE, false);
    }

    private static TutorState completedState(String sessionId) {
        return new TutorState(Map.of(
                "sessionId", sessionId,
                "topic", "Math - Algebra",
                "confidence", 0.95,
                "solutionSteps", List.of(new SolutionStep(1, "Isolate", "Subtract 5 from both sides", "2x = 8")),
                "workedSolution", "x = 4",
                "finalOutput", "<article>lesson</article>",
                "status", SessionStatus.COMPLETED.name()));
    }

    // ── analyze ──────────────────────────────────────────────────────

    @Test
    @DisplayName("Analyze consults the rate limiter before the engine")
    void analyzeChecksQuotaFirst() {
        when(rateLimiter.check("alice")).thenReturn(allowed());
        when(engine.run("s-1", "alice", InputKind.TEXT, "Solve 2x + 5 = 13")).thenReturn(completedState("s-1"));

        var response = service.analyze(new ProblemSubmission("s-1", "alice", InputKind.TEXT, "Solve 2x + 5 = 13"));

        var order = inOrder(rateLimiter, engine);
        order.verify(rateLimiter).check("alice");
        order.verify(engine).run("s-1", "alice", InputKind.TEXT, "Solve 2x + 5 = 13");
        assertEquals(TutorResponse.COMPLETED, response.status());
        assertEquals("x = 4", response.finalAnswer());
        assertEquals(1, response.steps().size());
        assertNull(response.candidates());
    }

    @Test
    @DisplayName("A rejected request never reaches the engine")
    void rejectedRequestSkipsEngine() {
        when(rateLimiter.check("alice")).thenReturn(new RateLimitDecision(false, 0, 5, 12, Tier.FREE, false));

        var ex = assertThrows(RateLimitExceededException.class,
                () -> service.analyze(new ProblemSubmission(null, "alice", InputKind.TEXT, "2+2")));

        assertEquals(12, ex.getResetInSeconds());
        verifyNoInteractions(engine);
    }

    @Test
    @DisplayName("A missing session id is generated by the engine")
    void generatesSessionId() {
        when(rateLimiter.check("bob")).thenReturn(allowed());
        when(engine.generateSessionId()).thenReturn("generated-id");
        when(engine.run(eq("generated-id"), anyString(), any(), anyString())).thenReturn(completedState("generated-id"));

        var response = service.analyze(new ProblemSubmission("  ", "bob", InputKind.TEXT, "2+2"));

        assertEquals("generated-id", response.sessionId());
    }

    @Test
    @DisplayName("A halted session reports its candidates and no final answer")
    void haltedResponse() {
        when(rateLimiter.check("bob")).thenReturn(allowed());
        when(engine.run(anyString(), anyString(), any(), anyString())).thenReturn(new TutorState(Map.of(
                "sessionId", "s-2",
                "confidence", 0.6,
                "candidates", List.of("Physics - Mechanics", "Physics - Kinematics"),
                "finalOutput", "<ul/>",
                "haltedAwaitingInput", true,
                "status", SessionStatus.HALTED_DISAMBIGUATE.name())));

        var response = service.analyze(new ProblemSubmission("s-2", "bob", InputKind.TEXT, "motion"));

        assertEquals(TutorResponse.REQUIRES_DISAMBIGUATION, response.status());
        assertTrue(response.haltedAwaitingInput());
        assertEquals(List.of("Physics - Mechanics", "Physics - Kinematics"), response.candidates());
        assertNull(response.finalAnswer());
        assertNull(response.steps());
    }

    // ── resume and lookup ────────────────────────────────────────────

    @Test
    @DisplayName("Resume is not rate limited")
    void resumeSkipsRateLimiter() {
        when(engine.resume("s-2", "Physics - Mechanics")).thenReturn(completedState("s-2"));

        var response = service.resume("s-2", "Physics - Mechanics");

        assertEquals(TutorResponse.COMPLETED, response.status());
        verifyNoInteractions(rateLimiter);
    }

    @Test
    @DisplayName("Session lookup maps the latest snapshot")
    void sessionLookup() {
        when(engine.getState("s-1")).thenReturn(
                new SessionSnapshot("s-1", completedState("s-1"), "assemble_output", null));

        var response = service.session("s-1");

        assertEquals("s-1", response.sessionId());
        assertEquals("Math - Algebra", response.topic());
    }

    // ── quota and explain ────────────────────────────────────────────

    @Test
    @DisplayName("Quota reset delegates to the rate limiter")
    void resetQuota() {
        service.resetQuota("alice");
        verify(rateLimiter).reset("alice");
    }

    @Test
    @DisplayName("Explain step returns the explanation even when degraded")
    void explainStep() {
        var fallback = new StepExplanation("No further explanation is available.", "Math");
        when(stepExplainer.explain("Subtract 5", "", "Math"))
                .thenReturn(new CollaboratorResult<>(fallback, CollaboratorOutcome.DEGRADED_TRANSIENT, 2));

        assertSame(fallback, service.explainStep("Subtract 5", "", "Math"));
        verifyNoInteractions(rateLimiter);
    }
}
