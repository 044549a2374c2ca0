package com.stemtutor.dispatch.api;

import com.stemtutor.core.engine.ExecutorFatalException;
import com.stemtutor.core.engine.SessionNotFoundException;
import com.stemtutor.core.engine.SessionNotResumableException;
import com.stemtutor.core.model.InputKind;
import com.stemtutor.core.model.StepExplanation;
import com.stemtutor.core.ratelimit.QuotaStatus;
import com.stemtutor.core.ratelimit.RateLimitExceededException;
import com.stemtutor.core.ratelimit.RateLimiterUnavailableException;
import com.stemtutor.core.service.ProblemSubmission;
import com.stemtutor.core.service.TutorResponse;
import com.stemtutor.core.service.TutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller for tutoring sessions and rate-limit quotas.
 */
@RestController
@RequestMapping("/v1")
public class TutorController {

    private static final Logger log = LoggerFactory.getLogger(TutorController.class);

    private final TutorService tutorService;

    public TutorController(TutorService tutorService) {
        this.tutorService = tutorService;
    }

    /**
     * POST /v1/analyze: Classify a problem and teach it, or halt for input.
     */
    @PostMapping("/analyze")
    public ResponseEntity<?> analyze(@RequestBody AnalyzeRequest request) {
        InputKind kind;
        try {
            kind = InputKind.valueOf(request.type() == null ? "" : request.type().trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return badRequest("Invalid type: " + request.type() + " (expected text or image)");
        }
        if (request.content() == null || request.content().isBlank()) {
            return badRequest("Content is required");
        }
        if (kind == InputKind.IMAGE && !isBase64(request.content())) {
            return badRequest("Invalid base64 encoding");
        }

        String identity = request.identity() != null && !request.identity().isBlank()
                ? request.identity()
                : UUID.randomUUID().toString();
        var response = tutorService.analyze(
                new ProblemSubmission(request.sessionId(), identity, kind, request.content()));
        return ResponseEntity.ok(response);
    }

    /**
     * POST /v1/resume: Continue a halted session with the selected topic.
     */
    @PostMapping("/resume")
    public ResponseEntity<?> resume(@RequestBody ResumeRequest request) {
        if (request.sessionId() == null || request.sessionId().isBlank()) {
            return badRequest("session_id is required");
        }
        if (request.selectedTopic() == null || request.selectedTopic().isBlank()) {
            return badRequest("selected_topic is required");
        }
        return ResponseEntity.ok(tutorService.resume(request.sessionId(), request.selectedTopic()));
    }

    /**
     * GET /v1/sessions/{id}: Latest checkpointed state of a session.
     */
    @GetMapping("/sessions/{id}")
    public ResponseEntity<TutorResponse> getSession(@PathVariable String id) {
        return ResponseEntity.ok(tutorService.session(id));
    }

    /**
     * GET /v1/quota/{identity}: Remaining allowance, without consuming it.
     */
    @GetMapping("/quota/{identity}")
    public ResponseEntity<QuotaStatus> getQuota(@PathVariable String identity) {
        return ResponseEntity.ok(tutorService.quota(identity));
    }

    /**
     * DELETE /v1/quota/{identity}: Restore a full bucket.
     */
    @DeleteMapping("/quota/{identity}")
    public ResponseEntity<Void> resetQuota(@PathVariable String identity) {
        tutorService.resetQuota(identity);
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /v1/explain-step: Explain one step of a worked solution.
     */
    @PostMapping("/explain-step")
    public ResponseEntity<?> explainStep(@RequestBody ExplainStepRequest request) {
        if (request.stepText() == null || request.stepText().isBlank()) {
            return badRequest("step_text is required");
        }
        StepExplanation explanation = tutorService.explainStep(
                request.stepText(),
                request.context() != null ? request.context() : "",
                request.topic() != null ? request.topic() : "");
        return ResponseEntity.ok(explanation);
    }

    // ── Error mapping ────────────────────────────────────────────────

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<Map<String, Object>> onRateLimited(RateLimitExceededException e) {
        var body = new LinkedHashMap<String, Object>();
        body.put("error", "Rate limit exceeded");
        body.put("reset_in_seconds", e.getResetInSeconds());
        body.put("limit", e.getDecision().limit());
        body.put("tier", e.getDecision().tier());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getResetInSeconds()))
                .body(body);
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<Map<String, String>> onSessionNotFound(SessionNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(SessionNotResumableException.class)
    public ResponseEntity<Map<String, String>> onNotResumable(SessionNotResumableException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(RateLimiterUnavailableException.class)
    public ResponseEntity<Map<String, String>> onRateLimiterUnavailable(RateLimiterUnavailableException e) {
        log.warn("Rate limit store unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> onIllegalArgument(IllegalArgumentException e) {
        return badRequest(e.getMessage());
    }

    @ExceptionHandler(ExecutorFatalException.class)
    public ResponseEntity<TutorResponse> onExecutorFatal(ExecutorFatalException e) {
        log.error("Session {} aborted: {}", e.getSessionId(), e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(TutorResponse.error(e.getSessionId()));
    }

    private static ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }

    static boolean isBase64(String content) {
        String data = content.trim();
        int comma = data.indexOf(',');
        if (data.startsWith("data:") && comma > 0) {
            data = data.substring(comma + 1);
        }
        if (data.isEmpty()) {
            return false;
        }
        try {
            Base64.getMimeDecoder().decode(data);
            return data.matches("[A-Za-z0-9+/=\\r\\n]+");
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
