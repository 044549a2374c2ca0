package com.stemtutor.core.engine;

import com.stemtutor.core.graph.TutorGraph;
import com.stemtutor.core.logging.MdcContext;
import com.stemtutor.core.metrics.TutorMetrics;
import com.stemtutor.core.model.InputKind;
import com.stemtutor.core.model.SessionSnapshot;
import com.stemtutor.core.model.SessionStatus;
import com.stemtutor.core.persistence.CheckpointQueryService;
import com.stemtutor.core.persistence.CheckpointStoreException;
import com.stemtutor.core.state.TutorState;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives tutoring sessions through the compiled {@link TutorGraph}.
 * <p>
 * The engine is stateless between calls: everything a session needs to be
 * resumed lives in the checkpoint store, keyed by session id, so any instance
 * can serve any call.
 * <p>
 * Calls for the same session id are serialized within this instance by lock
 * striping, so two concurrent resumes cannot both run the teaching branch.
 * Calls landing on different instances are not coordinated.
 */
@Service
public class TutorEngine {

    private static final Logger log = LoggerFactory.getLogger(TutorEngine.class);

    private final TutorGraph tutorGraph;
    private final CheckpointQueryService checkpoints;
    private static final int LOCK_STRIPES = 64;

    private final TutorMetrics metrics;
    private final ReentrantLock[] sessionLocks = new ReentrantLock[LOCK_STRIPES];

    public TutorEngine(TutorGraph tutorGraph, CheckpointQueryService checkpoints, TutorMetrics metrics) {
        this.tutorGraph = tutorGraph;
        this.checkpoints = checkpoints;
        this.metrics = metrics;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            sessionLocks[i] = new ReentrantLock();
        }
    }

    public String generateSessionId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Runs a new session from the entry step until it completes or halts.
     * Checkpoints left under the same id by a halted or aborted run are
     * dropped first, so the run always starts from a fresh state. A completed
     * session is final and its id cannot be reused.
     *
     * @throws SessionNotResumableException if the id belongs to a completed session
     * @throws ExecutorFatalException       if the graph or the checkpoint store fails
     */
    public TutorState run(String sessionId, String identity, InputKind inputKind, String payload) {
        MdcContext.setSession(sessionId);
        var lock = lockFor(sessionId);
        lock.lock();
        try {
            log.info("Starting session {} for '{}' with {} input", sessionId, identity, inputKind);

            var stateMap = new HashMap<String, Object>();
            stateMap.put("sessionId", sessionId);
            stateMap.put("identity", identity);
            stateMap.put("inputKind", inputKind.name());
            stateMap.put("inputPayload", payload);
            if (inputKind == InputKind.TEXT) {
                stateMap.put("problemText", payload);
            }
            stateMap.put("status", SessionStatus.RUNNING.name());

            try {
                var existing = checkpoints.getLatestSnapshot(sessionId);
                if (existing.isPresent() && existing.get().state().status() == SessionStatus.COMPLETED) {
                    throw new SessionNotResumableException(sessionId, SessionStatus.COMPLETED,
                            "Session " + sessionId + " is already COMPLETED and cannot be run again");
                }
                checkpoints.release(sessionId);
            } catch (CheckpointStoreException e) {
                throw fatal(sessionId, "Checkpoint store unavailable", e);
            }
            return invoke(sessionId, Map.copyOf(stateMap));
        } finally {
            lock.unlock();
            MdcContext.clear();
        }
    }

    /**
     * Continues a halted session with the topic the student selected.
     * <p>
     * The selection overrides the classification ({@link #resumeOverride}) and
     * the graph re-enters at the router, which then takes the teaching branch.
     *
     * @throws SessionNotFoundException     if no checkpoint exists for the session
     * @throws SessionNotResumableException if the session is not halted
     * @throws IllegalArgumentException     if the selection is blank
     */
    public TutorState resume(String sessionId, String selection) {
        if (selection == null || selection.isBlank()) {
            throw new IllegalArgumentException("A topic selection is required to resume");
        }
        MdcContext.setSession(sessionId);
        var lock = lockFor(sessionId);
        lock.lock();
        try {
            var snapshot = getState(sessionId);
            SessionStatus status = snapshot.state().status();
            if (!status.isHalted()) {
                throw new SessionNotResumableException(sessionId, status);
            }
            log.info("Resuming session {} from {} with selection '{}'", sessionId, status, selection);

            var merged = TutorState.merge(snapshot.state().data(), resumeOverride(selection.trim()));
            return invoke(sessionId, merged);
        } finally {
            lock.unlock();
            MdcContext.clear();
        }
    }

    /**
     * Latest persisted state of a session.
     *
     * @throws SessionNotFoundException if no checkpoint exists for the session
     */
    public SessionSnapshot getState(String sessionId) {
        try {
            return checkpoints.getLatestSnapshot(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
        } catch (CheckpointStoreException e) {
            throw fatal(sessionId, "Checkpoint store unavailable", e);
        }
    }

    /**
     * Partial update applied to a halted session when the student picks a topic.
     */
    static Map<String, Object> resumeOverride(String selection) {
        return Map.of(
                "topic", selection,
                "confidence", 1.0,
                "ambiguous", false,
                "candidates", List.of(),
                "haltedAwaitingInput", false,
                "status", SessionStatus.RUNNING.name(),
                "resumeSelection", selection,
                "route", "",
                "finalOutput", ""
        );
    }

    private TutorState invoke(String sessionId, Map<String, Object> inputs) {
        var config = RunnableConfig.builder()
                .threadId(sessionId)
                .build();

        TutorState state;
        try {
            state = tutorGraph.getCompiledGraph()
                    .invoke(inputs, config)
                    .orElseThrow(() -> new IllegalStateException("Graph execution returned empty state"));
        } catch (RuntimeException e) {
            throw fatal(sessionId, "Session execution failed", e);
        }

        log.info("Session {} finished as {}", sessionId, state.status());
        metrics.recordSessionResult(state.status().name());
        return state;
    }

    private ReentrantLock lockFor(String sessionId) {
        return sessionLocks[Math.floorMod(sessionId.hashCode(), LOCK_STRIPES)];
    }

    private ExecutorFatalException fatal(String sessionId, String message, Throwable cause) {
        log.error("{} for session {}: {}", message, sessionId, cause.getMessage(), cause);
        metrics.recordSessionResult(SessionStatus.FAILED.name());
        return new ExecutorFatalException(sessionId, message + ": " + cause.getMessage(), cause);
    }
}
