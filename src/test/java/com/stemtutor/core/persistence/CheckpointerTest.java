package com.stemtutor.core.persistence;

import com.stemtutor.core.graph.TutorGraph;
import com.stemtutor.core.graph.TutorGraphFixture;
import com.stemtutor.core.model.SessionStatus;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for checkpoint saver integration with the tutoring graph.
 * Uses {@link MemorySaver} to validate checkpointing behavior
 * without requiring a PostgreSQL database.
 */
class CheckpointerTest {

    private MemorySaver saver;
    private TutorGraph graph;
    private CheckpointQueryService queryService;

    @BeforeEach
    void setUp() throws Exception {
        saver = new MemorySaver();
        graph = new TutorGraphFixture().build(saver);
        queryService = new CheckpointQueryService(saver);
    }

    private void run(String sessionId, String problem) {
        var input = new HashMap<String, Object>();
        input.put("sessionId", sessionId);
        input.put("inputKind", "TEXT");
        input.put("inputPayload", problem);
        graph.getCompiledGraph().invoke(input, RunnableConfig.builder().threadId(sessionId).build());
    }

    @Test
    @DisplayName("A checkpoint is written for every completed step")
    void checkpointPerStep() {
        run("cp-1", TutorGraphFixture.CLEAR_PROBLEM);

        var checkpoints = saver.list(RunnableConfig.builder().threadId("cp-1").build());
        assertTrue(checkpoints.size() >= 5, "Expected one checkpoint per step, got " + checkpoints.size());
    }

    @Test
    @DisplayName("The latest snapshot of a halted session carries the halt")
    void haltedSnapshot() {
        run("cp-2", TutorGraphFixture.VAGUE_PROBLEM);

        var snapshot = queryService.getLatestSnapshot("cp-2").orElseThrow();

        assertEquals(SessionStatus.HALTED_DISAMBIGUATE, snapshot.state().status());
        assertTrue(snapshot.state().haltedAwaitingInput());
        assertFalse(snapshot.state().candidates().isEmpty());
        assertNotNull(snapshot.lastCompletedStep());
    }

    @Test
    @DisplayName("Sessions are isolated by id")
    void isolatedSessions() {
        run("cp-a", TutorGraphFixture.CLEAR_PROBLEM);
        run("cp-b", TutorGraphFixture.UNCLEAR_PROBLEM);

        assertEquals(SessionStatus.COMPLETED, queryService.getLatestSnapshot("cp-a").orElseThrow().state().status());
        assertEquals(SessionStatus.HALTED_CLARIFY, queryService.getLatestSnapshot("cp-b").orElseThrow().state().status());
        assertTrue(queryService.getLatestSnapshot("cp-unknown").isEmpty());
    }

    @Test
    @DisplayName("release drops a session's checkpoints and ignores unknown sessions")
    void release() {
        run("cp-3", TutorGraphFixture.CLEAR_PROBLEM);

        queryService.release("cp-3");
        queryService.release("never-seen");

        assertTrue(queryService.getLatestCheckpoint("cp-3").isEmpty());
    }
}
