package com.stemtutor.core.persistence;

import com.stemtutor.core.model.SessionSnapshot;
import com.stemtutor.core.state.TutorState;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Read and cleanup operations over the checkpoint store, keyed by session id.
 */
@Service
public class CheckpointQueryService {

    private final BaseCheckpointSaver saver;

    public CheckpointQueryService(BaseCheckpointSaver saver) {
        this.saver = saver;
    }

    public Optional<Checkpoint> getLatestCheckpoint(String sessionId) {
        return saver.get(configFor(sessionId));
    }

    public Optional<SessionSnapshot> getLatestSnapshot(String sessionId) {
        return getLatestCheckpoint(sessionId).map(cp -> new SessionSnapshot(
                sessionId,
                new TutorState(cp.getState()),
                cp.getNodeId(),
                cp.getNextNodeId()));
    }

    /**
     * Drops every checkpoint stored for the session. Unknown sessions are a no-op.
     */
    public void release(String sessionId) {
        try {
            if (getLatestCheckpoint(sessionId).isEmpty()) {
                return;
            }
            saver.release(configFor(sessionId));
        } catch (CheckpointStoreException e) {
            throw e;
        } catch (Exception e) {
            throw new CheckpointStoreException("Failed to release checkpoints for session '" + sessionId + "'", e);
        }
    }

    private static RunnableConfig configFor(String sessionId) {
        return RunnableConfig.builder().threadId(sessionId).build();
    }
}
