package com.stemtutor.core.model;

import com.stemtutor.core.state.TutorState;

/**
 * Latest persisted view of a session: its state plus the graph position.
 */
public record SessionSnapshot(
        String sessionId,
        TutorState state,
        String lastCompletedStep,
        String nextStep
) {}
