package com.stemtutor.core.nodes;

import com.stemtutor.core.state.TutorState;

import java.util.Map;

/**
 * One independent content step run concurrently by {@link ParallelTeachingNode}.
 * Branches are merged in {@link org.springframework.core.annotation.Order} order,
 * so the later branch wins when two deltas name the same key.
 */
public interface TeachingBranch {

    String name();

    Map<String, Object> apply(TutorState state);

    /**
     * Delta used when {@link #apply} throws.
     */
    Map<String, Object> fallback(TutorState state);
}
