package com.stemtutor.core.model;

/**
 * Lifecycle states of a tutoring session.
 */
public enum SessionStatus {
    RUNNING,
    HALTED_CLARIFY,
    HALTED_DISAMBIGUATE,
    COMPLETED,
    FAILED;

    public boolean isHalted() {
        return this == HALTED_CLARIFY || this == HALTED_DISAMBIGUATE;
    }
}
