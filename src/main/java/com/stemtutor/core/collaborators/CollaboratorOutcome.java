package com.stemtutor.core.collaborators;

public enum CollaboratorOutcome {
    OK,
    DEGRADED_TRANSIENT,
    DEGRADED_PERMANENT;

    public boolean isDegraded() {
        return this != OK;
    }
}
