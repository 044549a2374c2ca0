package com.stemtutor.core.collaborators;

/**
 * Value returned by a collaborator call, or its fallback, with how it was obtained.
 */
public record CollaboratorResult<T>(T value, CollaboratorOutcome outcome, int attempts) {

    public boolean degraded() {
        return outcome.isDegraded();
    }
}
