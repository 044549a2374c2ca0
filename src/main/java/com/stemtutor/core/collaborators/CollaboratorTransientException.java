package com.stemtutor.core.collaborators;

/**
 * A collaborator failure worth retrying: overload, quota, 5xx or a dropped connection.
 */
public class CollaboratorTransientException extends RuntimeException {

    private final String collaborator;

    public CollaboratorTransientException(String collaborator, String message, Throwable cause) {
        super(message, cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
