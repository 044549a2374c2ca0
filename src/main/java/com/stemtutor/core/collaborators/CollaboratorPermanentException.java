package com.stemtutor.core.collaborators;

/**
 * A collaborator failure that retrying cannot fix: malformed or empty output, or a rejected request.
 */
public class CollaboratorPermanentException extends RuntimeException {

    private final String collaborator;

    public CollaboratorPermanentException(String collaborator, String message, Throwable cause) {
        super(message, cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
