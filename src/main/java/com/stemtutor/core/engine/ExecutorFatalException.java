package com.stemtutor.core.engine;

/**
 * An executor-internal fault aborted the run: the checkpoint store failed,
 * the graph reached an unknown step or route, or the runtime itself failed.
 * Collaborator failures never surface as this exception.
 */
public class ExecutorFatalException extends RuntimeException {

    private final String sessionId;

    public ExecutorFatalException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
