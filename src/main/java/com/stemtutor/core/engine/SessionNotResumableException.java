package com.stemtutor.core.engine;

import com.stemtutor.core.model.SessionStatus;

/**
 * Resume was requested for a session that is not halted awaiting input,
 * or a run was requested under the id of a completed session.
 */
public class SessionNotResumableException extends RuntimeException {

    private final String sessionId;
    private final SessionStatus status;

    public SessionNotResumableException(String sessionId, SessionStatus status) {
        this(sessionId, status, "Session " + sessionId + " is " + status + " and cannot be resumed");
    }

    public SessionNotResumableException(String sessionId, SessionStatus status, String message) {
        super(message);
        this.sessionId = sessionId;
        this.status = status;
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionStatus getStatus() {
        return status;
    }
}
