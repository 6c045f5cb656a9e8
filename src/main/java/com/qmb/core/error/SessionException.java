package com.qmb.core.error;

/**
 * Thrown when an operation needs an active session and none exists.
 */
public class SessionException extends ModelBuilderException {

    public static final String NO_ACTIVE_SESSION =
            "No active session. Start one with qmb_start_session first.";

    public SessionException(String message) {
        super(ErrorKind.SESSION, message);
    }

    public static SessionException noActiveSession() {
        return new SessionException(NO_ACTIVE_SESSION);
    }
}
