package com.example.sessionmeter.session;

/**
 * Reading or writing persisted session state failed. In-memory state is left as it was.
 */
public class SessionStoreException extends SessionMeterException {

    public SessionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
