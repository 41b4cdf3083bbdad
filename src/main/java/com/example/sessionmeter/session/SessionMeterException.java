package com.example.sessionmeter.session;

public class SessionMeterException extends RuntimeException {

    public SessionMeterException(String message) {
        super(message);
    }

    public SessionMeterException(String message, Throwable cause) {
        super(message, cause);
    }
}
