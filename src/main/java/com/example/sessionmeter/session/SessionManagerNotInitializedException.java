package com.example.sessionmeter.session;

public class SessionManagerNotInitializedException extends SessionMeterException {

    public SessionManagerNotInitializedException(String managerName) {
        super("Session manager " + managerName + " is not initialized");
    }
}
