package com.example.sessionmeter.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionEvent {
    SESSION_STARTED("session_started"),
    SESSION_ENDED("session_ended");

    private final String value;

    SessionEvent(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
