package com.example.sessionmeter.session;

/**
 * A session cannot be created because a required identity field is absent.
 */
public class IdentityMissingException extends SessionMeterException {

    private final String field;

    public IdentityMissingException(String field) {
        super("Missing identity field: " + field);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
