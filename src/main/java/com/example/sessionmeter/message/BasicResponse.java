package com.example.sessionmeter.message;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * {@code {success, error?}} reply to a message. Failures carry a user-facing error string.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BasicResponse {
    private final boolean success;
    private final String error;

    protected BasicResponse(boolean success, String error) {
        this.success = success;
        this.error = error;
    }

    public static BasicResponse ok() {
        return new BasicResponse(true, null);
    }

    public static BasicResponse failure(String error) {
        return new BasicResponse(false, error);
    }

    public boolean isSuccess() { return success; }
    public String getError() { return error; }
}
