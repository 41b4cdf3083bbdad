package com.example.sessionmeter.message;

public class UserInputResponse extends BasicResponse {
    private final String sessionKey;

    private UserInputResponse(boolean success, String error, String sessionKey) {
        super(success, error);
        this.sessionKey = sessionKey;
    }

    public static UserInputResponse success(String sessionKey) {
        return new UserInputResponse(true, null, sessionKey);
    }

    public static UserInputResponse failure(String error) {
        return new UserInputResponse(false, error, null);
    }

    public String getSessionKey() { return sessionKey; }
}
