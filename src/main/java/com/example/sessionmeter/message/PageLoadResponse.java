package com.example.sessionmeter.message;

public class PageLoadResponse extends BasicResponse {
    private final String sessionKey;

    private PageLoadResponse(boolean success, String error, String sessionKey) {
        super(success, error);
        this.sessionKey = sessionKey;
    }

    public static PageLoadResponse success(String sessionKey) {
        return new PageLoadResponse(true, null, sessionKey);
    }

    public static PageLoadResponse failure(String error) {
        return new PageLoadResponse(false, error, null);
    }

    public String getSessionKey() { return sessionKey; }
}
