package com.example.sessionmeter.message;

/**
 * Reply to both timeout get and timeout set; {@code timeout} is in seconds.
 */
public class SessionTimeoutResponse extends BasicResponse {
    private final Long timeout;

    private SessionTimeoutResponse(boolean success, String error, Long timeout) {
        super(success, error);
        this.timeout = timeout;
    }

    public static SessionTimeoutResponse success(long timeout) {
        return new SessionTimeoutResponse(true, null, timeout);
    }

    public static SessionTimeoutResponse failure(String error) {
        return new SessionTimeoutResponse(false, error, null);
    }

    public Long getTimeout() { return timeout; }
}
