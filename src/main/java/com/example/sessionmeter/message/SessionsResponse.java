package com.example.sessionmeter.message;

import com.example.sessionmeter.model.SessionDTO;

import java.util.List;

public class SessionsResponse extends BasicResponse {
    private final List<SessionDTO> sessions;

    private SessionsResponse(boolean success, String error, List<SessionDTO> sessions) {
        super(success, error);
        this.sessions = sessions;
    }

    public static SessionsResponse success(List<SessionDTO> sessions) {
        return new SessionsResponse(true, null, List.copyOf(sessions));
    }

    public static SessionsResponse failure(String error) {
        return new SessionsResponse(false, error, null);
    }

    public List<SessionDTO> getSessions() { return sessions; }
}
