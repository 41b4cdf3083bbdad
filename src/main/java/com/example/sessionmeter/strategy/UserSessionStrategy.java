package com.example.sessionmeter.strategy;

import com.example.sessionmeter.model.SessionIdentity;
import com.example.sessionmeter.model.SessionType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One session per user within an organization. Key: {@code userId@orgId}.
 */
public class UserSessionStrategy extends AbstractSessionKeyStrategy {

    @Override
    public SessionType getSessionType() {
        return SessionType.USER_SESSION;
    }

    @Override
    public void validate(SessionIdentity identity) {
        require("userId", identity.getUserId());
        require("orgId", identity.getOrgId());
    }

    @Override
    public SessionIdentity normalize(SessionIdentity identity) {
        return SessionIdentity.user(identity.getUserId(), identity.getOrgId());
    }

    @Override
    public String calcSessionKey(SessionIdentity identity) {
        return SessionKeys.escape(identity.getUserId()) + "@" + SessionKeys.escape(identity.getOrgId());
    }

    @Override
    public Map<String, String> identifierFields(SessionIdentity identity) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("userId", identity.getUserId());
        fields.put("orgId", identity.getOrgId());
        return fields;
    }

    @Override
    public boolean reportsToSessionLog() {
        return true;
    }
}
