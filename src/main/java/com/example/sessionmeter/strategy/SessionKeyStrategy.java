package com.example.sessionmeter.strategy;

import com.example.sessionmeter.model.ActiveSession;
import com.example.sessionmeter.model.SessionDTO;
import com.example.sessionmeter.model.SessionIdentity;
import com.example.sessionmeter.model.SessionType;

import java.util.Map;

/**
 * Per-variant identity rules: which fields identify a session, how they become a key and how the
 * session is persisted.
 */
public interface SessionKeyStrategy {

    SessionType getSessionType();

    /**
     * @throws com.example.sessionmeter.session.IdentityMissingException if a required field is blank
     */
    void validate(SessionIdentity identity);

    /**
     * Drops the fields this variant does not use.
     */
    SessionIdentity normalize(SessionIdentity identity);

    String calcSessionKey(SessionIdentity identity);

    /**
     * Exactly the fields used for the key, in key order.
     */
    Map<String, String> identifierFields(SessionIdentity identity);

    /**
     * Whether sessions of this variant write start and end entries to the session log.
     */
    boolean reportsToSessionLog();

    SessionDTO serialize(ActiveSession session);

    ActiveSession deserialize(SessionDTO dto);
}
