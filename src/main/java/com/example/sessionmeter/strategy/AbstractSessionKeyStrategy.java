package com.example.sessionmeter.strategy;

import com.example.sessionmeter.model.ActiveSession;
import com.example.sessionmeter.model.SessionDTO;
import com.example.sessionmeter.model.SessionIdentity;
import com.example.sessionmeter.session.IdentityMissingException;

import java.time.Instant;
import java.time.format.DateTimeParseException;

abstract class AbstractSessionKeyStrategy implements SessionKeyStrategy {

    protected static void require(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new IdentityMissingException(field);
        }
    }

    @Override
    public SessionDTO serialize(ActiveSession session) {
        SessionIdentity identity = normalize(session.getIdentity());
        return SessionDTO.builder()
                .userId(identity.getUserId())
                .orgId(identity.getOrgId())
                .chartType(identity.getChartType())
                .chartName(identity.getChartName())
                .startTime(session.getStartTime().toString())
                .lastActivityTime(session.getLastActivityTime() != null
                        ? session.getLastActivityTime().toString() : null)
                .activitySeen(session.isActivitySeen())
                .build();
    }

    @Override
    public ActiveSession deserialize(SessionDTO dto) {
        SessionIdentity identity = normalize(new SessionIdentity(
                dto.getUserId(), dto.getOrgId(), dto.getChartType(), dto.getChartName()));
        validate(identity);
        try {
            return new ActiveSession(
                    getSessionType(),
                    identity,
                    Instant.parse(dto.getStartTime()),
                    dto.isActivitySeen(),
                    dto.getLastActivityTime() != null ? Instant.parse(dto.getLastActivityTime()) : null);
        } catch (DateTimeParseException | NullPointerException e) {
            throw new IllegalArgumentException("Invalid session timestamps for " + calcSessionKey(identity), e);
        }
    }
}
