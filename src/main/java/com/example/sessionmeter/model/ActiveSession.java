package com.example.sessionmeter.model;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A live session held by a session manager. Expiration timers are not part of the entity; the
 * manager keeps them in its own table keyed by {@link #getSessionKey()}.
 */
@Getter
@ToString
public class ActiveSession {

    private final SessionType type;
    private final SessionIdentity identity;
    private final Instant startTime;
    private boolean activitySeen;
    private Instant lastActivityTime;

    public ActiveSession(SessionType type, SessionIdentity identity, Instant startTime) {
        this(type, identity, startTime, false, null);
    }

    public ActiveSession(SessionType type, SessionIdentity identity, Instant startTime,
                         boolean activitySeen, Instant lastActivityTime) {
        this.type = Objects.requireNonNull(type, "type");
        this.identity = Objects.requireNonNull(identity, "identity");
        this.startTime = Objects.requireNonNull(startTime, "startTime");
        this.activitySeen = activitySeen;
        this.lastActivityTime = lastActivityTime == null || !lastActivityTime.isBefore(startTime)
                ? lastActivityTime : startTime;
    }

    public String getSessionKey() {
        return type.strategy().calcSessionKey(identity);
    }

    public Map<String, String> getIdentifierFields() {
        return type.strategy().identifierFields(identity);
    }

    /**
     * Marks the first activity. Returns true only on the unseen to seen transition.
     */
    public boolean markActivitySeen() {
        if (activitySeen) {
            return false;
        }
        activitySeen = true;
        return true;
    }

    public void recordActivity(Instant timestamp) {
        Objects.requireNonNull(timestamp, "timestamp");
        // clock skew between page and manager must not produce negative durations
        this.lastActivityTime = timestamp.isBefore(startTime) ? startTime : timestamp;
    }

    public Duration duration() {
        return lastActivityTime == null ? Duration.ZERO : Duration.between(startTime, lastActivityTime);
    }

    public double durationSeconds() {
        return duration().toMillis() / 1000.0;
    }
}
