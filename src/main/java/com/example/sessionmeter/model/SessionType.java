package com.example.sessionmeter.model;

import com.example.sessionmeter.strategy.ChartSessionStrategy;
import com.example.sessionmeter.strategy.SessionKeyStrategy;
import com.example.sessionmeter.strategy.UserSessionStrategy;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum SessionType {
    USER_SESSION("UserSession", "user", new UserSessionStrategy()),
    CHART_SESSION("ChartSession", "chart", new ChartSessionStrategy());

    private final String wireName;
    private final String alias;
    private final SessionKeyStrategy strategy;

    SessionType(String wireName, String alias, SessionKeyStrategy strategy) {
        this.wireName = wireName;
        this.alias = alias;
        this.strategy = strategy;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getAlias() {
        return alias;
    }

    public SessionKeyStrategy strategy() {
        return strategy;
    }

    /**
     * Accepts the wire name ("UserSession"), the short alias ("user") or the enum constant name.
     */
    @JsonCreator
    public static SessionType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equalsIgnoreCase(value)
                        || t.alias.equalsIgnoreCase(value)
                        || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown session type: " + value));
    }
}
