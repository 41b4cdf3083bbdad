package com.example.sessionmeter.session;

import com.example.sessionmeter.model.SessionType;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class SessionManagerSettings {
    String name;
    SessionType sessionType;
    @Builder.Default
    Duration sessionTimeout = Duration.ofSeconds(180);
    @Builder.Default
    Duration debounceDelay = Duration.ofMillis(3000);
    @Builder.Default
    Duration throttleDelay = Duration.ofMillis(10000);
}
