package com.example.sessionmeter.config;

import com.example.sessionmeter.kv.KvClient;
import com.example.sessionmeter.model.SessionType;
import com.example.sessionmeter.service.DailyUsageService;
import com.example.sessionmeter.service.SessionLogService;
import com.example.sessionmeter.session.SessionManager;
import com.example.sessionmeter.session.SessionManagerSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class SessionMeterConfig {

    @Value("${app.sessions.debounce-ms:3000}")
    private long debounceMs;

    @Value("${app.sessions.throttle-ms:10000}")
    private long throttleMs;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Single writer thread shared by every store write, so writes land in the order they were
     * issued.
     */
    @Bean(name = "sessionStoreExecutor", destroyMethod = "shutdown")
    public ExecutorService sessionStoreExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "session-store-writer");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(destroyMethod = "shutdown")
    public SessionManager userSessionManager(@Value("${app.sessions.user.name:user_sessions}") String name,
                                             @Value("${app.sessions.user.timeout-seconds:180}") long timeoutSeconds,
                                             KvClient kvClient,
                                             ObjectMapper objectMapper,
                                             DailyUsageService dailyUsageService,
                                             SessionLogService sessionLogService,
                                             @Qualifier("sessionStoreExecutor") Executor storeExecutor,
                                             Clock clock) {
        return new SessionManager(settings(name, SessionType.USER_SESSION, timeoutSeconds),
                kvClient, objectMapper, dailyUsageService, sessionLogService, storeExecutor, clock);
    }

    @Bean(destroyMethod = "shutdown")
    public SessionManager chartSessionManager(@Value("${app.sessions.chart.name:chart_sessions}") String name,
                                              @Value("${app.sessions.chart.timeout-seconds:60}") long timeoutSeconds,
                                              KvClient kvClient,
                                              ObjectMapper objectMapper,
                                              DailyUsageService dailyUsageService,
                                              SessionLogService sessionLogService,
                                              @Qualifier("sessionStoreExecutor") Executor storeExecutor,
                                              Clock clock) {
        return new SessionManager(settings(name, SessionType.CHART_SESSION, timeoutSeconds),
                kvClient, objectMapper, dailyUsageService, sessionLogService, storeExecutor, clock);
    }

    private SessionManagerSettings settings(String name, SessionType type, long timeoutSeconds) {
        return SessionManagerSettings.builder()
                .name(name)
                .sessionType(type)
                .sessionTimeout(Duration.ofSeconds(timeoutSeconds))
                .debounceDelay(Duration.ofMillis(debounceMs))
                .throttleDelay(Duration.ofMillis(throttleMs))
                .build();
    }
}
