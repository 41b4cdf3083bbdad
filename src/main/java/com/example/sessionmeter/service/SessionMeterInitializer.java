package com.example.sessionmeter.service;

import com.example.sessionmeter.session.SessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Loads daily usages, then starts every session manager. A manager that fails to start stays
 * uninitialized and rejects events until the next restart.
 */
@Component
public class SessionMeterInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(SessionMeterInitializer.class);

    private final DailyUsageService dailyUsageService;
    private final List<SessionManager> sessionManagers;

    public SessionMeterInitializer(DailyUsageService dailyUsageService, List<SessionManager> sessionManagers) {
        this.dailyUsageService = dailyUsageService;
        this.sessionManagers = sessionManagers;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            dailyUsageService.initialize();
        } catch (RuntimeException e) {
            logger.error("Failed to load daily usages, session managers not started", e);
            return;
        }
        for (SessionManager manager : sessionManagers) {
            try {
                manager.initialize().join();
            } catch (CompletionException e) {
                logger.error("Failed to initialize session manager {}", manager.getManagerName(), e.getCause());
            }
        }
    }
}
