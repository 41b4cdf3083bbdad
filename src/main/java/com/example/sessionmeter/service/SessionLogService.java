package com.example.sessionmeter.service;

import com.example.sessionmeter.model.SessionEvent;
import com.example.sessionmeter.model.SessionLogEntry;
import com.example.sessionmeter.model.SessionType;
import com.example.sessionmeter.repo.SessionLogRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Append-only audit log of session start and end events.
 */
@Service
public class SessionLogService {

    private static final Logger logger = LoggerFactory.getLogger(SessionLogService.class);

    private final SessionLogRepo sessionLogRepo;
    private final Executor storeExecutor;

    public SessionLogService(SessionLogRepo sessionLogRepo,
                             @Qualifier("sessionStoreExecutor") Executor storeExecutor) {
        this.sessionLogRepo = sessionLogRepo;
        this.storeExecutor = storeExecutor;
    }

    public CompletableFuture<SessionLogEntry> logSessionEvent(SessionEvent event, Instant eventTime, Instant logTime,
                                                              String username, long durationMs,
                                                              SessionType sessionType, String sessionKey) {
        SessionLogEntry entry = SessionLogEntry.builder()
                .event(event.getValue())
                .eventTime(eventTime)
                .logTime(logTime)
                .username(username)
                .duration(durationMs)
                .sessionType(sessionType)
                .sessionKey(sessionKey)
                .build();

        return CompletableFuture.supplyAsync(() -> {
            sessionLogRepo.save(entry);
            logger.info("Event logged: {} for {} (duration {} ms)", entry.getEvent(), username, durationMs);
            return entry;
        }, storeExecutor).whenComplete((saved, e) -> {
            if (e != null) {
                logger.error("Failed to log {} event for {}", entry.getEvent(), username, e);
            }
        });
    }

    public List<SessionLogEntry> getSessionLogs() {
        return sessionLogRepo.findAllByOrderByLogTimeAsc();
    }

    public void clearSessionLogs() {
        sessionLogRepo.deleteAll();
        logger.info("Session logs cleared");
    }
}
