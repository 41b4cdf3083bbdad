package com.example.sessionmeter.service;

import com.example.sessionmeter.model.ActiveSession;
import com.example.sessionmeter.model.DailyUsage;
import com.example.sessionmeter.model.SessionType;
import com.example.sessionmeter.repo.DailyUsageRepo;
import com.example.sessionmeter.strategy.SessionKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Rolls session durations into per-day totals keyed by the session's start date (UTC) and its
 * identifier fields.
 *
 * <p>{@link #reportSession} only ever replaces the still-open amount; {@link #closeSession} is the
 * only operation that moves it into the day's total, so totals never decrease and a closed
 * session is never counted twice.
 */
@Service
public class DailyUsageService {

    private static final Logger logger = LoggerFactory.getLogger(DailyUsageService.class);

    private final DailyUsageRepo dailyUsageRepo;
    private final Executor storeExecutor;
    private final Map<String, DailyUsage> dailyUsages = new ConcurrentHashMap<>();
    private volatile boolean loaded;

    public DailyUsageService(DailyUsageRepo dailyUsageRepo,
                             @Qualifier("sessionStoreExecutor") Executor storeExecutor) {
        this.dailyUsageRepo = dailyUsageRepo;
        this.storeExecutor = storeExecutor;
    }

    public synchronized void initialize() {
        logger.info("Initializing daily usages...");
        dailyUsages.clear();
        for (DailyUsage usage : dailyUsageRepo.findAll()) {
            dailyUsages.put(usage.getKey(), usage);
        }
        loaded = true;
        logger.info("Loaded {} daily usages", dailyUsages.size());
    }

    public boolean isLoaded() {
        return loaded;
    }

    public static String calculateKey(String date, Map<String, String> fields) {
        return date + ":" + SessionKeys.join(fields.values(), "_");
    }

    public static String dateOf(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC).toString();
    }

    public static String calcKeyFromSession(ActiveSession session) {
        return calculateKey(dateOf(session.getStartTime()), session.getIdentifierFields());
    }

    public synchronized DailyUsage reportSession(ActiveSession session) {
        requireLoaded("reportSession");
        String key = calcKeyFromSession(session);
        DailyUsage usage = dailyUsages.get(key);
        if (usage != null) {
            usage.setCurrentSessionDuration(session.durationSeconds());
        } else {
            usage = DailyUsage.builder()
                    .key(key)
                    .date(dateOf(session.getStartTime()))
                    .type(session.getType())
                    .fields(new LinkedHashMap<>(session.getIdentifierFields()))
                    .currentSessionDuration(session.durationSeconds())
                    .totalDuration(0)
                    .build();
            dailyUsages.put(key, usage);
            logger.debug("Created daily usage {}", key);
        }
        persist(usage);
        return usage.toBuilder().build();
    }

    public synchronized Optional<DailyUsage> closeSession(ActiveSession session) {
        requireLoaded("closeSession");
        String key = calcKeyFromSession(session);
        DailyUsage usage = dailyUsages.get(key);
        if (usage == null) {
            logger.warn("closeSession: no daily usage for key {}", key);
            return Optional.empty();
        }
        usage.setTotalDuration(usage.getTotalDuration() + usage.getCurrentSessionDuration());
        usage.setCurrentSessionDuration(0);
        persist(usage);
        logger.debug("Closed session on daily usage {}: total {} s", key, usage.getTotalDuration());
        return Optional.of(usage.toBuilder().build());
    }

    public Optional<DailyUsage> getDailyUsage(String key) {
        requireLoaded("getDailyUsage");
        return Optional.ofNullable(dailyUsages.get(key)).map(u -> u.toBuilder().build());
    }

    public List<DailyUsage> getAllDailyUsages() {
        requireLoaded("getAllDailyUsages");
        return dailyUsages.values().stream()
                .map(u -> u.toBuilder().build())
                .sorted((a, b) -> a.getKey().compareTo(b.getKey()))
                .collect(Collectors.toList());
    }

    public List<DailyUsage> getDailyUsages(SessionType type) {
        return getAllDailyUsages().stream()
                .filter(u -> u.getType() == type)
                .collect(Collectors.toList());
    }

    private void requireLoaded(String operation) {
        if (!loaded) {
            throw new IllegalStateException(operation + ": daily usages not loaded yet");
        }
    }

    private void persist(DailyUsage usage) {
        DailyUsage snapshot = usage.toBuilder().fields(new LinkedHashMap<>(usage.getFields())).build();
        CompletableFuture.runAsync(() -> dailyUsageRepo.save(snapshot), storeExecutor)
                .whenComplete((ignored, e) -> {
                    if (e != null) {
                        logger.error("Failed to save daily usage {}", snapshot.getKey(), e);
                    }
                });
    }
}
