package com.example.sessionmeter.session;

import com.example.sessionmeter.kv.KvClient;
import com.example.sessionmeter.model.ActiveSession;
import com.example.sessionmeter.model.SessionDTO;
import com.example.sessionmeter.model.SessionEvent;
import com.example.sessionmeter.model.SessionIdentity;
import com.example.sessionmeter.model.SessionType;
import com.example.sessionmeter.service.DailyUsageService;
import com.example.sessionmeter.service.SessionLogService;
import com.example.sessionmeter.strategy.SessionKeyStrategy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Owns the live sessions of one {@link SessionType}: the session table, the tab to session
 * mapping, one expiration timer per session and the debounced persistence of the table.
 *
 * <p>Every handler runs on the manager's own single thread, so a lookup followed by a create for
 * the same key can never interleave with another event. Persistence runs on the shared store
 * executor and never blocks that thread. A failed write fails the returned future only; the
 * in-memory table stays authoritative until the next successful write.
 *
 * <p>Per key: absent, then active without activity (created by a page load), then active with
 * activity (first input logs {@code session_started}), then terminated by the expiration timer or
 * an explicit call (logs {@code session_ended} only if activity was seen), then absent again.
 * Only variants whose strategy reports to the session log write those entries.
 */
public class SessionManager {

    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    static final Duration MIN_SESSION_DURATION = Duration.ofMillis(1000);
    private static final TypeReference<LinkedHashMap<String, SessionDTO>> SESSION_TABLE_TYPE = new TypeReference<>() {};

    private final String managerName;
    private final SessionType sessionType;
    private final SessionKeyStrategy strategy;
    private final KvClient kvClient;
    private final ObjectMapper objectMapper;
    private final DailyUsageService dailyUsageService;
    private final SessionLogService sessionLogService;
    private final Executor storeExecutor;
    private final Clock clock;
    private final Duration debounceDelay;
    private final Duration throttleDelay;
    private final String sessionsKey;
    private final String sessionTimeoutKey;
    private final ScheduledThreadPoolExecutor loop;

    // confined to the loop thread
    private final Map<String, ActiveSession> sessions = new LinkedHashMap<>();
    private final Map<Integer, String> tabIdToSessionKey = new HashMap<>();
    private final Map<String, ScheduledFuture<?>> expirationTimers = new HashMap<>();
    private final Map<String, DebounceThrottle> debouncedUpdates = new HashMap<>();

    private CompletableFuture<Void> lastTableWrite = CompletableFuture.completedFuture(null);

    private volatile boolean initialized;
    private volatile Duration sessionTimeout;

    public SessionManager(SessionManagerSettings settings,
                          KvClient kvClient,
                          ObjectMapper objectMapper,
                          DailyUsageService dailyUsageService,
                          SessionLogService sessionLogService,
                          Executor storeExecutor,
                          Clock clock) {
        this.managerName = settings.getName();
        this.sessionType = settings.getSessionType();
        this.strategy = sessionType.strategy();
        this.kvClient = kvClient;
        this.objectMapper = objectMapper;
        this.dailyUsageService = dailyUsageService;
        this.sessionLogService = sessionLogService;
        this.storeExecutor = storeExecutor;
        this.clock = clock;
        this.debounceDelay = settings.getDebounceDelay();
        this.throttleDelay = settings.getThrottleDelay();
        this.sessionTimeout = settings.getSessionTimeout();
        this.sessionsKey = managerName + ":sessions";
        this.sessionTimeoutKey = managerName + ":session_timeout";
        this.loop = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "session-manager-" + managerName);
            t.setDaemon(true);
            return t;
        });
        this.loop.setRemoveOnCancelPolicy(true);
    }

    public String getManagerName() {
        return managerName;
    }

    public SessionType getSessionType() {
        return sessionType;
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Loads the persisted table and terminates every session in it. A persisted session means the
     * previous run ended without logging {@code session_ended}; closing them here keeps every
     * logged start paired with an end. The configured timeout is loaded before that, so a failed
     * log write while closing them never leaves the manager on the default timeout.
     */
    public CompletableFuture<Void> initialize() {
        if (!dailyUsageService.isLoaded()) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Daily usages must be loaded before " + managerName + " starts"));
        }
        logger.info("{}: initializing session manager...", managerName);
        return CompletableFuture.supplyAsync(this::readSessionTable, storeExecutor)
                .thenCompose(table -> CompletableFuture.supplyAsync(this::readSessionTimeout, storeExecutor)
                        .exceptionally(e -> {
                            logger.error("{}: failed to load session timeout, keeping {} s",
                                    managerName, sessionTimeout.toSeconds(), e);
                            return Optional.empty();
                        })
                        .thenApply(timeout -> {
                            timeout.ifPresent(t -> sessionTimeout = t);
                            return table;
                        }))
                .thenComposeAsync(this::installAndTerminateAll, loop)
                .thenRun(() -> logger.info("{}: session manager initialized, timeout {} s",
                        managerName, sessionTimeout.toSeconds()));
    }

    /**
     * Finds or creates the session for a page load and maps the tab to it. A page load alone is
     * not activity; a new session still starts its expiration timer.
     *
     * @return the session key, once any resulting table write has completed
     */
    public CompletableFuture<String> handlePageLoad(SessionIdentity identity, Instant pageStartTime, Integer tabId) {
        return onLoop(() -> {
            requireInitialized("handlePageLoad");
            Resolved resolved = findOrCreateSession(identity, pageStartTime);
            mapTab(tabId, resolved.sessionKey);
            return resolved.written.thenApply(v -> resolved.sessionKey);
        });
    }

    /**
     * Records user activity against the session for {@code identity}, creating it if needed.
     */
    public CompletableFuture<String> handleUserInput(SessionIdentity identity, Instant timestamp, Integer tabId) {
        return onLoop(() -> {
            requireInitialized("handleUserInput");
            Instant activityTime = timestamp != null ? timestamp : clock.instant();
            Resolved resolved = findOrCreateSession(identity, activityTime);
            mapTab(tabId, resolved.sessionKey);
            updateLastActivity(resolved.sessionKey, activityTime);
            return resolved.written.thenApply(v -> resolved.sessionKey);
        });
    }

    public CompletableFuture<Void> terminateSession(String sessionKey) {
        return onLoop(() -> terminate(sessionKey));
    }

    /**
     * Runs the closed tab's pending debounced write now, or writes the table if nothing was pending. The session itself stays alive: the same
     * identity may be active in other tabs or come back before its timeout.
     */
    public CompletableFuture<Void> onTabRemove(int tabId) {
        return onLoop(() -> {
            String sessionKey = tabIdToSessionKey.remove(tabId);
            if (sessionKey == null) {
                logger.debug("{}: no sessionKey found for tabId {}", managerName, tabId);
                return CompletableFuture.completedFuture(null);
            }
            DebounceThrottle debouncer = debouncedUpdates.get(sessionKey);
            if (debouncer != null && debouncer.flush()) {
                logger.debug("{}: flushed pending write of sessionKey {} on close of tab {}", managerName, sessionKey, tabId);
                return lastTableWrite;
            }
            if (!sessions.containsKey(sessionKey)) {
                logger.warn("{}: tab {} pointed at unknown sessionKey {}", managerName, tabId, sessionKey);
                return CompletableFuture.completedFuture(null);
            }
            logger.debug("{}: writing sessionKey {} on close of tab {}", managerName, sessionKey, tabId);
            return persistSessions();
        });
    }

    public long getSessionTimeout() {
        return sessionTimeout.toSeconds();
    }

    /**
     * Changes the expiration timeout. Timers already running keep their delay; the new value
     * applies from the next activity.
     */
    public CompletableFuture<Void> setSessionTimeout(long timeoutSeconds) {
        if (timeoutSeconds <= 0) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Session timeout must be positive: " + timeoutSeconds));
        }
        sessionTimeout = Duration.ofSeconds(timeoutSeconds);
        logger.info("{}: session timeout set to {} s", managerName, timeoutSeconds);
        return CompletableFuture.runAsync(() -> {
            try {
                kvClient.set(sessionTimeoutKey, Long.toString(timeoutSeconds));
            } catch (RuntimeException e) {
                throw new SessionStoreException("Failed to save session timeout for " + managerName, e);
            }
        }, storeExecutor);
    }

    public CompletableFuture<List<SessionDTO>> getSessions() {
        return onLoop(() -> {
            requireInitialized("getSessions");
            List<SessionDTO> dtos = sessions.values().stream()
                    .map(strategy::serialize)
                    .collect(Collectors.toList());
            return CompletableFuture.completedFuture(dtos);
        });
    }

    public CompletableFuture<Optional<SessionDTO>> getSession(String sessionKey) {
        return onLoop(() -> {
            requireInitialized("getSession");
            return CompletableFuture.completedFuture(
                    Optional.ofNullable(sessions.get(sessionKey)).map(strategy::serialize));
        });
    }

    public CompletableFuture<Optional<String>> getSessionKeyForTab(int tabId) {
        return onLoop(() -> CompletableFuture.completedFuture(Optional.ofNullable(tabIdToSessionKey.get(tabId))));
    }

    /**
     * Stops all timers, writes the table once more and stops the manager thread. Sessions are left
     * in the store so the next start can close them.
     */
    public void shutdown() {
        logger.info("{}: shutting down session manager", managerName);
        try {
            onLoop(() -> {
                expirationTimers.values().forEach(t -> t.cancel(false));
                expirationTimers.clear();
                debouncedUpdates.values().forEach(DebounceThrottle::cancel);
                debouncedUpdates.clear();
                return initialized ? persistSessions() : CompletableFuture.<Void>completedFuture(null);
            }).get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("{}: final session write failed: {}", managerName, e.getMessage());
        } finally {
            loop.shutdownNow();
        }
    }

    // Everything below runs on the loop thread.

    private CompletableFuture<Void> installAndTerminateAll(Map<String, ActiveSession> loaded) {
        sessions.clear();
        sessions.putAll(loaded);
        initialized = true;
        logger.info("{}: loaded {} persisted sessions, terminating them", managerName, loaded.size());
        List<CompletableFuture<Void>> terminations = new ArrayList<>();
        for (String sessionKey : new ArrayList<>(sessions.keySet())) {
            terminations.add(terminate(sessionKey));
        }
        // serving from here on, so write failures are logged rather than failing initialize()
        return CompletableFuture.allOf(terminations.toArray(new CompletableFuture[0]))
                .exceptionally(e -> {
                    logger.error("{}: not every recovered session was closed cleanly in the store", managerName, e);
                    return null;
                });
    }

    private Resolved findOrCreateSession(SessionIdentity identity, Instant startTime) {
        if (identity == null) {
            throw new IdentityMissingException("userId");
        }
        SessionIdentity normalized = strategy.normalize(identity);
        strategy.validate(normalized);
        String sessionKey = strategy.calcSessionKey(normalized);
        if (sessions.containsKey(sessionKey)) {
            logger.debug("{}: session already exists for sessionKey {}", managerName, sessionKey);
            return new Resolved(sessionKey, CompletableFuture.completedFuture(null));
        }

        ActiveSession session = new ActiveSession(sessionType, normalized,
                startTime != null ? startTime : clock.instant());
        sessions.put(sessionKey, session);
        logger.info("{}: new session created for sessionKey {}", managerName, sessionKey);
        dailyUsageService.reportSession(session);
        armExpirationTimer(sessionKey);
        return new Resolved(sessionKey, persistSessions());
    }

    private void mapTab(Integer tabId, String sessionKey) {
        if (tabId != null) {
            tabIdToSessionKey.put(tabId, sessionKey);
        }
    }

    private void updateLastActivity(String sessionKey, Instant timestamp) {
        ActiveSession session = sessions.get(sessionKey);
        if (session == null) {
            logger.warn("{}: activity for unknown sessionKey {} dropped", managerName, sessionKey);
            return;
        }
        if (session.markActivitySeen()) {
            logger.info("{}: first activity on {} at {}", managerName, sessionKey, timestamp);
            reportToSessionLog(SessionEvent.SESSION_STARTED, session.getStartTime(), session, 0, sessionKey);
        }
        session.recordActivity(timestamp);
        dailyUsageService.reportSession(session);
        armExpirationTimer(sessionKey);
        debouncedUpdates
                .computeIfAbsent(sessionKey, k -> new DebounceThrottle(loop, debounceDelay, throttleDelay, clock))
                .debounce(() -> persistLastActivity(sessionKey));
    }

    private void persistLastActivity(String sessionKey) {
        if (!sessions.containsKey(sessionKey)) {
            logger.warn("{}: session not found for sessionKey {}, last activity not persisted", managerName, sessionKey);
            return;
        }
        persistSessions();
    }

    private void armExpirationTimer(String sessionKey) {
        clearExpirationTimer(sessionKey);
        long delayMs = sessionTimeout.toMillis();
        ScheduledFuture<?> timer = loop.schedule(() -> {
            expirationTimers.remove(sessionKey);
            logger.info("{}: session expired for sessionKey {}", managerName, sessionKey);
            try {
                terminate(sessionKey);
            } catch (RuntimeException e) {
                logger.error("{}: failed to terminate expired session {}", managerName, sessionKey, e);
            }
        }, delayMs, TimeUnit.MILLISECONDS);
        expirationTimers.put(sessionKey, timer);
    }

    private void clearExpirationTimer(String sessionKey) {
        ScheduledFuture<?> timer = expirationTimers.remove(sessionKey);
        if (timer != null) {
            timer.cancel(false);
        }
    }

    private CompletableFuture<Void> terminate(String sessionKey) {
        requireInitialized("terminateSession");
        ActiveSession session = sessions.get(sessionKey);
        if (session == null) {
            logger.warn("{}: no active session found for sessionKey {}", managerName, sessionKey);
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<?> logged = CompletableFuture.completedFuture(null);
        if (session.isActivitySeen()) {
            Instant endTime = session.getLastActivityTime() != null ? session.getLastActivityTime() : session.getStartTime();
            Duration duration = session.duration();
            if (duration.compareTo(MIN_SESSION_DURATION) < 0) {
                duration = MIN_SESSION_DURATION;
            }
            logged = reportToSessionLog(SessionEvent.SESSION_ENDED, endTime, session, duration.toMillis(), sessionKey);
        }

        clearExpirationTimer(sessionKey);
        DebounceThrottle debouncer = debouncedUpdates.remove(sessionKey);
        if (debouncer != null) {
            debouncer.cancel();
        }
        dailyUsageService.reportSession(session);
        dailyUsageService.closeSession(session);
        tabIdToSessionKey.values().removeIf(sessionKey::equals);
        sessions.remove(sessionKey);
        logger.info("{}: session terminated for sessionKey {}", managerName, sessionKey);

        return CompletableFuture.allOf(logged, persistSessions());
    }

    private CompletableFuture<?> reportToSessionLog(SessionEvent event, Instant eventTime, ActiveSession session,
                                                    long durationMs, String sessionKey) {
        if (!strategy.reportsToSessionLog()) {
            logger.debug("{}: {} for {} not reported to the session log", managerName, event.getValue(), sessionKey);
            return CompletableFuture.completedFuture(null);
        }
        return sessionLogService.logSessionEvent(event, eventTime, clock.instant(),
                session.getIdentity().username(), durationMs, sessionType, sessionKey);
    }

    private CompletableFuture<Void> persistSessions() {
        Map<String, SessionDTO> table = new LinkedHashMap<>();
        sessions.forEach((key, session) -> table.put(key, strategy.serialize(session)));
        String json;
        try {
            json = objectMapper.writeValueAsString(table);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new SessionStoreException("Failed to serialize sessions for " + managerName, e));
        }
        lastTableWrite = CompletableFuture.runAsync(() -> {
            try {
                kvClient.set(sessionsKey, json);
            } catch (RuntimeException e) {
                throw new SessionStoreException("Failed to save sessions for " + managerName, e);
            }
        }, storeExecutor).whenComplete((v, e) -> {
            if (e != null) {
                logger.error("{}: failed to save sessions", managerName, e);
            } else {
                logger.debug("{}: saved {} sessions", managerName, table.size());
            }
        });
        return lastTableWrite;
    }

    private void requireInitialized(String operation) {
        if (!initialized) {
            logger.warn("{}: {} attempted before initialization", managerName, operation);
            throw new SessionManagerNotInitializedException(managerName);
        }
    }

    // Store-executor reads

    private Map<String, ActiveSession> readSessionTable() {
        Optional<String> json;
        Map<String, SessionDTO> table;
        try {
            json = kvClient.get(sessionsKey);
            table = json.isPresent() ? objectMapper.readValue(json.get(), SESSION_TABLE_TYPE) : Map.of();
        } catch (JsonProcessingException | RuntimeException e) {
            throw new SessionStoreException("Failed to load sessions for " + managerName, e);
        }
        Map<String, ActiveSession> loaded = new LinkedHashMap<>();
        table.forEach((storedKey, dto) -> {
            try {
                ActiveSession session = strategy.deserialize(dto);
                loaded.put(session.getSessionKey(), session);
            } catch (RuntimeException e) {
                logger.warn("{}: skipping unreadable persisted session {}: {}", managerName, storedKey, e.getMessage());
            }
        });
        return loaded;
    }

    private Optional<Duration> readSessionTimeout() {
        return kvClient.get(sessionTimeoutKey)
                .map(String::trim)
                .map(Long::parseLong)
                .filter(seconds -> seconds > 0)
                .map(Duration::ofSeconds);
    }

    private <T> CompletableFuture<T> onLoop(Supplier<CompletableFuture<T>> action) {
        try {
            return CompletableFuture.supplyAsync(action, loop).thenCompose(Function.identity());
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new IllegalStateException(managerName + " is shut down", e));
        }
    }

    private static final class Resolved {
        private final String sessionKey;
        private final CompletableFuture<Void> written;

        private Resolved(String sessionKey, CompletableFuture<Void> written) {
            this.sessionKey = sessionKey;
            this.written = written;
        }
    }
}
