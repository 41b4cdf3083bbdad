package com.example.sessionmeter.service;

import com.example.sessionmeter.message.ActivityMessage;
import com.example.sessionmeter.message.BasicResponse;
import com.example.sessionmeter.message.PageLoadMessage;
import com.example.sessionmeter.message.PageLoadResponse;
import com.example.sessionmeter.message.SessionTimeoutResponse;
import com.example.sessionmeter.message.SessionTimeoutSetMessage;
import com.example.sessionmeter.message.SessionsResponse;
import com.example.sessionmeter.message.UserInputMessage;
import com.example.sessionmeter.message.UserInputResponse;
import com.example.sessionmeter.model.DailyUsage;
import com.example.sessionmeter.model.SessionIdentity;
import com.example.sessionmeter.model.SessionLogEntry;
import com.example.sessionmeter.model.SessionType;
import com.example.sessionmeter.session.IdentityMissingException;
import com.example.sessionmeter.session.SessionManager;
import com.example.sessionmeter.session.SessionManagerNotInitializedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.BiConsumer;

/**
 * Entry point for messages from the page script. Every activity message goes to the user
 * session manager; messages that also name a chart go to the chart session manager too. Replies
 * reflect the user session only.
 */
@Service
public class SessionMeterService {

    private static final Logger logger = LoggerFactory.getLogger(SessionMeterService.class);

    static final String NO_TAB_ID = "tabId is undefined";
    static final String NO_IDENTITY = "No userId or orgCode provided";
    static final String NOT_INITIALIZED = "Session manager is not initialized";

    private final SessionManager userSessionManager;
    private final SessionManager chartSessionManager;
    private final SessionLogService sessionLogService;
    private final DailyUsageService dailyUsageService;

    public SessionMeterService(@Qualifier("userSessionManager") SessionManager userSessionManager,
                               @Qualifier("chartSessionManager") SessionManager chartSessionManager,
                               SessionLogService sessionLogService,
                               DailyUsageService dailyUsageService) {
        this.userSessionManager = userSessionManager;
        this.chartSessionManager = chartSessionManager;
        this.sessionLogService = sessionLogService;
        this.dailyUsageService = dailyUsageService;
    }

    public CompletableFuture<PageLoadResponse> handlePageLoad(PageLoadMessage message) {
        if (message.getTabId() == null) {
            logger.warn("Page load without tabId from {}", message.getUsername());
            return CompletableFuture.completedFuture(PageLoadResponse.failure(NO_TAB_ID));
        }
        SessionIdentity identity = message.toIdentity();
        if (identity.hasChart()) {
            chartSessionManager.handlePageLoad(identity, message.getPageStartTime(), message.getTabId())
                    .whenComplete(logChartFailure("page load", message));
        }
        return userSessionManager.handlePageLoad(identity, message.getPageStartTime(), message.getTabId())
                .handle((sessionKey, e) -> e == null
                        ? PageLoadResponse.success(sessionKey)
                        : PageLoadResponse.failure(errorMessage("page load", e)));
    }

    public CompletableFuture<UserInputResponse> handleUserInput(UserInputMessage message) {
        if (message.getTabId() == null) {
            logger.warn("User input without tabId from {}", message.getUsername());
            return CompletableFuture.completedFuture(UserInputResponse.failure(NO_TAB_ID));
        }
        logger.debug("User input {} from {}", message.getInputType(), message.getUsername());
        SessionIdentity identity = message.toIdentity();
        if (identity.hasChart()) {
            chartSessionManager.handleUserInput(identity, message.getTimestamp(), message.getTabId())
                    .whenComplete(logChartFailure("user input", message));
        }
        return userSessionManager.handleUserInput(identity, message.getTimestamp(), message.getTabId())
                .handle((sessionKey, e) -> e == null
                        ? UserInputResponse.success(sessionKey)
                        : UserInputResponse.failure(errorMessage("user input", e)));
    }

    public CompletableFuture<Void> onTabRemove(int tabId) {
        logger.debug("Tab {} removed", tabId);
        return CompletableFuture.allOf(
                userSessionManager.onTabRemove(tabId),
                chartSessionManager.onTabRemove(tabId));
    }

    public CompletableFuture<SessionsResponse> getSessions(SessionType type) {
        return managerFor(type).getSessions()
                .handle((sessions, e) -> e == null
                        ? SessionsResponse.success(sessions)
                        : SessionsResponse.failure(errorMessage("sessions get", e)));
    }

    public SessionTimeoutResponse getSessionTimeout(SessionType type) {
        return SessionTimeoutResponse.success(managerFor(type).getSessionTimeout());
    }

    public CompletableFuture<SessionTimeoutResponse> setSessionTimeout(SessionType type, SessionTimeoutSetMessage message) {
        if (message == null || message.getTimeout() == null) {
            return CompletableFuture.completedFuture(SessionTimeoutResponse.failure("timeout is undefined"));
        }
        SessionManager manager = managerFor(type);
        return manager.setSessionTimeout(message.getTimeout())
                .handle((v, e) -> e == null
                        ? SessionTimeoutResponse.success(manager.getSessionTimeout())
                        : SessionTimeoutResponse.failure(errorMessage("session timeout set", e)));
    }

    public List<SessionLogEntry> getSessionLogs() {
        return sessionLogService.getSessionLogs();
    }

    public BasicResponse clearSessionLogs() {
        sessionLogService.clearSessionLogs();
        return BasicResponse.ok();
    }

    public List<DailyUsage> getDailyUsages(SessionType type) {
        return type == null ? dailyUsageService.getAllDailyUsages() : dailyUsageService.getDailyUsages(type);
    }

    public List<SessionManager> getManagers() {
        return List.of(userSessionManager, chartSessionManager);
    }

    private SessionManager managerFor(SessionType type) {
        return type == SessionType.CHART_SESSION ? chartSessionManager : userSessionManager;
    }

    private BiConsumer<String, Throwable> logChartFailure(String operation, ActivityMessage message) {
        return (sessionKey, e) -> {
            if (e != null) {
                logger.warn("Chart session {} failed for {}: {}", operation, message.getUsername(), unwrap(e).getMessage());
            }
        };
    }

    static String errorMessage(String operation, Throwable e) {
        Throwable cause = unwrap(e);
        if (cause instanceof IdentityMissingException) {
            logger.warn("{} rejected: {}", operation, cause.getMessage());
            return NO_IDENTITY;
        }
        if (cause instanceof SessionManagerNotInitializedException) {
            return NOT_INITIALIZED;
        }
        logger.error("{} failed", operation, cause);
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static Throwable unwrap(Throwable e) {
        Throwable cause = e;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
