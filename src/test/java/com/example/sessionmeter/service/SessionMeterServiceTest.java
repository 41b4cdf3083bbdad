package com.example.sessionmeter.service;

import com.example.sessionmeter.message.PageLoadMessage;
import com.example.sessionmeter.message.PageLoadResponse;
import com.example.sessionmeter.message.SessionTimeoutResponse;
import com.example.sessionmeter.message.SessionTimeoutSetMessage;
import com.example.sessionmeter.message.SessionsResponse;
import com.example.sessionmeter.message.UserInputMessage;
import com.example.sessionmeter.message.UserInputResponse;
import com.example.sessionmeter.model.SessionDTO;
import com.example.sessionmeter.model.SessionIdentity;
import com.example.sessionmeter.model.SessionType;
import com.example.sessionmeter.session.IdentityMissingException;
import com.example.sessionmeter.session.SessionManager;
import com.example.sessionmeter.session.SessionManagerNotInitializedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionMeterServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private SessionManager userSessionManager;

    @Mock
    private SessionManager chartSessionManager;

    @Mock
    private SessionLogService sessionLogService;

    @Mock
    private DailyUsageService dailyUsageService;

    private SessionMeterService sessionMeterService;

    @BeforeEach
    void setUp() {
        sessionMeterService = new SessionMeterService(userSessionManager, chartSessionManager,
                sessionLogService, dailyUsageService);
    }

    private static PageLoadMessage pageLoad(String chartType, String chartName, Integer tabId) {
        return PageLoadMessage.builder()
                .username("alice")
                .orgCode("org1")
                .chartType(chartType)
                .chartName(chartName)
                .pageStartTime(NOW)
                .tabId(tabId)
                .build();
    }

    @Test
    void testHandlePageLoad_UserOnly() {
        // Given
        when(userSessionManager.handlePageLoad(any(SessionIdentity.class), eq(NOW), eq(5)))
                .thenReturn(CompletableFuture.completedFuture("alice@org1"));

        // When
        PageLoadResponse response = sessionMeterService.handlePageLoad(pageLoad(null, null, 5)).join();

        // Then
        assertTrue(response.isSuccess());
        assertNull(response.getError());
        assertEquals("alice@org1", response.getSessionKey());
        verify(chartSessionManager, never()).handlePageLoad(any(), any(), any());
    }

    @Test
    void testHandlePageLoad_ChartFieldsAlsoRouteToChartManager() {
        when(userSessionManager.handlePageLoad(any(SessionIdentity.class), eq(NOW), eq(5)))
                .thenReturn(CompletableFuture.completedFuture("alice@org1"));
        when(chartSessionManager.handlePageLoad(any(SessionIdentity.class), eq(NOW), eq(5)))
                .thenReturn(CompletableFuture.completedFuture("alice@org1-progress-visit"));

        PageLoadResponse response = sessionMeterService.handlePageLoad(pageLoad("progress", "visit", 5)).join();

        assertTrue(response.isSuccess());
        assertEquals("alice@org1", response.getSessionKey());
        verify(chartSessionManager).handlePageLoad(
                eq(SessionIdentity.chart("alice", "org1", "progress", "visit")), eq(NOW), eq(5));
    }

    @Test
    void testHandlePageLoad_ChartFailureDoesNotFailResponse() {
        when(userSessionManager.handlePageLoad(any(SessionIdentity.class), eq(NOW), eq(5)))
                .thenReturn(CompletableFuture.completedFuture("alice@org1"));
        when(chartSessionManager.handlePageLoad(any(SessionIdentity.class), eq(NOW), eq(5)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));

        PageLoadResponse response = sessionMeterService.handlePageLoad(pageLoad("progress", "visit", 5)).join();

        assertTrue(response.isSuccess());
    }

    @Test
    void testHandlePageLoad_MissingTabId() {
        PageLoadResponse response = sessionMeterService.handlePageLoad(pageLoad(null, null, null)).join();

        assertFalse(response.isSuccess());
        assertEquals("tabId is undefined", response.getError());
        verifyNoInteractions(userSessionManager, chartSessionManager);
    }

    @Test
    void testHandleUserInput_MissingIdentity() {
        // Given
        UserInputMessage message = UserInputMessage.builder()
                .orgCode("org1")
                .input("a")
                .inputType("keydown")
                .timestamp(NOW)
                .tabId(5)
                .build();
        when(userSessionManager.handleUserInput(any(SessionIdentity.class), eq(NOW), eq(5)))
                .thenReturn(CompletableFuture.failedFuture(new IdentityMissingException("userId")));

        // When
        UserInputResponse response = sessionMeterService.handleUserInput(message).join();

        // Then
        assertFalse(response.isSuccess());
        assertEquals("No userId or orgCode provided", response.getError());
    }

    @Test
    void testHandleUserInput_NotInitialized() {
        UserInputMessage message = UserInputMessage.builder()
                .username("alice")
                .orgCode("org1")
                .timestamp(NOW)
                .tabId(5)
                .build();
        when(userSessionManager.handleUserInput(any(SessionIdentity.class), eq(NOW), eq(5)))
                .thenReturn(CompletableFuture.failedFuture(new SessionManagerNotInitializedException("user_sessions")));

        UserInputResponse response = sessionMeterService.handleUserInput(message).join();

        assertFalse(response.isSuccess());
        assertEquals("Session manager is not initialized", response.getError());
    }

    @Test
    void testOnTabRemove_NotifiesBothManagers() {
        when(userSessionManager.onTabRemove(9)).thenReturn(CompletableFuture.completedFuture(null));
        when(chartSessionManager.onTabRemove(9)).thenReturn(CompletableFuture.completedFuture(null));

        sessionMeterService.onTabRemove(9).join();

        verify(userSessionManager).onTabRemove(9);
        verify(chartSessionManager).onTabRemove(9);
    }

    @Test
    void testGetSessions_ChartType() {
        SessionDTO dto = SessionDTO.builder().userId("alice").orgId("org1").startTime(NOW.toString()).build();
        when(chartSessionManager.getSessions()).thenReturn(CompletableFuture.completedFuture(List.of(dto)));

        SessionsResponse response = sessionMeterService.getSessions(SessionType.CHART_SESSION).join();

        assertTrue(response.isSuccess());
        assertEquals(List.of(dto), response.getSessions());
        verify(userSessionManager, never()).getSessions();
    }

    @Test
    void testSetSessionTimeout() {
        when(userSessionManager.setSessionTimeout(120)).thenReturn(CompletableFuture.completedFuture(null));
        when(userSessionManager.getSessionTimeout()).thenReturn(120L);

        SessionTimeoutResponse response = sessionMeterService
                .setSessionTimeout(SessionType.USER_SESSION, new SessionTimeoutSetMessage(120L)).join();

        assertTrue(response.isSuccess());
        assertEquals(120L, response.getTimeout());
    }

    @Test
    void testSetSessionTimeout_Invalid() {
        when(userSessionManager.setSessionTimeout(-5))
                .thenReturn(CompletableFuture.failedFuture(new IllegalArgumentException("Session timeout must be positive: -5")));

        SessionTimeoutResponse response = sessionMeterService
                .setSessionTimeout(SessionType.USER_SESSION, new SessionTimeoutSetMessage(-5L)).join();

        assertFalse(response.isSuccess());
        assertEquals("Session timeout must be positive: -5", response.getError());
    }

    @Test
    void testGetDailyUsages_AllTypes() {
        when(dailyUsageService.getAllDailyUsages()).thenReturn(List.of());

        assertTrue(sessionMeterService.getDailyUsages(null).isEmpty());
        verify(dailyUsageService, never()).getDailyUsages(any());
    }
}
