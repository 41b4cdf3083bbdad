package com.example.sessionmeter.mcp;

import com.example.sessionmeter.message.SessionTimeoutResponse;
import com.example.sessionmeter.message.SessionTimeoutSetMessage;
import com.example.sessionmeter.message.SessionsResponse;
import com.example.sessionmeter.model.SessionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import com.example.sessionmeter.service.SessionMeterService;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionToolsTest {

    @Mock
    private SessionMeterService sessionMeterService;

    private SessionTools sessionTools;

    @BeforeEach
    void setUp() {
        sessionTools = new SessionTools(sessionMeterService);
    }

    @Test
    void testSessionsGet() {
        when(sessionMeterService.getSessions(SessionType.USER_SESSION))
                .thenReturn(CompletableFuture.completedFuture(SessionsResponse.success(List.of())));

        Map<String, Object> result = sessionTools.sessions_get("user");

        assertEquals(true, result.get("success"));
        assertEquals(List.of(), result.get("sessions"));
    }

    @Test
    void testSessionsGet_NotInitialized() {
        when(sessionMeterService.getSessions(SessionType.CHART_SESSION))
                .thenReturn(CompletableFuture.completedFuture(
                        SessionsResponse.failure("Session manager is not initialized")));

        Map<String, Object> result = sessionTools.sessions_get("chart");

        assertEquals(false, result.get("success"));
        assertEquals("Session manager is not initialized", result.get("error"));
    }

    @Test
    void testSessionTimeoutSet() {
        when(sessionMeterService.setSessionTimeout(eq(SessionType.CHART_SESSION), any(SessionTimeoutSetMessage.class)))
                .thenReturn(CompletableFuture.completedFuture(SessionTimeoutResponse.success(90)));

        Map<String, Object> result = sessionTools.session_timeout_set("chart", 90L);

        assertEquals(true, result.get("success"));
        assertEquals(90L, result.get("timeout"));
    }

    @Test
    void testDailyUsageGet_BlankTypeMeansAll() {
        when(sessionMeterService.getDailyUsages(null)).thenReturn(List.of());

        assertTrue(sessionTools.daily_usage_get(" ").isEmpty());
    }

    @Test
    void testSessionLogsClear() {
        Map<String, Object> result = sessionTools.session_logs_clear();

        assertEquals(true, result.get("ok"));
        verify(sessionMeterService).clearSessionLogs();
    }
}
