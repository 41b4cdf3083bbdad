package com.example.sessionmeter.service;

import com.example.sessionmeter.model.ActiveSession;
import com.example.sessionmeter.model.DailyUsage;
import com.example.sessionmeter.model.SessionIdentity;
import com.example.sessionmeter.model.SessionType;
import com.example.sessionmeter.repo.DailyUsageRepo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DailyUsageServiceTest {

    private static final Instant START = Instant.parse("2024-05-01T23:00:00Z");

    @Mock
    private DailyUsageRepo dailyUsageRepo;

    private DailyUsageService dailyUsageService;

    @BeforeEach
    void setUp() {
        dailyUsageService = new DailyUsageService(dailyUsageRepo, Runnable::run);
    }

    private void load(DailyUsage... existing) {
        when(dailyUsageRepo.findAll()).thenReturn(List.of(existing));
        dailyUsageService.initialize();
    }

    private static ActiveSession userSession(String userId, Instant start, long activeSeconds) {
        ActiveSession session = new ActiveSession(SessionType.USER_SESSION, SessionIdentity.user(userId, "org1"), start);
        session.markActivitySeen();
        session.recordActivity(start.plusSeconds(activeSeconds));
        return session;
    }

    @Test
    void testCalculateKey() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("userId", "alice");
        fields.put("orgId", "org_1");

        assertEquals("2024-05-01:alice_org\\_1", DailyUsageService.calculateKey("2024-05-01", fields));
    }

    @Test
    void testReportSession_CreatesEntryWithZeroTotal() {
        // Given
        load();
        ActiveSession session = userSession("alice", START, 30);

        // When
        DailyUsage usage = dailyUsageService.reportSession(session);

        // Then
        assertEquals("2024-05-01:alice_org1", usage.getKey());
        assertEquals("2024-05-01", usage.getDate());
        assertEquals(SessionType.USER_SESSION, usage.getType());
        assertEquals(30.0, usage.getCurrentSessionDuration());
        assertEquals(0.0, usage.getTotalDuration());
        verify(dailyUsageRepo, times(1)).save(any(DailyUsage.class));
    }

    @Test
    void testReportSession_OnlyUpdatesCurrentDuration() {
        load();
        ActiveSession session = userSession("alice", START, 10);
        dailyUsageService.reportSession(session);

        session.recordActivity(START.plusSeconds(40));
        DailyUsage usage = dailyUsageService.reportSession(session);

        assertEquals(40.0, usage.getCurrentSessionDuration());
        assertEquals(0.0, usage.getTotalDuration());
    }

    @Test
    void testCloseSession_SumOfClosedSessions() {
        // Given
        load();
        long[] durations = {12, 30, 7, 61};

        // When
        for (int i = 0; i < durations.length; i++) {
            ActiveSession session = userSession("alice", START.plusSeconds(i), durations[i]);
            dailyUsageService.reportSession(session);
            dailyUsageService.closeSession(session);
        }

        // Then
        DailyUsage usage = dailyUsageService.getDailyUsage("2024-05-01:alice_org1").orElseThrow();
        assertEquals(110.0, usage.getTotalDuration());
        assertEquals(0.0, usage.getCurrentSessionDuration());
    }

    @Test
    void testCloseSession_TwiceAddsNothing() {
        load();
        ActiveSession session = userSession("alice", START, 20);
        dailyUsageService.reportSession(session);

        dailyUsageService.closeSession(session);
        DailyUsage usage = dailyUsageService.closeSession(session).orElseThrow();

        assertEquals(20.0, usage.getTotalDuration());
        assertEquals(0.0, usage.getCurrentSessionDuration());
    }

    @Test
    void testCloseSession_UnknownKey() {
        load();

        Optional<DailyUsage> result = dailyUsageService.closeSession(userSession("bob", START, 5));

        assertTrue(result.isEmpty());
        verify(dailyUsageRepo, never()).save(any(DailyUsage.class));
    }

    @Test
    void testInitialize_ContinuesLoadedTotals() {
        load(DailyUsage.builder()
                .key("2024-05-01:alice_org1")
                .date("2024-05-01")
                .type(SessionType.USER_SESSION)
                .fields(Map.of("userId", "alice", "orgId", "org1"))
                .currentSessionDuration(0)
                .totalDuration(100)
                .build());
        ActiveSession session = userSession("alice", START, 25);

        dailyUsageService.reportSession(session);
        DailyUsage usage = dailyUsageService.closeSession(session).orElseThrow();

        assertEquals(125.0, usage.getTotalDuration());
    }

    @Test
    void testDateFromSessionStart() {
        load();
        ActiveSession session = userSession("alice", START, 7200);

        DailyUsage usage = dailyUsageService.reportSession(session);

        assertEquals("2024-05-01", usage.getDate());
    }

    @Test
    void testGetDailyUsages_FilterByType() {
        load();
        dailyUsageService.reportSession(userSession("alice", START, 5));
        ActiveSession chart = new ActiveSession(SessionType.CHART_SESSION,
                SessionIdentity.chart("alice", "org1", "progress", "visit"), START);
        dailyUsageService.reportSession(chart);

        List<DailyUsage> charts = dailyUsageService.getDailyUsages(SessionType.CHART_SESSION);

        assertEquals(1, charts.size());
        assertEquals("2024-05-01:alice_org1_progress_visit", charts.get(0).getKey());
        assertEquals(2, dailyUsageService.getAllDailyUsages().size());
    }

    @Test
    void testReportSession_BeforeInitialize() {
        assertThrows(IllegalStateException.class,
                () -> dailyUsageService.reportSession(userSession("alice", START, 5)));
    }

    @Test
    void testPersistFailure_KeepsInMemoryTotals() {
        load();
        when(dailyUsageRepo.save(any(DailyUsage.class))).thenThrow(new RuntimeException("mongo down"));
        ActiveSession session = userSession("alice", START, 9);

        dailyUsageService.reportSession(session);
        dailyUsageService.closeSession(session);

        assertEquals(9.0, dailyUsageService.getDailyUsage("2024-05-01:alice_org1").orElseThrow().getTotalDuration());
    }
}
