package com.example.sessionmeter.mcp;

import com.example.sessionmeter.message.SessionTimeoutSetMessage;
import com.example.sessionmeter.model.DailyUsage;
import com.example.sessionmeter.model.SessionLogEntry;
import com.example.sessionmeter.model.SessionType;
import com.example.sessionmeter.service.SessionMeterService;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class SessionTools {

    private final SessionMeterService sessionMeterService;

    public SessionTools(SessionMeterService sessionMeterService) {
        this.sessionMeterService = sessionMeterService;
    }

    @Tool(description = "List active sessions of a type (user or chart)")
    public Map<String, Object> sessions_get(String type) {
        var response = sessionMeterService.getSessions(SessionType.fromValue(type)).join();
        Map<String, Object> result = new HashMap<>();
        result.put("success", response.isSuccess());
        if (response.isSuccess()) {
            result.put("sessions", response.getSessions());
        } else {
            result.put("error", response.getError());
        }
        return result;
    }

    @Tool(description = "Get the session expiration timeout in seconds for a session type (user or chart)")
    public Map<String, Object> session_timeout_get(String type) {
        var response = sessionMeterService.getSessionTimeout(SessionType.fromValue(type));
        return Map.of("success", true, "timeout", response.getTimeout());
    }

    @Tool(description = "Set the session expiration timeout in seconds for a session type (user or chart)")
    public Map<String, Object> session_timeout_set(String type, Long timeout) {
        var response = sessionMeterService
                .setSessionTimeout(SessionType.fromValue(type), new SessionTimeoutSetMessage(timeout))
                .join();
        Map<String, Object> result = new HashMap<>();
        result.put("success", response.isSuccess());
        if (response.isSuccess()) {
            result.put("timeout", response.getTimeout());
        } else {
            result.put("error", response.getError());
        }
        return result;
    }

    @Tool(description = "Get all session start/end log entries ordered by log time")
    public List<SessionLogEntry> session_logs_get() {
        return sessionMeterService.getSessionLogs();
    }

    @Tool(description = "Delete all session log entries")
    public Map<String, Object> session_logs_clear() {
        sessionMeterService.clearSessionLogs();
        return Map.of("ok", true);
    }

    @Tool(description = "Get daily usage totals, optionally filtered by session type (user or chart)")
    public List<DailyUsage> daily_usage_get(String type) {
        SessionType sessionType = (type == null || type.isBlank()) ? null : SessionType.fromValue(type);
        return sessionMeterService.getDailyUsages(sessionType);
    }
}
