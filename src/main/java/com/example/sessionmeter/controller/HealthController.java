package com.example.sessionmeter.controller;

import com.example.sessionmeter.kv.KvClient;
import com.example.sessionmeter.repo.SessionLogRepo;
import com.example.sessionmeter.session.SessionManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
public class HealthController {

    private final KvClient kvClient;
    private final SessionLogRepo sessionLogRepo;
    private final List<SessionManager> sessionManagers;

    public HealthController(KvClient kvClient, SessionLogRepo sessionLogRepo, List<SessionManager> sessionManagers) {
        this.kvClient = kvClient;
        this.sessionLogRepo = sessionLogRepo;
        this.sessionManagers = sessionManagers;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "session-meter");
        health.put("version", "0.1.0");

        try {
            kvClient.get("health-check");
            health.put("redis", "UP");
        } catch (Exception e) {
            health.put("redis", "DOWN");
            health.put("redisError", e.getMessage());
        }

        try {
            sessionLogRepo.count();
            health.put("mongodb", "UP");
        } catch (Exception e) {
            health.put("mongodb", "DOWN");
            health.put("mongodbError", e.getMessage());
        }

        Map<String, Object> managers = new HashMap<>();
        for (SessionManager manager : sessionManagers) {
            managers.put(manager.getManagerName(), Map.of(
                    "initialized", manager.isInitialized(),
                    "timeoutSeconds", manager.getSessionTimeout()));
        }
        health.put("sessionManagers", managers);

        return ResponseEntity.ok(health);
    }
}
