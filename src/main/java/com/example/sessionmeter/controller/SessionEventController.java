package com.example.sessionmeter.controller;

import com.example.sessionmeter.message.BasicResponse;
import com.example.sessionmeter.message.PageLoadMessage;
import com.example.sessionmeter.message.PageLoadResponse;
import com.example.sessionmeter.message.SessionTimeoutResponse;
import com.example.sessionmeter.message.SessionTimeoutSetMessage;
import com.example.sessionmeter.message.SessionsResponse;
import com.example.sessionmeter.message.UserInputMessage;
import com.example.sessionmeter.message.UserInputResponse;
import com.example.sessionmeter.model.DailyUsage;
import com.example.sessionmeter.model.SessionLogEntry;
import com.example.sessionmeter.model.SessionType;
import com.example.sessionmeter.service.SessionMeterService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@RestController
@RequestMapping("/api")
public class SessionEventController {

    private final SessionMeterService sessionMeterService;

    public SessionEventController(SessionMeterService sessionMeterService) {
        this.sessionMeterService = sessionMeterService;
    }

    @PostMapping("/events/page-load")
    public Mono<PageLoadResponse> pageLoad(@RequestBody PageLoadMessage message) {
        return Mono.fromFuture(() -> sessionMeterService.handlePageLoad(message));
    }

    @PostMapping("/events/user-input")
    public Mono<UserInputResponse> userInput(@RequestBody UserInputMessage message) {
        return Mono.fromFuture(() -> sessionMeterService.handleUserInput(message));
    }

    @DeleteMapping("/tabs/{tabId}")
    public Mono<ResponseEntity<Void>> tabRemoved(@PathVariable int tabId) {
        return Mono.fromFuture(() -> sessionMeterService.onTabRemove(tabId))
                .then(Mono.just(ResponseEntity.accepted().<Void>build()));
    }

    @GetMapping("/sessions/{type}")
    public Mono<SessionsResponse> sessions(@PathVariable String type) {
        SessionType sessionType = SessionType.fromValue(type);
        return Mono.fromFuture(() -> sessionMeterService.getSessions(sessionType));
    }

    @GetMapping("/sessions/{type}/timeout")
    public SessionTimeoutResponse sessionTimeout(@PathVariable String type) {
        return sessionMeterService.getSessionTimeout(SessionType.fromValue(type));
    }

    @PutMapping("/sessions/{type}/timeout")
    public Mono<SessionTimeoutResponse> setSessionTimeout(@PathVariable String type,
                                                          @RequestBody SessionTimeoutSetMessage message) {
        SessionType sessionType = SessionType.fromValue(type);
        return Mono.fromFuture(() -> sessionMeterService.setSessionTimeout(sessionType, message));
    }

    // Mongo repositories block, keep them off the event loop
    @GetMapping("/session-logs")
    public Mono<List<SessionLogEntry>> sessionLogs() {
        return Mono.fromCallable(sessionMeterService::getSessionLogs)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/session-logs")
    public Mono<BasicResponse> clearSessionLogs() {
        return Mono.fromCallable(sessionMeterService::clearSessionLogs)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/daily-usage")
    public List<DailyUsage> dailyUsage(@RequestParam(required = false) String type) {
        return sessionMeterService.getDailyUsages(type == null ? null : SessionType.fromValue(type));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<BasicResponse> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(BasicResponse.failure(e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<BasicResponse> unavailable(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(BasicResponse.failure(e.getMessage()));
    }
}
