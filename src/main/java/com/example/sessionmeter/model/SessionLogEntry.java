package com.example.sessionmeter.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("session_logs")
public class SessionLogEntry {
    @Id
    private String id;
    private String event; // session_started | session_ended
    private Instant eventTime;
    private Instant logTime;
    private String username;
    private long duration; // ms

    private SessionType sessionType;
    private String sessionKey;
}
