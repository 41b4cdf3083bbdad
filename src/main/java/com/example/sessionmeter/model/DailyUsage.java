package com.example.sessionmeter.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Map;

/**
 * Usage of one identity on one calendar day (UTC). Durations are in seconds.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Document("daily_usage")
public class DailyUsage {
    @Id
    private String key;
    private String date; // yyyy-MM-dd
    private SessionType type;
    private Map<String, String> fields;
    private double currentSessionDuration;
    private double totalDuration;
}
