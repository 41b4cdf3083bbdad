package com.example.sessionmeter.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

/**
 * Persisted form of a session. Timestamps are ISO-8601 strings.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionDTO {
    private String userId;
    private String orgId;
    private String chartType;
    private String chartName;
    private String startTime;
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String lastActivityTime;
    private boolean activitySeen;
}
