package com.example.sessionmeter.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionIdentity {
    private String userId;
    private String orgId;
    // chart sessions only
    private String chartType;
    private String chartName;

    public static SessionIdentity user(String userId, String orgId) {
        return new SessionIdentity(userId, orgId, null, null);
    }

    public static SessionIdentity chart(String userId, String orgId, String chartType, String chartName) {
        return new SessionIdentity(userId, orgId, chartType, chartName);
    }

    public boolean hasChart() {
        return chartType != null && !chartType.isBlank()
                && chartName != null && !chartName.isBlank();
    }

    /**
     * The audit-log username, {@code userId@orgId}.
     */
    public String username() {
        return userId + "@" + orgId;
    }
}
