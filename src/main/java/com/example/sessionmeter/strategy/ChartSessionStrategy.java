package com.example.sessionmeter.strategy;

import com.example.sessionmeter.model.SessionIdentity;
import com.example.sessionmeter.model.SessionType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One session per user per document being edited. Key: {@code userId@orgId-chartType-chartName}.
 */
public class ChartSessionStrategy extends AbstractSessionKeyStrategy {

    @Override
    public SessionType getSessionType() {
        return SessionType.CHART_SESSION;
    }

    @Override
    public void validate(SessionIdentity identity) {
        require("userId", identity.getUserId());
        require("orgId", identity.getOrgId());
        require("chartType", identity.getChartType());
        require("chartName", identity.getChartName());
    }

    @Override
    public SessionIdentity normalize(SessionIdentity identity) {
        return SessionIdentity.chart(identity.getUserId(), identity.getOrgId(),
                identity.getChartType(), identity.getChartName());
    }

    @Override
    public String calcSessionKey(SessionIdentity identity) {
        return SessionKeys.escape(identity.getUserId()) + "@" + SessionKeys.escape(identity.getOrgId())
                + "-" + SessionKeys.escape(identity.getChartType())
                + "-" + SessionKeys.escape(identity.getChartName());
    }

    @Override
    public Map<String, String> identifierFields(SessionIdentity identity) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("userId", identity.getUserId());
        fields.put("orgId", identity.getOrgId());
        fields.put("chartType", identity.getChartType());
        fields.put("chartName", identity.getChartName());
        return fields;
    }

    /**
     * Chart activity is always routed to the user session as well, which owns the log entries.
     */
    @Override
    public boolean reportsToSessionLog() {
        return false;
    }
}
