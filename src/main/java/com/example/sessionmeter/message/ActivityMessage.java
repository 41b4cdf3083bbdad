package com.example.sessionmeter.message;

import com.example.sessionmeter.model.SessionIdentity;

/**
 * Fields shared by the page-load and user-input messages sent by the page script.
 * {@code username} and {@code orgCode} become the user and org ids.
 */
public interface ActivityMessage {

    String getUsername();

    String getOrgCode();

    String getChartType();

    String getChartName();

    Integer getTabId();

    default SessionIdentity toIdentity() {
        return SessionIdentity.builder()
                .userId(getUsername())
                .orgId(getOrgCode())
                .chartType(getChartType())
                .chartName(getChartName())
                .build();
    }
}
