package com.example.sessionmeter.message;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PageLoadMessage implements ActivityMessage {
    private String username;
    private String orgCode;
    private String chartType;
    private String chartName;
    private Instant pageStartTime;
    private Integer tabId;
}
