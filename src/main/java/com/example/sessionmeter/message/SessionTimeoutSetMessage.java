package com.example.sessionmeter.message;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionTimeoutSetMessage {
    private Long timeout;
}
