package com.example.sessionmeter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SessionMeterApplication {

    public static void main(String[] args) {
        SpringApplication.run(SessionMeterApplication.class, args);
    }
}
