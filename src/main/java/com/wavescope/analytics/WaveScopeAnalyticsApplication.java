package com.wavescope.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class WaveScopeAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(WaveScopeAnalyticsApplication.class, args);
    }
}
