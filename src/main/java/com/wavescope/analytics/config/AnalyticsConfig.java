package com.wavescope.analytics.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AnalyticsConfig {

    /**
     * Source of "now" for every analytics operation. All timestamps are UTC.
     */
    @Bean
    public Clock analyticsClock() {
        return Clock.systemUTC();
    }
}
