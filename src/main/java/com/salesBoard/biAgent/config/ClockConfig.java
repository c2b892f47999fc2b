package com.salesBoard.biAgent.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Clock that decides "today" for relative time ranges and overdue checks.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${bi.clock.zone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
