package com.portfolio.analytics.pulse.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Supplies the clock used to resolve "today" at the service boundary.
 * Detectors and the simulator only ever see an explicit reference date.
 */
@Configuration
@Slf4j
public class ClockConfig {

    @Value("${portfolio.clock.zone:UTC}")
    private String zone;

    @Bean
    public Clock portfolioClock() {
        log.info("[Clock Config] Resolving reference dates in zone: {}", zone);
        return Clock.system(ZoneId.of(zone));
    }
}
