package com.contactcare.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneId;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single clock for the whole application. Contact dates, review due dates and
 * audit timestamps all read "now" from here, so tests can pin it with {@code Clock.fixed}.
 */
@Configuration
public class TimeConfig {

    private static final Logger log = LoggerFactory.getLogger(TimeConfig.class);

    @Bean
    public Clock contactCareClock(@Value("${contactcare.clock.zone:UTC}") String zone) {
        ZoneId zoneId = ZoneId.of(zone);
        log.info("Contact care clock running in zone {}", zoneId);
        return Clock.system(zoneId);
    }
}
