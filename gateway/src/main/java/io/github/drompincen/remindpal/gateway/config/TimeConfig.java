package io.github.drompincen.remindpal.gateway.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/** The reference clock. Its zone is the one all time expressions are read in. */
@Configuration
public class TimeConfig {

    @Bean
    Clock clock(@Value("${remindpal.zone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
