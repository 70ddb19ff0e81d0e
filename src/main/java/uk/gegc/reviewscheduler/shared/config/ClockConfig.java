package uk.gegc.reviewscheduler.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Single time source for the application. Tests replace it with a fixed clock.
 * Review-day boundaries use the zone from {@code app.review.calendar}, never the clock's zone.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
