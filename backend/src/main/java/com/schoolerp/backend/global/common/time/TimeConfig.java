package com.schoolerp.backend.global.common.time;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;

/**
 * Single UTC time source for services and for entity audit timestamps.
 */
@Configuration
public class TimeConfig {

    public static final String AUDITING_DATE_TIME_PROVIDER = "auditingDateTimeProvider";

    @Bean
    public Clock clock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean(AUDITING_DATE_TIME_PROVIDER)
    public DateTimeProvider auditingDateTimeProvider(Clock clock) {
        return () -> Optional.of(OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC));
    }
}
