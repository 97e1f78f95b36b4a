package com.company.dashboards.repository;

import com.company.dashboards.MutableClock;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.time.Instant;

@TestConfiguration
class RepositoryTestConfig {

    static final Instant START = Instant.parse("2024-03-01T09:00:00Z");

    @Bean
    MutableClock clock() {
        return new MutableClock(START);
    }
}
