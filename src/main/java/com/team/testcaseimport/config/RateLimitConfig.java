package com.team.testcaseimport.config;

import io.github.bucket4j.Bucket;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class RateLimitConfig {

    @Value("${rate-limit.bulk-import.requests-per-minute:20}")
    private int requestsPerMinute;

    @Value("${rate-limit.bulk-import.requests-per-hour:200}")
    private int requestsPerHour;

    @Bean(name = "bulkImportRateLimiter")
    public Bucket bulkImportRateLimiter() {
        return Bucket.builder()
                .addLimit(limit -> limit.capacity(requestsPerMinute).refillGreedy(requestsPerMinute, Duration.ofMinutes(1)))
                .addLimit(limit -> limit.capacity(requestsPerHour).refillGreedy(requestsPerHour, Duration.ofHours(1)))
                .build();
    }
}
