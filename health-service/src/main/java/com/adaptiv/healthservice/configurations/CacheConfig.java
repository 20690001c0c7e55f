package com.adaptiv.healthservice.configurations;

import com.adaptiv.healthservice.aspects.RateLimitAspect;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
public class CacheConfig {

    /**
     * Rate limit buckets keyed by client IP and endpoint.
     * Entries outlive the longest window in use (login, 5 minutes).
     */
    @Bean
    public Cache<String, RateLimitAspect.RateLimitBucket> rateLimitCache() {
        return Caffeine.newBuilder()
                .expireAfterAccess(10, TimeUnit.MINUTES)
                .maximumSize(50000)
                .recordStats()
                .build();
    }
}
