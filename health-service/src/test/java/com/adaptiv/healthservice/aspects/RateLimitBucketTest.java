package com.adaptiv.healthservice.aspects;

import com.adaptiv.healthservice.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RateLimitBucketTest {

    @Test
    void allowsUpToLimitWithinWindow() {
        MutableClock clock = new MutableClock();
        RateLimitAspect.RateLimitBucket bucket = new RateLimitAspect.RateLimitBucket(3, 60, clock);

        assertTrue(bucket.tryConsume());
        assertTrue(bucket.tryConsume());
        assertTrue(bucket.tryConsume());
        assertFalse(bucket.tryConsume());

        clock.advance(Duration.ofSeconds(20));
        assertEquals(Duration.ofSeconds(40), bucket.getRetryAfter());
    }

    @Test
    void windowResetsAfterExpiry() {
        MutableClock clock = new MutableClock();
        RateLimitAspect.RateLimitBucket bucket = new RateLimitAspect.RateLimitBucket(1, 60, clock);

        assertTrue(bucket.tryConsume());
        assertFalse(bucket.tryConsume());

        clock.advance(Duration.ofSeconds(60));
        assertTrue(bucket.tryConsume());
    }
}
