package com.adaptiv.healthservice.aspects;

import com.adaptiv.healthservice.annotations.RateLimited;
import com.adaptiv.healthservice.exceptions.ApiResponses;
import com.adaptiv.healthservice.exceptions.ErrorCode;
import com.adaptiv.healthservice.exceptions.ErrorResponse;
import com.adaptiv.healthservice.services.SecurityAuditService;
import com.github.benmanes.caffeine.cache.Cache;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Enforces {@link RateLimited} with a fixed window per client IP and endpoint.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "security.rate-limit.enabled", havingValue = "true", matchIfMissing = true)
public class RateLimitAspect {

    private final Cache<String, RateLimitBucket> rateLimitCache;
    private final Clock clock;

    // Forwarding headers are client-controlled unless a trusted proxy rewrites them.
    @Value("${security.rate-limit.trust-forwarded-for:false}")
    private boolean trustForwardedFor;

    @Around("@annotation(rateLimited)")
    public Object rateLimit(ProceedingJoinPoint joinPoint, RateLimited rateLimited) throws Throwable {
        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();

        if (attributes == null) {
            log.warn("No request attributes found for rate limiting");
            return joinPoint.proceed();
        }

        HttpServletRequest request = attributes.getRequest();
        String clientIp = clientKey(request);
        String endpoint = request.getRequestURI();
        String rateLimitKey = String.format("rate_limit:%s:%s", clientIp, endpoint);

        RateLimitBucket bucket = rateLimitCache.get(rateLimitKey,
                k -> new RateLimitBucket(rateLimited.maxRequests(), rateLimited.windowSeconds(), clock));

        if (!bucket.tryConsume()) {
            log.warn("Rate limit exceeded for IP: {} on endpoint: {} ({} requests/{} sec)",
                    clientIp, endpoint, rateLimited.maxRequests(), rateLimited.windowSeconds());

            Duration retryAfter = bucket.getRetryAfter();
            ErrorResponse body = ApiResponses.errorBody(ErrorCode.RATE_LIMITED, rateLimited.message(), retryAfter);
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .header(HttpHeaders.RETRY_AFTER, String.valueOf(body.getRetryAfterSeconds()))
                    .body(body);
        }

        return joinPoint.proceed();
    }

    private String clientKey(HttpServletRequest request) {
        if (trustForwardedFor) {
            return SecurityAuditService.getIpAddress(request);
        }
        String remoteAddr = request.getRemoteAddr();
        return remoteAddr != null ? remoteAddr : "UNKNOWN";
    }

    /**
     * Fixed window counter. The window restarts with the first request after it expires.
     */
    public static class RateLimitBucket {
        private final int maxRequests;
        private final Duration window;
        private final Clock clock;
        private int requestCount;
        private Instant windowStart;

        public RateLimitBucket(int maxRequests, int windowSeconds, Clock clock) {
            this.maxRequests = maxRequests;
            this.window = Duration.ofSeconds(windowSeconds);
            this.clock = clock;
            this.windowStart = Instant.now(clock);
        }

        public synchronized boolean tryConsume() {
            Instant now = Instant.now(clock);

            if (!now.isBefore(windowStart.plus(window))) {
                windowStart = now;
                requestCount = 0;
            }

            requestCount++;
            return requestCount <= maxRequests;
        }

        public synchronized Duration getRetryAfter() {
            Duration remaining = Duration.between(Instant.now(clock), windowStart.plus(window));
            return remaining.isNegative() ? Duration.ZERO : remaining;
        }
    }
}
