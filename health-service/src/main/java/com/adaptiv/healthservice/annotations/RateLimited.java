package com.adaptiv.healthservice.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * IP-based request limit for an endpoint.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RateLimited {

    /**
     * Maximum number of requests allowed within the time window
     */
    int maxRequests() default 5;

    /**
     * Time window in seconds
     */
    int windowSeconds() default 60;

    String message() default "Too many requests. Please try again later.";
}
