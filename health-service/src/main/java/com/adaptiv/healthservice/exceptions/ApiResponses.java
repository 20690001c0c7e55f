package com.adaptiv.healthservice.exceptions;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Turns {@link Outcome} values into HTTP responses.
 */
public final class ApiResponses {

    private ApiResponses() {
    }

    public static ResponseEntity<Object> from(Outcome<?> outcome) {
        return from(outcome, HttpStatus.OK);
    }

    public static ResponseEntity<Object> from(Outcome<?> outcome, HttpStatus successStatus) {
        if (outcome.isSuccess()) {
            return ResponseEntity.status(successStatus).body(outcome.getValue());
        }
        return failure(outcome, outcome.getError().getStatus());
    }

    public static ResponseEntity<Object> failure(Outcome<?> outcome, HttpStatus status) {
        ErrorResponse body = errorBody(outcome.getError(), outcome.getMessage(), outcome.getRetryAfter());
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
        if (body.getRetryAfterSeconds() != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(body.getRetryAfterSeconds()));
        }
        return builder.body(body);
    }

    public static ErrorResponse errorBody(ErrorCode code, String message, Duration retryAfter) {
        return ErrorResponse.builder()
                .success(false)
                .code(code.name())
                .message(message != null ? message : code.getDefaultMessage())
                .retryAfterSeconds(retryAfter != null ? Math.max(1, ceilSeconds(retryAfter)) : null)
                .timestamp(LocalDateTime.now())
                .build();
    }

    private static long ceilSeconds(Duration duration) {
        long seconds = duration.getSeconds();
        return duration.getNano() > 0 ? seconds + 1 : seconds;
    }
}
