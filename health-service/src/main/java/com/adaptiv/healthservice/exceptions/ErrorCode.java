package com.adaptiv.healthservice.exceptions;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Every policy outcome a caller can see. Each code carries the HTTP status it maps to by default.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid email or password"),
    ACCOUNT_INACTIVE(HttpStatus.UNAUTHORIZED, "Account is inactive"),
    ACCOUNT_LOCKED(HttpStatus.LOCKED, "Account temporarily locked due to too many failed attempts"),
    TOKEN_INVALID(HttpStatus.UNAUTHORIZED, "Invalid or expired token"),

    FORBIDDEN_ROLE(HttpStatus.FORBIDDEN, "Your role does not permit this operation"),
    FORBIDDEN_CONSENT(HttpStatus.FORBIDDEN, "Patient has disabled data sharing"),
    FORBIDDEN_ADMIN_EXCLUDED(HttpStatus.FORBIDDEN, "Administrators cannot access clinical data"),

    CONFLICT_ALREADY_PENDING(HttpStatus.BAD_REQUEST, "A disable request is already pending review"),
    CONFLICT_INVALID_TRANSITION(HttpStatus.BAD_REQUEST, "Consent is not in a state that allows this change"),
    CONFLICT_STALE_STATE(HttpStatus.CONFLICT, "Consent was changed by another request, please retry"),

    EMAIL_ALREADY_REGISTERED(HttpStatus.CONFLICT, "Email is already registered"),
    VALIDATION_FAILED(HttpStatus.BAD_REQUEST, "Request validation failed"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "Resource not found"),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "Too many requests. Please try again later.");

    private final HttpStatus status;
    private final String defaultMessage;
}
