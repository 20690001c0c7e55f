package com.adaptiv.healthservice.services;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Value of the {@code tokenType} claim. A token is only accepted where its type is expected.
 */
@Getter
@RequiredArgsConstructor
public enum TokenType {
    ACCESS("access"),
    REFRESH("refresh"),
    PASSWORD_RESET("password_reset");

    private final String claimValue;
}
