package com.adaptiv.healthservice.services.authorization;

import com.adaptiv.healthservice.exceptions.ErrorCode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccessDecision {

    private static final AccessDecision PERMIT = new AccessDecision(true, null, null);

    boolean permitted;
    ErrorCode reason;
    String message;

    public static AccessDecision permit() {
        return PERMIT;
    }

    public static AccessDecision deny(ErrorCode reason) {
        return new AccessDecision(false, reason, reason.getDefaultMessage());
    }

    public static AccessDecision deny(ErrorCode reason, String message) {
        return new AccessDecision(false, reason, message);
    }
}
