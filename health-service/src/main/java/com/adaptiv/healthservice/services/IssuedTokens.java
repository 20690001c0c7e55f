package com.adaptiv.healthservice.services;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class IssuedTokens {
    String accessToken;
    String refreshToken;
    long accessTokenExpiresInSeconds;
}
