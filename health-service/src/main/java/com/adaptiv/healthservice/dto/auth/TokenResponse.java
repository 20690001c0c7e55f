package com.adaptiv.healthservice.dto.auth;

import com.adaptiv.healthservice.services.IssuedTokens;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenResponse {
    private String accessToken;
    private String refreshToken;
    private String tokenType;
    private long expiresIn;

    public static TokenResponse from(IssuedTokens tokens) {
        return TokenResponse.builder()
                .accessToken(tokens.getAccessToken())
                .refreshToken(tokens.getRefreshToken())
                .tokenType("bearer")
                .expiresIn(tokens.getAccessTokenExpiresInSeconds())
                .build();
    }
}
