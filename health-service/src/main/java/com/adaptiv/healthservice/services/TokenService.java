package com.adaptiv.healthservice.services;

import com.adaptiv.healthservice.exceptions.ErrorCode;
import com.adaptiv.healthservice.exceptions.Outcome;
import com.adaptiv.healthservice.models.Account;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Issues and validates the signed tokens used for sessions and password resets.
 * Tokens are never stored; validity is signature, expiry, issuer and type.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenService {

    public static final String CLAIM_ROLE = "role";
    public static final String CLAIM_TOKEN_TYPE = "tokenType";
    public static final String CLAIM_PASSWORD_FINGERPRINT = "pwf";

    private final JwtEncoder jwtEncoder;
    private final JwtDecoder jwtDecoder;
    private final Clock clock;

    @Value("${jwt.access-token-expiry-minutes:30}")
    private long accessTokenExpiryMinutes;

    @Value("${jwt.refresh-token-expiry-days:7}")
    private long refreshTokenExpiryDays;

    @Value("${jwt.password-reset-expiry-minutes:60}")
    private long passwordResetExpiryMinutes;

    @Value("${jwt.issuer:adaptiv-health}")
    private String issuer;

    /**
     * Access plus refresh token for a freshly authenticated account.
     */
    public IssuedTokens issueSessionTokens(Account account) {
        Duration accessLifetime = Duration.ofMinutes(accessTokenExpiryMinutes);
        String accessToken = encode(account, TokenType.ACCESS, accessLifetime, null);
        String refreshToken = encode(account, TokenType.REFRESH, Duration.ofDays(refreshTokenExpiryDays), null);

        log.debug("Issued session tokens for account: {}", account.getAccountId());
        return IssuedTokens.builder()
                .accessToken(accessToken)
                .refreshToken(refreshToken)
                .accessTokenExpiresInSeconds(accessLifetime.getSeconds())
                .build();
    }

    /**
     * One-hour reset token bound to a fingerprint of the password hash it was issued against.
     */
    public String issuePasswordResetToken(Account account, String passwordFingerprint) {
        return encode(account, TokenType.PASSWORD_RESET, Duration.ofMinutes(passwordResetExpiryMinutes), passwordFingerprint);
    }

    /**
     * Validates signature, expiry and issuer, then requires the given token type.
     */
    public Outcome<Jwt> decode(String token, TokenType expectedType) {
        if (token == null || token.isBlank()) {
            return Outcome.failure(ErrorCode.TOKEN_INVALID);
        }

        Jwt jwt;
        try {
            jwt = jwtDecoder.decode(token);
        } catch (JwtException e) {
            log.debug("Rejected token: {}", e.getMessage());
            return Outcome.failure(ErrorCode.TOKEN_INVALID);
        }

        if (!expectedType.getClaimValue().equals(jwt.getClaimAsString(CLAIM_TOKEN_TYPE))) {
            log.warn("Token of type {} presented where {} was expected", jwt.getClaimAsString(CLAIM_TOKEN_TYPE),
                    expectedType.getClaimValue());
            return Outcome.failure(ErrorCode.TOKEN_INVALID);
        }
        if (parseSubject(jwt) == null) {
            return Outcome.failure(ErrorCode.TOKEN_INVALID);
        }
        return Outcome.success(jwt);
    }

    public static UUID parseSubject(Jwt jwt) {
        try {
            return jwt.getSubject() != null ? UUID.fromString(jwt.getSubject()) : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private String encode(Account account, TokenType type, Duration lifetime, String passwordFingerprint) {
        Instant now = Instant.now(clock);

        JwtClaimsSet.Builder claims = JwtClaimsSet.builder()
                .issuer(issuer)
                .issuedAt(now)
                .expiresAt(now.plus(lifetime))
                .subject(account.getAccountId().toString())
                .id(UUID.randomUUID().toString())
                .claim(CLAIM_ROLE, account.getRole().name())
                .claim(CLAIM_TOKEN_TYPE, type.getClaimValue());
        if (passwordFingerprint != null) {
            claims.claim(CLAIM_PASSWORD_FINGERPRINT, passwordFingerprint);
        }

        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
        return jwtEncoder.encode(JwtEncoderParameters.from(header, claims.build())).getTokenValue();
    }
}
