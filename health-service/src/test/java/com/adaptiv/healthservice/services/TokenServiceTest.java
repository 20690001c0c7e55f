package com.adaptiv.healthservice.services;

import com.adaptiv.healthservice.configurations.JwtConfig;
import com.adaptiv.healthservice.exceptions.ErrorCode;
import com.adaptiv.healthservice.exceptions.Outcome;
import com.adaptiv.healthservice.models.Account;
import com.adaptiv.healthservice.models.Role;
import com.adaptiv.healthservice.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.test.util.ReflectionTestUtils;

import javax.crypto.SecretKey;
import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenServiceTest {

    private static final String SECRET = "unit-test-secret-key-with-enough-bytes-for-hs256";

    private MutableClock clock;
    private TokenService tokenService;
    private Account account;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        JwtConfig config = jwtConfig(SECRET);
        SecretKey key = config.jwtSigningKey();

        tokenService = new TokenService(config.jwtEncoder(key), config.jwtDecoder(key, clock), clock);
        ReflectionTestUtils.setField(tokenService, "accessTokenExpiryMinutes", 30L);
        ReflectionTestUtils.setField(tokenService, "refreshTokenExpiryDays", 7L);
        ReflectionTestUtils.setField(tokenService, "passwordResetExpiryMinutes", 60L);
        ReflectionTestUtils.setField(tokenService, "issuer", "adaptiv-health");

        account = Account.builder().accountId(UUID.randomUUID()).email("pat@example.com").role(Role.PATIENT).build();
    }

    @Test
    void accessTokenCarriesSubjectRoleAndType() {
        IssuedTokens tokens = tokenService.issueSessionTokens(account);

        Outcome<Jwt> decoded = tokenService.decode(tokens.getAccessToken(), TokenType.ACCESS);

        assertTrue(decoded.isSuccess());
        assertEquals(account.getAccountId().toString(), decoded.getValue().getSubject());
        assertEquals("PATIENT", decoded.getValue().getClaimAsString(TokenService.CLAIM_ROLE));
        assertEquals("access", decoded.getValue().getClaimAsString(TokenService.CLAIM_TOKEN_TYPE));
        assertEquals(1800, tokens.getAccessTokenExpiresInSeconds());
    }

    @Test
    void tokenIsOnlyAcceptedForItsOwnType() {
        IssuedTokens tokens = tokenService.issueSessionTokens(account);

        assertEquals(ErrorCode.TOKEN_INVALID, tokenService.decode(tokens.getRefreshToken(), TokenType.ACCESS).getError());
        assertEquals(ErrorCode.TOKEN_INVALID, tokenService.decode(tokens.getAccessToken(), TokenType.REFRESH).getError());
        assertEquals(ErrorCode.TOKEN_INVALID,
                tokenService.decode(tokens.getAccessToken(), TokenType.PASSWORD_RESET).getError());
        assertTrue(tokenService.decode(tokens.getRefreshToken(), TokenType.REFRESH).isSuccess());
    }

    @Test
    void accessTokenExpiresAfterThirtyMinutes() {
        String token = tokenService.issueSessionTokens(account).getAccessToken();

        clock.advance(Duration.ofMinutes(29));
        assertTrue(tokenService.decode(token, TokenType.ACCESS).isSuccess());

        clock.advance(Duration.ofMinutes(2));
        assertEquals(ErrorCode.TOKEN_INVALID, tokenService.decode(token, TokenType.ACCESS).getError());
    }

    @Test
    void refreshTokenOutlivesAccessTokenButNotSevenDays() {
        String token = tokenService.issueSessionTokens(account).getRefreshToken();

        clock.advance(Duration.ofDays(6));
        assertTrue(tokenService.decode(token, TokenType.REFRESH).isSuccess());

        clock.advance(Duration.ofDays(1).plusMinutes(1));
        assertTrue(tokenService.decode(token, TokenType.REFRESH).isFailure());
    }

    @Test
    void resetTokenCarriesPasswordFingerprint() {
        String token = tokenService.issuePasswordResetToken(account, "abc123");

        Outcome<Jwt> decoded = tokenService.decode(token, TokenType.PASSWORD_RESET);

        assertTrue(decoded.isSuccess());
        assertEquals("abc123", decoded.getValue().getClaimAsString(TokenService.CLAIM_PASSWORD_FINGERPRINT));
    }

    @Test
    void rejectsTamperedAndForeignTokens() {
        String token = tokenService.issueSessionTokens(account).getAccessToken();
        String tampered = token.substring(0, token.length() - 4) + (token.endsWith("AAAA") ? "BBBB" : "AAAA");

        JwtConfig otherConfig = jwtConfig("another-secret-key-that-is-also-long-enough");
        SecretKey otherKey = otherConfig.jwtSigningKey();
        TokenService foreign = new TokenService(otherConfig.jwtEncoder(otherKey), otherConfig.jwtDecoder(otherKey, clock), clock);
        ReflectionTestUtils.setField(foreign, "accessTokenExpiryMinutes", 30L);
        ReflectionTestUtils.setField(foreign, "refreshTokenExpiryDays", 7L);
        ReflectionTestUtils.setField(foreign, "issuer", "adaptiv-health");
        String foreignToken = foreign.issueSessionTokens(account).getAccessToken();

        assertTrue(tokenService.decode(tampered, TokenType.ACCESS).isFailure());
        assertTrue(tokenService.decode(foreignToken, TokenType.ACCESS).isFailure());
        assertTrue(tokenService.decode("not-a-jwt", TokenType.ACCESS).isFailure());
        assertTrue(tokenService.decode("", TokenType.ACCESS).isFailure());
    }

    @Test
    void shortSecretIsRejectedAtStartup() {
        JwtConfig config = jwtConfig("too-short");

        assertThrows(IllegalStateException.class, config::jwtSigningKey);
    }

    private static JwtConfig jwtConfig(String secret) {
        JwtConfig config = new JwtConfig();
        ReflectionTestUtils.setField(config, "secret", secret);
        ReflectionTestUtils.setField(config, "issuer", "adaptiv-health");
        return config;
    }
}
