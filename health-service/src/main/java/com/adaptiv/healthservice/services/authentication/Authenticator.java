package com.adaptiv.healthservice.services.authentication;

import com.adaptiv.healthservice.exceptions.ErrorCode;
import com.adaptiv.healthservice.exceptions.Outcome;
import com.adaptiv.healthservice.models.Account;
import com.adaptiv.healthservice.models.Credential;
import com.adaptiv.healthservice.models.SecurityAuditEvent.EventType;
import com.adaptiv.healthservice.repository.AccountRepository;
import com.adaptiv.healthservice.repository.CredentialRepository;
import com.adaptiv.healthservice.services.IssuedTokens;
import com.adaptiv.healthservice.services.SecurityAuditService;
import com.adaptiv.healthservice.services.TokenService;
import com.adaptiv.healthservice.services.TokenType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import static com.adaptiv.healthservice.services.SecurityAuditService.maskEmail;

@Service
@RequiredArgsConstructor
@Slf4j
public class Authenticator {

    private final AccountRepository accountRepository;
    private final CredentialRepository credentialRepository;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokenService;
    private final AccountLockoutService lockoutService;
    private final SecurityAuditService auditService;
    private final Clock clock;

    // Compared against when the email is unknown so both paths cost one hash check.
    private String dummyHash;

    @PostConstruct
    void initDummyHash() {
        dummyHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    /**
     * Checks are applied in order: lookup, active, lockout, password.
     * Unknown email and wrong password produce the same code and message.
     * The credential row stays locked until commit, so concurrent attempts on one
     * account are decided one after another against the latest counter.
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public Outcome<IssuedTokens> authenticate(String email, String password) {
        String normalizedEmail = normalizeEmail(email);

        Optional<Account> found = accountRepository.findByEmailIgnoreCase(normalizedEmail);
        if (found.isEmpty()) {
            passwordEncoder.matches(password, dummyHash);
            log.warn("Login failed for unknown email: {}", maskEmail(normalizedEmail));
            auditService.record(EventType.LOGIN_FAILED, null, null, ErrorCode.INVALID_CREDENTIALS.name(), "Unknown email");
            return Outcome.failure(ErrorCode.INVALID_CREDENTIALS);
        }

        Account account = found.get();
        UUID accountId = account.getAccountId();

        if (!account.isActive()) {
            log.warn("Login attempted for inactive account: {}", accountId);
            auditService.record(EventType.LOGIN_FAILED, accountId, accountId, ErrorCode.ACCOUNT_INACTIVE.name(), null);
            return Outcome.failure(ErrorCode.ACCOUNT_INACTIVE);
        }

        Credential credential = credentialRepository.findByIdForUpdate(accountId).orElse(null);
        if (credential == null) {
            passwordEncoder.matches(password, dummyHash);
            log.error("Account {} has no credential row", accountId);
            return Outcome.failure(ErrorCode.INVALID_CREDENTIALS);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Optional<Duration> remaining = lockoutService.remainingLockout(credential, now);
        if (remaining.isPresent()) {
            log.warn("Login attempted for locked account: {}. Unlock in {} seconds", accountId, remaining.get().getSeconds());
            auditService.record(EventType.LOGIN_FAILED, accountId, accountId, ErrorCode.ACCOUNT_LOCKED.name(), null);
            return Outcome.locked(remaining.get());
        }

        if (!passwordEncoder.matches(password, credential.getPasswordHash())) {
            AccountLockoutService.FailedAttempt attempt =
                    lockoutService.recordFailedAttempt(accountId, credential.getFailedAttempts());
            auditService.record(EventType.LOGIN_FAILED, accountId, accountId, ErrorCode.INVALID_CREDENTIALS.name(),
                    "Failed attempts: " + attempt.getFailedAttempts());
            if (attempt.isLocked()) {
                log.warn("Account {} locked until {}", accountId, attempt.getLockoutExpiresAt());
                auditService.record(EventType.ACCOUNT_LOCKED, accountId, accountId, ErrorCode.ACCOUNT_LOCKED.name(),
                        "Locked until " + attempt.getLockoutExpiresAt());
            }
            return Outcome.failure(ErrorCode.INVALID_CREDENTIALS);
        }

        if (credential.getFailedAttempts() > 0 || credential.getLockoutExpiresAt() != null) {
            lockoutService.clearLockout(accountId);
        }

        account.setLastLoginAt(now);
        accountRepository.save(account);

        auditService.record(EventType.LOGIN_SUCCEEDED, accountId, accountId, null, null);
        log.info("Account {} logged in successfully", accountId);
        return Outcome.success(tokenService.issueSessionTokens(account));
    }

    /**
     * New token pair from a refresh token. Lockout is not consulted; a missing or
     * deactivated account is.
     */
    @Transactional(readOnly = true)
    public Outcome<IssuedTokens> refresh(String refreshToken) {
        Outcome<Jwt> decoded = tokenService.decode(refreshToken, TokenType.REFRESH);
        if (decoded.isFailure()) {
            return decoded.propagate();
        }

        UUID accountId = TokenService.parseSubject(decoded.getValue());
        Optional<Account> account = accountRepository.findById(accountId);
        if (account.isEmpty()) {
            log.warn("Refresh token presented for missing account: {}", accountId);
            return Outcome.failure(ErrorCode.TOKEN_INVALID);
        }
        if (!account.get().isActive()) {
            log.warn("Refresh token presented for inactive account: {}", accountId);
            return Outcome.failure(ErrorCode.ACCOUNT_INACTIVE);
        }

        auditService.record(EventType.TOKEN_REFRESHED, accountId, accountId, null, null);
        return Outcome.success(tokenService.issueSessionTokens(account.get()));
    }

    public static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
