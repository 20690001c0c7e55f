package com.adaptiv.healthservice.services.authentication;

import com.adaptiv.healthservice.exceptions.ErrorCode;
import com.adaptiv.healthservice.exceptions.Outcome;
import com.adaptiv.healthservice.models.Account;
import com.adaptiv.healthservice.models.Credential;
import com.adaptiv.healthservice.models.SecurityAuditEvent.EventType;
import com.adaptiv.healthservice.repository.AccountRepository;
import com.adaptiv.healthservice.repository.CredentialRepository;
import com.adaptiv.healthservice.services.PasswordFingerprint;
import com.adaptiv.healthservice.services.SecurityAuditService;
import com.adaptiv.healthservice.services.TokenService;
import com.adaptiv.healthservice.services.TokenType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import static com.adaptiv.healthservice.services.SecurityAuditService.maskEmail;

@Service
@RequiredArgsConstructor
@Slf4j
public class PasswordResetService {

    private final AccountRepository accountRepository;
    private final CredentialRepository credentialRepository;
    private final PasswordEncoder passwordEncoder;
    private final PasswordFingerprint passwordFingerprint;
    private final TokenService tokenService;
    private final PasswordResetDelivery delivery;
    private final SecurityAuditService auditService;
    private final Clock clock;

    /**
     * Always succeeds. A token is only issued and delivered when the email belongs to an active account.
     */
    @Transactional(readOnly = true)
    public Outcome<Void> requestReset(String email) {
        String normalizedEmail = Authenticator.normalizeEmail(email);
        Optional<Account> account = accountRepository.findByEmailIgnoreCase(normalizedEmail)
                .filter(Account::isActive);
        Optional<Credential> credential = account.flatMap(a -> credentialRepository.findById(a.getAccountId()));

        if (account.isEmpty() || credential.isEmpty()) {
            log.info("Password reset requested for unknown or inactive email: {}", maskEmail(normalizedEmail));
            auditService.record(EventType.PASSWORD_RESET_REQUESTED, null, null, null, "No matching active account");
            return Outcome.success(null);
        }

        String fingerprint = passwordFingerprint.of(credential.get().getPasswordHash());
        String token = tokenService.issuePasswordResetToken(account.get(), fingerprint);
        delivery.deliver(account.get(), token);

        auditService.record(EventType.PASSWORD_RESET_REQUESTED, account.get().getAccountId(),
                account.get().getAccountId(), null, null);
        return Outcome.success(null);
    }

    /**
     * Sets the new password and clears any lockout. The token must be of the
     * password reset type and issued against the current password.
     */
    @Transactional(isolation = Isolation.SERIALIZABLE)
    public Outcome<Void> confirmReset(String resetToken, String newPassword) {
        Outcome<Jwt> decoded = tokenService.decode(resetToken, TokenType.PASSWORD_RESET);
        if (decoded.isFailure()) {
            return decoded.propagate();
        }

        UUID accountId = TokenService.parseSubject(decoded.getValue());
        Optional<Credential> found = credentialRepository.findByIdForUpdate(accountId);
        if (found.isEmpty()) {
            log.warn("Reset token presented for account without credential: {}", accountId);
            return Outcome.failure(ErrorCode.TOKEN_INVALID);
        }

        Credential credential = found.get();
        String fingerprint = decoded.getValue().getClaimAsString(TokenService.CLAIM_PASSWORD_FINGERPRINT);
        if (!passwordFingerprint.matches(credential.getPasswordHash(), fingerprint)) {
            log.warn("Reset token for account {} was already used or superseded", accountId);
            return Outcome.failure(ErrorCode.TOKEN_INVALID);
        }

        credential.setPasswordHash(passwordEncoder.encode(newPassword));
        credential.setPasswordChangedAt(LocalDateTime.now(clock));
        credential.setFailedAttempts(0);
        credential.setLockoutExpiresAt(null);
        credentialRepository.save(credential);

        auditService.record(EventType.PASSWORD_RESET_COMPLETED, accountId, accountId, null, null);
        log.info("Password reset completed for account: {}", accountId);
        return Outcome.success(null);
    }
}
