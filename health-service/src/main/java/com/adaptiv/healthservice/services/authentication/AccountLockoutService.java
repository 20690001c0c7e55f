package com.adaptiv.healthservice.services.authentication;

import com.adaptiv.healthservice.models.Credential;
import com.adaptiv.healthservice.repository.CredentialRepository;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Brute-force protection backed by the credential row.
 * Three failed password checks lock the account for fifteen minutes. Neither value is configurable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountLockoutService {

    public static final int MAX_FAILED_ATTEMPTS = 3;
    public static final Duration LOCKOUT_DURATION = Duration.ofMinutes(15);

    private static final int MAX_UPDATE_RETRIES = 5;

    private final CredentialRepository credentialRepository;
    private final Clock clock;

    public Optional<Duration> remainingLockout(Credential credential, LocalDateTime now) {
        if (!credential.isLockedAt(now)) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(now, credential.getLockoutExpiresAt()));
    }

    /**
     * Increments the counter with a compare-and-set, re-reading and retrying when a
     * concurrent request moved it first. Once the counter reaches the limit the
     * lockout expiry is (re)set to now plus {@link #LOCKOUT_DURATION}.
     */
    public FailedAttempt recordFailedAttempt(UUID accountId, int observedAttempts) {
        int expected = observedAttempts;

        for (int attempt = 0; attempt < MAX_UPDATE_RETRIES; attempt++) {
            int next = expected + 1;
            LocalDateTime lockoutUntil = next >= MAX_FAILED_ATTEMPTS
                    ? LocalDateTime.now(clock).plus(LOCKOUT_DURATION)
                    : null;

            if (credentialRepository.compareAndSetFailedAttempts(accountId, expected, next, lockoutUntil) == 1) {
                log.warn("Failed login attempt {} for account: {}", next, accountId);
                return new FailedAttempt(next, lockoutUntil);
            }

            expected = credentialRepository.findFailedAttempts(accountId)
                    .orElseThrow(() -> new IllegalStateException("Credential disappeared for account " + accountId));
            log.debug("Failure counter for account {} moved concurrently, retrying from {}", accountId, expected);
        }

        throw new OptimisticLockingFailureException(
                "Could not record failed attempt for account " + accountId + " after " + MAX_UPDATE_RETRIES + " tries");
    }

    public void clearLockout(UUID accountId) {
        credentialRepository.clearLockout(accountId);
    }

    @Value
    public static class FailedAttempt {
        int failedAttempts;
        LocalDateTime lockoutExpiresAt;

        public boolean isLocked() {
            return lockoutExpiresAt != null;
        }
    }
}
