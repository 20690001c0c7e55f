package com.adaptiv.healthservice.services.account;

import com.adaptiv.healthservice.dto.PageResponse;
import com.adaptiv.healthservice.dto.admin.AccountResponse;
import com.adaptiv.healthservice.dto.admin.ProvisionAccountRequest;
import com.adaptiv.healthservice.exceptions.ErrorCode;
import com.adaptiv.healthservice.exceptions.Outcome;
import com.adaptiv.healthservice.models.Account;
import com.adaptiv.healthservice.models.Credential;
import com.adaptiv.healthservice.models.Role;
import com.adaptiv.healthservice.models.SecurityAuditEvent.EventType;
import com.adaptiv.healthservice.repository.AccountRepository;
import com.adaptiv.healthservice.repository.CredentialRepository;
import com.adaptiv.healthservice.services.SecurityAuditService;
import com.adaptiv.healthservice.services.authentication.Authenticator;
import com.adaptiv.healthservice.services.authorization.AuthenticatedIdentity;
import com.adaptiv.healthservice.services.authorization.Authorizer;
import com.adaptiv.healthservice.services.consent.ConsentEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import static com.adaptiv.healthservice.services.SecurityAuditService.maskEmail;

/**
 * Account lifecycle. Accounts are created only by administrators and are never deleted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountService {

    public static final int MAX_PAGE_SIZE = 100;

    private final AccountRepository accountRepository;
    private final CredentialRepository credentialRepository;
    private final ConsentEngine consentEngine;
    private final PasswordEncoder passwordEncoder;
    private final Authorizer authorizer;
    private final SecurityAuditService auditService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Outcome<AccountResponse> currentAccount(AuthenticatedIdentity identity) {
        return authorizer.authorizeAuthenticated(identity, "account.me").map(AccountResponse::from);
    }

    @Transactional
    public Outcome<AccountResponse> provision(AuthenticatedIdentity identity, ProvisionAccountRequest request) {
        Outcome<Account> admin = authorizer.authorizeAdmin(identity, "account.provision");
        if (admin.isFailure()) {
            return admin.propagate();
        }

        Outcome<Account> created = createAccount(request.getEmail(), request.getPassword(), request.getFullName(),
                request.getRole());
        if (created.isSuccess()) {
            auditService.record(EventType.ACCOUNT_PROVISIONED, identity.getAccountId(),
                    created.getValue().getAccountId(), null, request.getRole().name());
        }
        return created.map(AccountResponse::from);
    }

    /**
     * Creates the account, its credential and, for patients, a consent record with sharing on.
     * Used by admin provisioning and by startup bootstrap.
     */
    @Transactional
    public Outcome<Account> createAccount(String email, String password, String fullName, Role role) {
        String normalizedEmail = Authenticator.normalizeEmail(email);
        if (accountRepository.existsByEmailIgnoreCase(normalizedEmail)) {
            log.warn("Provisioning rejected, email already registered: {}", maskEmail(normalizedEmail));
            return Outcome.failure(ErrorCode.EMAIL_ALREADY_REGISTERED);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        // Flushed here so a concurrent insert of the same email fails on the unique constraint now.
        Account account = accountRepository.saveAndFlush(Account.builder()
                .email(normalizedEmail)
                .fullName(fullName)
                .role(role)
                .active(true)
                .verified(true)
                .createdAt(now)
                .updatedAt(now)
                .build());

        credentialRepository.save(Credential.builder()
                .accountId(account.getAccountId())
                .passwordHash(passwordEncoder.encode(password))
                .failedAttempts(0)
                .passwordChangedAt(now)
                .build());

        if (role == Role.PATIENT) {
            consentEngine.createInitialRecord(account.getAccountId());
        }

        log.info("Provisioned {} account {} for {}", role, account.getAccountId(), maskEmail(normalizedEmail));
        return Outcome.success(account);
    }

    @Transactional(readOnly = true)
    public Outcome<PageResponse<AccountResponse>> list(AuthenticatedIdentity identity, int page, int perPage) {
        Outcome<Account> admin = authorizer.authorizeAdmin(identity, "account.list");
        if (admin.isFailure()) {
            return admin.propagate();
        }
        PageRequest pageable = PageRequest.of(Math.max(page, 1) - 1, Math.min(Math.max(perPage, 1), MAX_PAGE_SIZE),
                Sort.by(Sort.Direction.ASC, "createdAt"));
        return Outcome.success(PageResponse.from(accountRepository.findAll(pageable), AccountResponse::from));
    }

    /**
     * Soft delete. Administrators cannot deactivate themselves.
     */
    @Transactional
    public Outcome<AccountResponse> deactivate(AuthenticatedIdentity identity, UUID accountId) {
        Outcome<Account> admin = authorizer.authorizeAdmin(identity, "account.deactivate");
        if (admin.isFailure()) {
            return admin.propagate();
        }
        if (accountId.equals(identity.getAccountId())) {
            return Outcome.failure(ErrorCode.VALIDATION_FAILED, "You cannot deactivate your own account");
        }

        Optional<Account> target = accountRepository.findById(accountId);
        if (target.isEmpty()) {
            return Outcome.failure(ErrorCode.NOT_FOUND, "Account not found");
        }

        Account account = target.get();
        account.setActive(false);
        account.setUpdatedAt(LocalDateTime.now(clock));
        accountRepository.save(account);

        auditService.record(EventType.ACCOUNT_DEACTIVATED, identity.getAccountId(), accountId, null, null);
        log.info("Account {} deactivated by {}", accountId, identity.getAccountId());
        return Outcome.success(AccountResponse.from(account));
    }

    /**
     * Sets a new password on behalf of the user and lifts any lockout.
     */
    @Transactional
    public Outcome<AccountResponse> resetPassword(AuthenticatedIdentity identity, UUID accountId, String newPassword) {
        Outcome<Account> admin = authorizer.authorizeAdmin(identity, "account.reset_password");
        if (admin.isFailure()) {
            return admin.propagate();
        }

        Optional<Account> target = accountRepository.findById(accountId);
        Optional<Credential> credential = credentialRepository.findById(accountId);
        if (target.isEmpty() || credential.isEmpty()) {
            return Outcome.failure(ErrorCode.NOT_FOUND, "Account not found");
        }

        Credential updated = credential.get();
        updated.setPasswordHash(passwordEncoder.encode(newPassword));
        updated.setPasswordChangedAt(LocalDateTime.now(clock));
        updated.setFailedAttempts(0);
        updated.setLockoutExpiresAt(null);
        credentialRepository.save(updated);

        auditService.record(EventType.ADMIN_PASSWORD_RESET, identity.getAccountId(), accountId, null, null);
        log.info("Password for account {} reset by administrator {}", accountId, identity.getAccountId());
        return Outcome.success(AccountResponse.from(target.get()));
    }
}
