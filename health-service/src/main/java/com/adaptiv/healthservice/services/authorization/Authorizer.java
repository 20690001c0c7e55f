package com.adaptiv.healthservice.services.authorization;

import com.adaptiv.healthservice.exceptions.ErrorCode;
import com.adaptiv.healthservice.exceptions.Outcome;
import com.adaptiv.healthservice.models.Account;
import com.adaptiv.healthservice.repository.AccountRepository;
import com.adaptiv.healthservice.services.SecurityAuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Resolves the calling account and runs it through a guard chain.
 * Every denial is logged and audited with actor, target and reason code.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Authorizer {

    private final AccountRepository accountRepository;
    private final Guards guards;
    private final SecurityAuditService auditService;

    public Outcome<Account> authorize(AuthenticatedIdentity identity, UUID targetId, String operation, Guard guard) {
        if (identity == null) {
            return Outcome.failure(ErrorCode.TOKEN_INVALID);
        }

        Optional<Account> actor = accountRepository.findById(identity.getAccountId());
        if (actor.isEmpty()) {
            auditService.recordDenial(identity.getAccountId(), targetId, ErrorCode.TOKEN_INVALID, operation);
            return Outcome.failure(ErrorCode.TOKEN_INVALID);
        }

        AccessDecision decision = guard.evaluate(new AccessRequest(actor.get(), targetId, operation));
        if (!decision.isPermitted()) {
            auditService.recordDenial(identity.getAccountId(), targetId, decision.getReason(), operation);
            return Outcome.failure(decision.getReason(), decision.getMessage());
        }
        return Outcome.success(actor.get());
    }

    public Outcome<Account> authorizeAuthenticated(AuthenticatedIdentity identity, String operation) {
        return authorize(identity, null, operation, guards.anyAuthenticated());
    }

    /**
     * Clinical operations on the caller's own data.
     */
    public Outcome<Account> authorizeOwnClinicalData(AuthenticatedIdentity identity, String operation) {
        return authorize(identity, null, operation, guards.anyAuthenticated().and(guards.excludeAdmin()));
    }

    public Outcome<Account> authorizePatient(AuthenticatedIdentity identity, String operation) {
        return authorize(identity, null, operation, guards.anyAuthenticated().and(guards.requirePatient()));
    }

    public Outcome<Account> authorizeAdmin(AuthenticatedIdentity identity, String operation) {
        return authorize(identity, null, operation, guards.anyAuthenticated().and(guards.requireAdmin()));
    }

    public Outcome<Account> authorizeClinician(AuthenticatedIdentity identity, String operation) {
        return authorize(identity, null, operation, guards.anyAuthenticated().and(guards.requireClinician()));
    }

    /**
     * Reading a patient's clinical data: the patient themselves, or a clinician while sharing is on.
     */
    public Outcome<Account> authorizePhiAccess(AuthenticatedIdentity identity, UUID patientId, String operation) {
        Guard guard = guards.anyAuthenticated()
                .and(guards.excludeAdmin())
                .and(guards.selfOr(guards.requireClinician().and(guards.consentGranted())));
        return authorize(identity, patientId, operation, guard);
    }

    /**
     * Clinician-only actions on a patient's data, such as resolving an alert.
     */
    public Outcome<Account> authorizeClinicianFor(AuthenticatedIdentity identity, UUID patientId, String operation) {
        Guard guard = guards.anyAuthenticated()
                .and(guards.requireClinician())
                .and(guards.consentGranted());
        return authorize(identity, patientId, operation, guard);
    }
}
