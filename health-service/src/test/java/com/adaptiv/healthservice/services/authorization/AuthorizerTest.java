package com.adaptiv.healthservice.services.authorization;

import com.adaptiv.healthservice.exceptions.ErrorCode;
import com.adaptiv.healthservice.exceptions.Outcome;
import com.adaptiv.healthservice.models.Account;
import com.adaptiv.healthservice.models.Role;
import com.adaptiv.healthservice.models.ShareState;
import com.adaptiv.healthservice.repository.AccountRepository;
import com.adaptiv.healthservice.services.SecurityAuditService;
import com.adaptiv.healthservice.services.consent.ConsentEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthorizerTest {

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private ConsentEngine consentEngine;

    @Mock
    private SecurityAuditService auditService;

    private Authorizer authorizer;

    private Account patient;
    private Account clinician;
    private Account admin;

    @BeforeEach
    void setUp() {
        authorizer = new Authorizer(accountRepository, new Guards(consentEngine), auditService);
        patient = account(Role.PATIENT);
        clinician = account(Role.CLINICIAN);
        admin = account(Role.ADMIN);
    }

    @Test
    void adminIsExcludedFromPatientDataRegardlessOfConsent() {
        stub(admin);

        Outcome<Account> outcome = authorizer.authorizePhiAccess(identity(admin), patient.getAccountId(), "vitals.latest");

        assertEquals(ErrorCode.FORBIDDEN_ADMIN_EXCLUDED, outcome.getError());
        verify(auditService).recordDenial(admin.getAccountId(), patient.getAccountId(),
                ErrorCode.FORBIDDEN_ADMIN_EXCLUDED, "vitals.latest");
    }

    @Test
    void patientAlwaysReadsOwnDataEvenWithSharingOff() {
        stub(patient);

        Outcome<Account> outcome = authorizer.authorizePhiAccess(identity(patient), patient.getAccountId(), "vitals.latest");

        assertTrue(outcome.isSuccess());
        verify(auditService, never()).recordDenial(any(), any(), any(), anyString());
    }

    @Test
    void clinicianBlockedOnlyWhenSharingOff() {
        stub(clinician);
        when(consentEngine.sharingState(patient.getAccountId())).thenReturn(Optional.of(ShareState.OFF));

        Outcome<Account> outcome = authorizer.authorizePhiAccess(identity(clinician), patient.getAccountId(), "vitals.latest");

        assertEquals(ErrorCode.FORBIDDEN_CONSENT, outcome.getError());
        assertEquals(403, outcome.getError().getStatus().value());
    }

    @Test
    void clinicianAllowedWhileSharingOn() {
        stub(clinician);
        when(consentEngine.sharingState(patient.getAccountId())).thenReturn(Optional.of(ShareState.ON));

        assertTrue(authorizer.authorizePhiAccess(identity(clinician), patient.getAccountId(), "vitals.latest").isSuccess());
    }

    @Test
    void patientCannotReadAnotherPatient() {
        stub(patient);
        UUID otherPatient = UUID.randomUUID();

        Outcome<Account> outcome = authorizer.authorizePhiAccess(identity(patient), otherPatient, "vitals.latest");

        assertEquals(ErrorCode.FORBIDDEN_ROLE, outcome.getError());
    }

    @Test
    void adminOperationsRequireAdmin() {
        stub(clinician);

        assertEquals(ErrorCode.FORBIDDEN_ROLE, authorizer.authorizeAdmin(identity(clinician), "account.list").getError());
    }

    @Test
    void adminCannotSubmitOwnVitals() {
        stub(admin);

        assertEquals(ErrorCode.FORBIDDEN_ADMIN_EXCLUDED,
                authorizer.authorizeOwnClinicalData(identity(admin), "vitals.submit").getError());
    }

    @Test
    void unknownIdentityIsTreatedAsInvalidToken() {
        UUID ghost = UUID.randomUUID();
        when(accountRepository.findById(ghost)).thenReturn(Optional.empty());

        Outcome<Account> outcome = authorizer.authorizeAuthenticated(new AuthenticatedIdentity(ghost, Role.PATIENT), "me");

        assertEquals(ErrorCode.TOKEN_INVALID, outcome.getError());
        verify(auditService).recordDenial(eq(ghost), eq(null), eq(ErrorCode.TOKEN_INVALID), eq("me"));
    }

    @Test
    void missingIdentityIsInvalidToken() {
        assertEquals(ErrorCode.TOKEN_INVALID, authorizer.authorizeAuthenticated(null, "me").getError());
    }

    private void stub(Account account) {
        when(accountRepository.findById(account.getAccountId())).thenReturn(Optional.of(account));
    }

    private static AuthenticatedIdentity identity(Account account) {
        return new AuthenticatedIdentity(account.getAccountId(), account.getRole());
    }

    private static Account account(Role role) {
        return Account.builder().accountId(UUID.randomUUID()).email(role + "@example.com").role(role).active(true).build();
    }
}
