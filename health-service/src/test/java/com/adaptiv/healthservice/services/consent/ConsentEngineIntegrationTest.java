package com.adaptiv.healthservice.services.consent;

import com.adaptiv.healthservice.exceptions.ErrorCode;
import com.adaptiv.healthservice.exceptions.Outcome;
import com.adaptiv.healthservice.models.Account;
import com.adaptiv.healthservice.models.AlertRecord;
import com.adaptiv.healthservice.models.AlertType;
import com.adaptiv.healthservice.models.ConsentDecision;
import com.adaptiv.healthservice.models.ConsentRecord;
import com.adaptiv.healthservice.models.Severity;
import com.adaptiv.healthservice.models.ShareState;
import com.adaptiv.healthservice.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConsentEngineIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private ConsentEngine consentEngine;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private Account patient;
    private Account clinician;

    @BeforeEach
    void setUp() {
        patient = patient("pat@example.com");
        clinician = clinician("doc@example.com");
    }

    @Test
    void newPatientStartsWithSharingOn() {
        assertEquals(ShareState.ON, consentEngine.sharingState(patient.getAccountId()).orElseThrow());
        assertTrue(consentEngine.canAccess(patient.getAccountId()));
    }

    @Test
    void approvedRequestTurnsSharingOffAndEnableRestoresIt() {
        Outcome<ConsentRecord> requested = consentEngine.requestDisable(patient.getAccountId(), "Moving clinics");

        assertEquals(ShareState.DISABLE_REQUESTED, requested.getValue().getShareState());
        assertEquals(patient.getAccountId(), requested.getValue().getRequestedBy());
        assertTrue(consentEngine.canAccess(patient.getAccountId()));

        List<AlertRecord> alerts = alertRepository.findBySubjectIdAndAlertTypeOrderByCreatedAtAsc(
                patient.getAccountId(), AlertType.CONSENT_DISABLE_REQUEST);
        assertEquals(1, alerts.size());
        assertEquals(Severity.WARNING, alerts.get(0).getSeverity());
        assertTrue(alerts.get(0).getMessage().contains("Moving clinics"));

        Outcome<ConsentRecord> approved = consentEngine.review(clinician.getAccountId(), patient.getAccountId(),
                ConsentDecision.APPROVE, null);

        assertEquals(ShareState.OFF, approved.getValue().getShareState());
        assertEquals(clinician.getAccountId(), approved.getValue().getReviewedBy());
        assertEquals(ConsentDecision.APPROVE, approved.getValue().getDecision());
        assertEquals("Moving clinics", approved.getValue().getReason());
        assertFalse(consentEngine.canAccess(patient.getAccountId()));

        Outcome<ConsentRecord> enabled = consentEngine.enable(patient.getAccountId());

        assertEquals(ShareState.ON, enabled.getValue().getShareState());
        assertNull(enabled.getValue().getDecision());
        assertNull(enabled.getValue().getReason());
        assertTrue(consentEngine.canAccess(patient.getAccountId()));
    }

    @Test
    void rejectedRequestKeepsSharingOn() {
        consentEngine.requestDisable(patient.getAccountId(), "Privacy");

        Outcome<ConsentRecord> rejected = consentEngine.review(clinician.getAccountId(), patient.getAccountId(),
                ConsentDecision.REJECT, "Active monitoring required");

        assertEquals(ShareState.ON, rejected.getValue().getShareState());
        assertEquals(ConsentDecision.REJECT, rejected.getValue().getDecision());
        assertEquals("Active monitoring required", rejected.getValue().getReason());
        assertNull(rejected.getValue().getRequestedAt());
        assertTrue(consentEngine.pendingRequests().isEmpty());
    }

    @Test
    void secondRequestWhilePendingIsRejected() {
        consentEngine.requestDisable(patient.getAccountId(), null);

        assertEquals(ErrorCode.CONFLICT_ALREADY_PENDING,
                consentEngine.requestDisable(patient.getAccountId(), null).getError());
        assertEquals(1, consentEngine.pendingRequests().size());
    }

    @Test
    void invalidTransitionsAreRejected() {
        assertEquals(ErrorCode.CONFLICT_INVALID_TRANSITION, consentEngine.enable(patient.getAccountId()).getError());
        assertEquals(ErrorCode.CONFLICT_INVALID_TRANSITION, consentEngine.review(clinician.getAccountId(),
                patient.getAccountId(), ConsentDecision.APPROVE, null).getError());

        consentEngine.requestDisable(patient.getAccountId(), null);
        consentEngine.review(clinician.getAccountId(), patient.getAccountId(), ConsentDecision.APPROVE, null);

        assertEquals(ErrorCode.CONFLICT_INVALID_TRANSITION,
                consentEngine.requestDisable(patient.getAccountId(), null).getError());
    }

    @Test
    void pendingRequestCanBeWithdrawn() {
        consentEngine.requestDisable(patient.getAccountId(), "Second thoughts");

        assertEquals(ShareState.ON, consentEngine.enable(patient.getAccountId()).getValue().getShareState());
        assertTrue(consentEngine.pendingRequests().isEmpty());
    }

    @Test
    void reviewOfUnknownPatientIsNotFound() {
        assertEquals(ErrorCode.NOT_FOUND, consentEngine.review(clinician.getAccountId(), clinician.getAccountId(),
                ConsentDecision.APPROVE, null).getError());
    }

    @Test
    void conditionalUpdateOnlyAppliesFromExpectedState() {
        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        LocalDateTime now = LocalDateTime.now(clock);

        Integer first = tx.execute(status -> consentRepository.markDisableRequested(patient.getAccountId(), null, now));
        Integer second = tx.execute(status -> consentRepository.markDisableRequested(patient.getAccountId(), null, now));
        Integer staleEnable = tx.execute(status -> consentRepository.enableSharing(
                patient.getAccountId(), ShareState.OFF, now));

        assertEquals(1, first);
        assertEquals(0, second);
        assertEquals(0, staleEnable);
        assertEquals(ShareState.DISABLE_REQUESTED, consentEngine.sharingState(patient.getAccountId()).orElseThrow());
    }
}
