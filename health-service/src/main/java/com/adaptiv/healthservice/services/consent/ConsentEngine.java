package com.adaptiv.healthservice.services.consent;

import com.adaptiv.healthservice.exceptions.ErrorCode;
import com.adaptiv.healthservice.exceptions.Outcome;
import com.adaptiv.healthservice.models.ConsentDecision;
import com.adaptiv.healthservice.models.ConsentRecord;
import com.adaptiv.healthservice.models.SecurityAuditEvent.EventType;
import com.adaptiv.healthservice.models.ShareState;
import com.adaptiv.healthservice.repository.ConsentRecordRepository;
import com.adaptiv.healthservice.services.SecurityAuditService;
import com.adaptiv.healthservice.services.alerts.AlertEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Patient-controlled data sharing.
 * <pre>
 *   ON --disable--> DISABLE_REQUESTED --approve--> OFF --enable--> ON
 *                   DISABLE_REQUESTED --reject---> ON
 *                   DISABLE_REQUESTED --enable---> ON   (patient withdraws the request)
 * </pre>
 * Each transition is a conditional update on the state it was decided from; losing a
 * race yields {@link ErrorCode#CONFLICT_STALE_STATE} instead of overwriting.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConsentEngine {

    private final ConsentRecordRepository consentRepository;
    private final AlertEngine alertEngine;
    private final SecurityAuditService auditService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<ShareState> sharingState(UUID patientId) {
        return consentRepository.findById(patientId).map(ConsentRecord::getShareState);
    }

    /**
     * Clinicians keep access while a disable request is pending; only OFF blocks them.
     */
    @Transactional(readOnly = true)
    public boolean canAccess(UUID patientId) {
        return sharingState(patientId).map(ShareState::permitsClinicianAccess).orElse(false);
    }

    @Transactional(readOnly = true)
    public Outcome<ConsentRecord> status(UUID patientId) {
        return consentRepository.findById(patientId)
                .map(Outcome::success)
                .orElseGet(() -> Outcome.failure(ErrorCode.NOT_FOUND, "Consent record not found"));
    }

    @Transactional(readOnly = true)
    public List<ConsentRecord> pendingRequests() {
        return consentRepository.findByShareStateOrderByRequestedAtAsc(ShareState.DISABLE_REQUESTED);
    }

    @Transactional
    public ConsentRecord createInitialRecord(UUID patientId) {
        return consentRepository.save(ConsentRecord.builder()
                .patientId(patientId)
                .shareState(ShareState.ON)
                .updatedAt(LocalDateTime.now(clock))
                .build());
    }

    /**
     * Patient asks to stop sharing. Raises a warning alert for clinicians in the same transaction.
     */
    @Transactional
    public Outcome<ConsentRecord> requestDisable(UUID patientId, String reason) {
        Optional<ConsentRecord> current = consentRepository.findById(patientId);
        if (current.isEmpty()) {
            return Outcome.failure(ErrorCode.NOT_FOUND, "Consent record not found");
        }

        ShareState state = current.get().getShareState();
        if (state == ShareState.DISABLE_REQUESTED) {
            return Outcome.failure(ErrorCode.CONFLICT_ALREADY_PENDING);
        }
        if (state == ShareState.OFF) {
            return Outcome.failure(ErrorCode.CONFLICT_INVALID_TRANSITION, "Data sharing is already disabled");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (consentRepository.markDisableRequested(patientId, reason, now) == 0) {
            return staleState(patientId, "request disable");
        }

        alertEngine.raiseConsentDisableRequest(patientId, reason);
        recordTransition(patientId, patientId, ShareState.ON, ShareState.DISABLE_REQUESTED);
        return reload(patientId);
    }

    /**
     * Patient turns sharing back on, from OFF or by withdrawing a pending request.
     * All request and review metadata is cleared.
     */
    @Transactional
    public Outcome<ConsentRecord> enable(UUID patientId) {
        Optional<ConsentRecord> current = consentRepository.findById(patientId);
        if (current.isEmpty()) {
            return Outcome.failure(ErrorCode.NOT_FOUND, "Consent record not found");
        }

        ShareState state = current.get().getShareState();
        if (state == ShareState.ON) {
            return Outcome.failure(ErrorCode.CONFLICT_INVALID_TRANSITION, "Data sharing is already enabled");
        }

        if (consentRepository.enableSharing(patientId, state, LocalDateTime.now(clock)) == 0) {
            return staleState(patientId, "enable");
        }

        recordTransition(patientId, patientId, state, ShareState.ON);
        return reload(patientId);
    }

    /**
     * Clinician decision on a pending request. A non-blank reason replaces the stored one.
     */
    @Transactional
    public Outcome<ConsentRecord> review(UUID reviewerId, UUID patientId, ConsentDecision decision, String reason) {
        Optional<ConsentRecord> current = consentRepository.findById(patientId);
        if (current.isEmpty()) {
            return Outcome.failure(ErrorCode.NOT_FOUND, "Patient not found");
        }
        if (current.get().getShareState() != ShareState.DISABLE_REQUESTED) {
            return Outcome.failure(ErrorCode.CONFLICT_INVALID_TRANSITION, "No pending disable request for this patient");
        }

        String newReason = reason == null || reason.isBlank() ? null : reason;
        LocalDateTime now = LocalDateTime.now(clock);
        int updated;
        ShareState target;
        switch (decision) {
            case APPROVE -> {
                updated = consentRepository.approveDisable(patientId, reviewerId, newReason, now);
                target = ShareState.OFF;
            }
            case REJECT -> {
                updated = consentRepository.rejectDisable(patientId, reviewerId, newReason, now);
                target = ShareState.ON;
            }
            default -> throw new IllegalArgumentException("Unknown decision " + decision);
        }

        if (updated == 0) {
            return staleState(patientId, "review");
        }

        recordTransition(reviewerId, patientId, ShareState.DISABLE_REQUESTED, target);
        return reload(patientId);
    }

    private Outcome<ConsentRecord> reload(UUID patientId) {
        return consentRepository.findById(patientId)
                .map(Outcome::success)
                .orElseGet(() -> Outcome.failure(ErrorCode.NOT_FOUND, "Consent record not found"));
    }

    private Outcome<ConsentRecord> staleState(UUID patientId, String operation) {
        log.warn("Consent for patient {} changed concurrently during {}", patientId, operation);
        return Outcome.failure(ErrorCode.CONFLICT_STALE_STATE);
    }

    private void recordTransition(UUID actorId, UUID patientId, ShareState from, ShareState to) {
        log.info("Consent for patient {} moved {} -> {} by {}", patientId, from, to, actorId);
        auditService.record(EventType.CONSENT_CHANGED, actorId, patientId, null, from + "->" + to);
    }
}
